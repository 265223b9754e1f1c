package com.tennis.rating.service;

import com.tennis.rating.engine.Evaluator;
import com.tennis.rating.engine.Fixtures;
import com.tennis.rating.engine.RatingRunner;
import com.tennis.rating.engine.TemporalSplitter;
import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.exception.ResourceNotFoundException;
import com.tennis.rating.export.RankingsExporter;
import com.tennis.rating.feed.MatchFeed;
import com.tennis.rating.feed.MatchFeedResult;
import com.tennis.rating.model.EvaluationRunDocument;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.RunResult;
import com.tennis.rating.repository.EvaluationRunRepository;
import com.tennis.rating.repository.PlayerRatingRepository;
import com.tennis.rating.repository.PredictionResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RatingRunServiceTest {

    MatchFeed matchFeed;
    RankingsExporter exporter;
    PlayerRatingRepository playerRatingRepository;
    EvaluationRunRepository evaluationRunRepository;
    PredictionResultRepository predictionResultRepository;

    RatingRunService service;

    @BeforeEach
    void setUp() {
        matchFeed = mock(MatchFeed.class);
        exporter = mock(RankingsExporter.class);
        playerRatingRepository = mock(PlayerRatingRepository.class);
        evaluationRunRepository = mock(EvaluationRunRepository.class);
        predictionResultRepository = mock(PredictionResultRepository.class);

        TemporalSplitter splitter = new TemporalSplitter();
        service = new RatingRunService(
                matchFeed,
                new RatingRunner(Fixtures.model(), splitter, new Evaluator(10)),
                splitter,
                exporter,
                playerRatingRepository,
                evaluationRunRepository,
                predictionResultRepository
        );
    }

    @Test
    void run_loadsRatesAndExports() {
        List<Match> matches = List.of(
                Fixtures.tourMatch("m1", LocalDate.of(2017, 2, 1), "a", "b", "a"),
                Fixtures.tourMatch("m2", LocalDate.of(2019, 2, 1), "a", "b", "b"));
        Map<String, String> names = Map.of("a", "Ann", "b", "Bea");
        when(matchFeed.load(2017, 2019)).thenReturn(new MatchFeedResult(matches, names, 3));

        RatingRunService.RunSummary summary = service.run(2017, 2019, 1);

        assertNotNull(summary.runId());
        assertEquals(1, summary.fitMatches());
        assertEquals(1, summary.evaluatedMatches());
        assertEquals(3, summary.skippedRecords());
        assertEquals(2, summary.playersRated());
        assertEquals(0.0, summary.accuracy());

        ArgumentCaptor<RunResult> result = ArgumentCaptor.forClass(RunResult.class);
        verify(exporter).export(eq(summary.runId()), result.capture(), eq(names));
        assertEquals(2019, result.getValue().config().yearTo());
    }

    @Test
    void invalidConfig_failsBeforeLoadingMatches() {
        assertThrows(ConfigurationException.class, () -> service.run(2010, 2020, 12));

        verifyNoInteractions(matchFeed);
        verifyNoInteractions(exporter);
    }

    @Test
    void unknownPlayer_isNotFound() {
        when(playerRatingRepository.findByPlayerKey("nobody")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.getPlayer("nobody"));
    }

    @Test
    void predictionsOfUnknownRun_areNotFound() {
        when(evaluationRunRepository.findByRunId("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.getPredictions("missing"));
        verifyNoInteractions(predictionResultRepository);
    }

    @Test
    void predictionsOfKnownRun_areReturnedInDateOrder() {
        when(evaluationRunRepository.findByRunId("r1")).thenReturn(Optional.of(new EvaluationRunDocument()));
        when(predictionResultRepository.findByRunIdOrderByMatchDateAsc("r1")).thenReturn(List.of());

        assertTrue(service.getPredictions("r1").isEmpty());
        verify(predictionResultRepository).findByRunIdOrderByMatchDateAsc("r1");
    }

    @Test
    void leaderboard_usesMinimumMatchesFilterWhenGiven() {
        service.getLeaderboard(20, 0);
        verify(playerRatingRepository).findAllByOrderByRankAsc(any());

        service.getLeaderboard(20, 10);
        verify(playerRatingRepository).findByMinMatchesPlayed(eq(10), any());
    }
}
