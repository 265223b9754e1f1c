package com.tennis.rating.export;

import com.tennis.rating.engine.Evaluator;
import com.tennis.rating.engine.Fixtures;
import com.tennis.rating.engine.RatingRunner;
import com.tennis.rating.engine.TemporalSplitter;
import com.tennis.rating.model.EvaluationRunDocument;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.PlayerRating;
import com.tennis.rating.model.PlayerRatingDocument;
import com.tennis.rating.model.PredictionResultDocument;
import com.tennis.rating.model.RunConfig;
import com.tennis.rating.model.RunResult;
import com.tennis.rating.repository.EvaluationRunRepository;
import com.tennis.rating.repository.PlayerRatingRepository;
import com.tennis.rating.repository.PredictionResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MongoRankingsExporterTest {

    PlayerRatingRepository playerRatingRepository;
    EvaluationRunRepository evaluationRunRepository;
    PredictionResultRepository predictionResultRepository;
    MongoRankingsExporter exporter;

    @BeforeEach
    void setUp() {
        playerRatingRepository = mock(PlayerRatingRepository.class);
        evaluationRunRepository = mock(EvaluationRunRepository.class);
        predictionResultRepository = mock(PredictionResultRepository.class);
        exporter = new MongoRankingsExporter(playerRatingRepository, evaluationRunRepository, predictionResultRepository);
    }

    private static RunResult smallRun() {
        List<Match> matches = List.of(
                Fixtures.tourMatch("m1", LocalDate.of(2017, 2, 1), "a", "b", "a"),
                Fixtures.tourMatch("m2", LocalDate.of(2017, 6, 1), "b", "c", "c"),
                Fixtures.tourMatch("m3", LocalDate.of(2019, 2, 1), "a", "c", "a"),
                Fixtures.tourMatch("m4", LocalDate.of(2019, 3, 1), "b", "c", "b"));
        return new RatingRunner(Fixtures.model(), new TemporalSplitter(), new Evaluator(10))
                .run(new RunConfig(2017, 2019, 1), matches);
    }

    @Test
    @SuppressWarnings("unchecked")
    void export_replacesRankingsAndAppendsRun() {
        RunResult result = smallRun();

        exporter.export("run-1", result, Map.of("a", "Player A", "c", "Player C"));

        InOrder order = inOrder(playerRatingRepository);
        order.verify(playerRatingRepository).deleteAll();
        ArgumentCaptor<List<PlayerRatingDocument>> ratings = ArgumentCaptor.forClass(List.class);
        order.verify(playerRatingRepository).saveAll(ratings.capture());

        List<PlayerRatingDocument> saved = ratings.getValue();
        assertEquals(3, saved.size());
        assertEquals(1, saved.get(0).getRank());
        assertEquals("run-1", saved.get(0).getRunId());
        assertTrue(saved.stream().anyMatch(d -> d.getPlayerKey().equals("b") && d.getPlayerName().equals("b")));
        assertTrue(saved.stream().anyMatch(d -> d.getPlayerName().equals("Player A")));

        ArgumentCaptor<EvaluationRunDocument> run = ArgumentCaptor.forClass(EvaluationRunDocument.class);
        verify(evaluationRunRepository).save(run.capture());
        assertEquals("run-1", run.getValue().getRunId());
        assertEquals(2, run.getValue().getEvaluatedMatches());
        assertEquals(2, run.getValue().getFitMatches());
        assertEquals(LocalDate.of(2017, 12, 31), run.getValue().getFitSnapshotDate());
        assertEquals(result.fitSnapshot().ratings().stream().map(PlayerRating::playerId).toList(),
                run.getValue().getFitLeaders());
        assertEquals(3, run.getValue().getFitLeaders().size());

        ArgumentCaptor<List<PredictionResultDocument>> predictions = ArgumentCaptor.forClass(List.class);
        verify(predictionResultRepository).saveAll(predictions.capture());
        assertEquals(List.of("m3", "m4"),
                predictions.getValue().stream().map(PredictionResultDocument::getMatchKey).toList());
        assertTrue(predictions.getValue().stream().allMatch(p -> "run-1".equals(p.getRunId())));
    }

    @Test
    void emptyEvaluation_savesNoPredictions() {
        List<Match> fitOnly = List.of(Fixtures.tourMatch("m1", LocalDate.of(2017, 2, 1), "a", "b", "a"));
        RunResult result = new RatingRunner(Fixtures.model(), new TemporalSplitter(), new Evaluator(10))
                .run(new RunConfig(2017, 2019, 1), fitOnly);

        exporter.export("run-2", result, Map.of());

        verify(predictionResultRepository, never()).saveAll(anyList());
        verify(evaluationRunRepository).save(any(EvaluationRunDocument.class));
    }
}
