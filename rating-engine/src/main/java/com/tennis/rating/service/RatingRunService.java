package com.tennis.rating.service;

import com.tennis.rating.engine.RatingRunner;
import com.tennis.rating.engine.TemporalSplitter;
import com.tennis.rating.exception.ResourceNotFoundException;
import com.tennis.rating.export.RankingsExporter;
import com.tennis.rating.feed.MatchFeed;
import com.tennis.rating.feed.MatchFeedResult;
import com.tennis.rating.model.EvaluationReport;
import com.tennis.rating.model.EvaluationRunDocument;
import com.tennis.rating.model.PlayerRatingDocument;
import com.tennis.rating.model.PredictionResultDocument;
import com.tennis.rating.model.RunConfig;
import com.tennis.rating.model.RunResult;
import com.tennis.rating.repository.EvaluationRunRepository;
import com.tennis.rating.repository.PlayerRatingRepository;
import com.tennis.rating.repository.PredictionResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs the rating engine over stored matches and serves the exported results.
 */
@Service
public class RatingRunService {

    private static final Logger log = LoggerFactory.getLogger(RatingRunService.class);

    private final MatchFeed matchFeed;
    private final RatingRunner ratingRunner;
    private final TemporalSplitter temporalSplitter;
    private final RankingsExporter rankingsExporter;
    private final PlayerRatingRepository playerRatingRepository;
    private final EvaluationRunRepository evaluationRunRepository;
    private final PredictionResultRepository predictionResultRepository;

    public RatingRunService(
            MatchFeed matchFeed,
            RatingRunner ratingRunner,
            TemporalSplitter temporalSplitter,
            RankingsExporter rankingsExporter,
            PlayerRatingRepository playerRatingRepository,
            EvaluationRunRepository evaluationRunRepository,
            PredictionResultRepository predictionResultRepository
    ) {
        this.matchFeed = matchFeed;
        this.ratingRunner = ratingRunner;
        this.temporalSplitter = temporalSplitter;
        this.rankingsExporter = rankingsExporter;
        this.playerRatingRepository = playerRatingRepository;
        this.evaluationRunRepository = evaluationRunRepository;
        this.predictionResultRepository = predictionResultRepository;
    }

    /**
     * Rate every stored match in the range, evaluate the held-out years and export the results.
     *
     * @throws com.tennis.rating.exception.ConfigurationException before any data is read
     *         if the year range or test size is invalid
     */
    public RunSummary run(int yearFrom, int yearTo, int testSizeYears) {
        RunConfig config = new RunConfig(yearFrom, yearTo, testSizeYears);
        temporalSplitter.validate(config);

        String runId = UUID.randomUUID().toString();
        Instant started = Instant.now();
        log.info("Starting rating run {} for {}-{} holding out {} year(s)", runId, yearFrom, yearTo, testSizeYears);

        MatchFeedResult feed = matchFeed.load(yearFrom, yearTo);
        RunResult result = ratingRunner.run(config, feed.matches());
        rankingsExporter.export(runId, result, feed.playerNames());

        Duration elapsed = Duration.between(started, Instant.now());
        log.info("Rating run {} finished in {} ms", runId, elapsed.toMillis());
        return RunSummary.of(runId, result, feed.skippedRecords(), elapsed.toMillis());
    }

    public List<PlayerRatingDocument> getLeaderboard(int limit, int minMatches) {
        if (minMatches > 0) {
            return playerRatingRepository.findByMinMatchesPlayed(minMatches, PageRequest.of(0, limit, Sort.by("rank")));
        }
        return playerRatingRepository.findAllByOrderByRankAsc(PageRequest.of(0, limit));
    }

    public PlayerRatingDocument getPlayer(String playerKey) {
        return playerRatingRepository.findByPlayerKey(playerKey)
                .orElseThrow(() -> new ResourceNotFoundException("Player rating", playerKey));
    }

    public List<PlayerRatingDocument> searchPlayers(String query) {
        return playerRatingRepository.searchByName(query);
    }

    public List<EvaluationRunDocument> getRecentRuns(int limit) {
        return evaluationRunRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
    }

    public List<PredictionResultDocument> getPredictions(String runId) {
        if (evaluationRunRepository.findByRunId(runId).isEmpty()) {
            throw new ResourceNotFoundException("Evaluation run", runId);
        }
        return predictionResultRepository.findByRunIdOrderByMatchDateAsc(runId);
    }

    // ============ RESULT RECORDS ============

    public record RunSummary(
            String runId,
            int yearFrom,
            int yearTo,
            int testSizeYears,
            int fitMatches,
            int evaluatedMatches,
            int excludedMatches,
            int skippedRecords,
            int dataQualityWarnings,
            int playersRated,
            double accuracy,
            double brierScore,
            double logLoss,
            long elapsedMillis
    ) {
        static RunSummary of(String runId, RunResult result, int skippedRecords, long elapsedMillis) {
            EvaluationReport report = result.evaluation();
            return new RunSummary(
                    runId,
                    result.config().yearFrom(),
                    result.config().yearTo(),
                    result.config().testSizeYears(),
                    result.fitMatches(),
                    report.totalMatches(),
                    result.excludedMatches(),
                    skippedRecords,
                    result.dataQualityWarnings(),
                    result.finalSnapshot().size(),
                    report.accuracy(),
                    report.brierScore(),
                    report.logLoss(),
                    elapsedMillis
            );
        }

        public String getAccuracyPercent() {
            return String.format("%.1f%%", accuracy * 100);
        }
    }
}
