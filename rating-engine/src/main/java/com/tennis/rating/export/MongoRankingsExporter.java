package com.tennis.rating.export;

import com.tennis.rating.model.EvaluationRunDocument;
import com.tennis.rating.model.MatchPrediction;
import com.tennis.rating.model.PlayerRating;
import com.tennis.rating.model.PlayerRatingDocument;
import com.tennis.rating.model.PredictionResultDocument;
import com.tennis.rating.model.RatingSnapshot;
import com.tennis.rating.model.RunResult;
import com.tennis.rating.repository.EvaluationRunRepository;
import com.tennis.rating.repository.PlayerRatingRepository;
import com.tennis.rating.repository.PredictionResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Writes run outcomes to MongoDB. The ranking collection always holds the latest run only;
 * evaluation runs and their predictions accumulate.
 */
@Component
public class MongoRankingsExporter implements RankingsExporter {

    private static final Logger log = LoggerFactory.getLogger(MongoRankingsExporter.class);

    private static final int BATCH_SIZE = 500;

    private final PlayerRatingRepository playerRatingRepository;
    private final EvaluationRunRepository evaluationRunRepository;
    private final PredictionResultRepository predictionResultRepository;

    public MongoRankingsExporter(
            PlayerRatingRepository playerRatingRepository,
            EvaluationRunRepository evaluationRunRepository,
            PredictionResultRepository predictionResultRepository
    ) {
        this.playerRatingRepository = playerRatingRepository;
        this.evaluationRunRepository = evaluationRunRepository;
        this.predictionResultRepository = predictionResultRepository;
    }

    @Override
    public void export(String runId, RunResult result, Map<String, String> playerNames) {
        RatingSnapshot snapshot = result.finalSnapshot();

        playerRatingRepository.deleteAll();
        List<PlayerRatingDocument> ratings = new ArrayList<>(snapshot.size());
        for (PlayerRating rating : snapshot.ratings()) {
            ratings.add(PlayerRatingDocument.from(
                    rating, playerNames.getOrDefault(rating.playerId(), rating.playerId()), runId, snapshot.asOf()));
        }
        saveInBatches(ratings, playerRatingRepository::saveAll);
        log.info("Exported rankings for {} players as of {}", ratings.size(), snapshot.asOf());

        evaluationRunRepository.save(EvaluationRunDocument.from(runId, result));

        List<PredictionResultDocument> predictions = new ArrayList<>();
        for (MatchPrediction p : result.evaluation().predictions()) {
            predictions.add(PredictionResultDocument.from(
                    runId, p,
                    playerNames.getOrDefault(p.playerA(), p.playerA()),
                    playerNames.getOrDefault(p.playerB(), p.playerB())));
        }
        saveInBatches(predictions, predictionResultRepository::saveAll);
        log.info("Exported run {} with {} predictions", runId, predictions.size());
    }

    private static <T> void saveInBatches(List<T> documents, Consumer<List<T>> saver) {
        for (int i = 0; i < documents.size(); i += BATCH_SIZE) {
            saver.accept(documents.subList(i, Math.min(i + BATCH_SIZE, documents.size())));
        }
    }
}
