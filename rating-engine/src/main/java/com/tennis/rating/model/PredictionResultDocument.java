package com.tennis.rating.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Pre-match prediction for an evaluation-window match, stored next to its actual outcome.
 */
@Document(collection = "prediction_results")
@CompoundIndex(name = "run_match_idx", def = "{'runId': 1, 'matchKey': 1}", unique = true)
public class PredictionResultDocument {

    @Id
    private String id;

    @Indexed
    private String runId;

    private String matchKey;
    private LocalDate matchDate;
    private String tier;

    private String playerAKey;
    private String playerAName;
    private String playerBKey;
    private String playerBName;

    private double effectiveRatingA;
    private double effectiveRatingB;
    private double probabilityA;           // P(player A wins)
    private double predictedProbability;   // probability assigned to the actual winner

    private String predictedWinner;
    private String actualWinner;
    private boolean correct;
    private double brierScore;             // (probabilityA - outcomeA)^2

    private Instant evaluatedAt;

    public PredictionResultDocument() {
        this.evaluatedAt = Instant.now();
    }

    public static PredictionResultDocument from(String runId, MatchPrediction p, String playerAName, String playerBName) {
        PredictionResultDocument doc = new PredictionResultDocument();
        doc.runId = runId;
        doc.matchKey = p.matchKey();
        doc.matchDate = p.date();
        doc.tier = p.tier().name();
        doc.playerAKey = p.playerA();
        doc.playerAName = playerAName;
        doc.playerBKey = p.playerB();
        doc.playerBName = playerBName;
        doc.effectiveRatingA = p.effectiveRatingA();
        doc.effectiveRatingB = p.effectiveRatingB();
        doc.probabilityA = p.probabilityA();
        doc.predictedProbability = p.winnerProbability();
        doc.predictedWinner = p.predictedWinner();
        doc.actualWinner = p.winner();
        doc.correct = p.correct();
        doc.brierScore = p.brierScore();
        return doc;
    }

    public String getPredictedProbabilityFormatted() {
        return String.format("%.0f%%", predictedProbability * 100);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getMatchKey() { return matchKey; }
    public void setMatchKey(String matchKey) { this.matchKey = matchKey; }

    public LocalDate getMatchDate() { return matchDate; }
    public void setMatchDate(LocalDate matchDate) { this.matchDate = matchDate; }

    public String getTier() { return tier; }
    public void setTier(String tier) { this.tier = tier; }

    public String getPlayerAKey() { return playerAKey; }
    public void setPlayerAKey(String playerAKey) { this.playerAKey = playerAKey; }

    public String getPlayerAName() { return playerAName; }
    public void setPlayerAName(String playerAName) { this.playerAName = playerAName; }

    public String getPlayerBKey() { return playerBKey; }
    public void setPlayerBKey(String playerBKey) { this.playerBKey = playerBKey; }

    public String getPlayerBName() { return playerBName; }
    public void setPlayerBName(String playerBName) { this.playerBName = playerBName; }

    public double getEffectiveRatingA() { return effectiveRatingA; }
    public void setEffectiveRatingA(double effectiveRatingA) { this.effectiveRatingA = effectiveRatingA; }

    public double getEffectiveRatingB() { return effectiveRatingB; }
    public void setEffectiveRatingB(double effectiveRatingB) { this.effectiveRatingB = effectiveRatingB; }

    public double getProbabilityA() { return probabilityA; }
    public void setProbabilityA(double probabilityA) { this.probabilityA = probabilityA; }

    public double getPredictedProbability() { return predictedProbability; }
    public void setPredictedProbability(double predictedProbability) { this.predictedProbability = predictedProbability; }

    public String getPredictedWinner() { return predictedWinner; }
    public void setPredictedWinner(String predictedWinner) { this.predictedWinner = predictedWinner; }

    public String getActualWinner() { return actualWinner; }
    public void setActualWinner(String actualWinner) { this.actualWinner = actualWinner; }

    public boolean isCorrect() { return correct; }
    public void setCorrect(boolean correct) { this.correct = correct; }

    public double getBrierScore() { return brierScore; }
    public void setBrierScore(double brierScore) { this.brierScore = brierScore; }

    public Instant getEvaluatedAt() { return evaluatedAt; }
    public void setEvaluatedAt(Instant evaluatedAt) { this.evaluatedAt = evaluatedAt; }
}
