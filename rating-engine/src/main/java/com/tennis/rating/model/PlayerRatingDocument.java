package com.tennis.rating.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Exported ranking entry of one player as of the end of a rating run's evaluation window.
 */
@Document(collection = "player_ratings")
public class PlayerRatingDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String playerKey;

    private String playerName;

    @Indexed
    private int rank;

    private double effectiveRating;     // what predictions use
    private double baselineRating;      // long-run ability
    private double currentRating;       // recent ability
    private double formSignal;          // decayed to asOf, within [-1, 1]

    private int matchesPlayed;
    private int wins;
    private int losses;

    private double peakRating;
    private LocalDate peakDate;
    private LocalDate lastActiveDate;

    private String runId;
    private LocalDate asOf;
    private Instant updatedAt;

    public PlayerRatingDocument() {
        this.updatedAt = Instant.now();
    }

    public static PlayerRatingDocument from(PlayerRating rating, String playerName, String runId, LocalDate asOf) {
        PlayerRatingDocument doc = new PlayerRatingDocument();
        doc.id = rating.playerId();
        doc.playerKey = rating.playerId();
        doc.playerName = playerName;
        doc.rank = rating.rank();
        doc.effectiveRating = rating.effectiveRating();
        doc.baselineRating = rating.baselineRating();
        doc.currentRating = rating.currentRating();
        doc.formSignal = rating.formSignal();
        doc.matchesPlayed = rating.matchesPlayed();
        doc.wins = rating.wins();
        doc.losses = rating.losses();
        doc.peakRating = rating.peakRating();
        doc.peakDate = rating.peakDate();
        doc.lastActiveDate = rating.lastActiveDate();
        doc.runId = runId;
        doc.asOf = asOf;
        return doc;
    }

    // ============ HELPER METHODS ============

    /**
     * "hot", "rising", "stable", "cooling" or "cold" from the form signal.
     */
    public String getFormTrend() {
        if (formSignal >= 0.15) return "hot";
        if (formSignal >= 0.05) return "rising";
        if (formSignal > -0.05) return "stable";
        if (formSignal > -0.15) return "cooling";
        return "cold";
    }

    public String getEffectiveRatingFormatted() {
        return String.format("%.1f", effectiveRating);
    }

    public String getWinLossRecord() {
        return wins + "-" + losses;
    }

    public double getWinRate() {
        return matchesPlayed > 0 ? (double) wins / matchesPlayed : 0.0;
    }

    // ============ GETTERS AND SETTERS ============

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getPlayerKey() { return playerKey; }
    public void setPlayerKey(String playerKey) { this.playerKey = playerKey; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }

    public double getEffectiveRating() { return effectiveRating; }
    public void setEffectiveRating(double effectiveRating) { this.effectiveRating = effectiveRating; }

    public double getBaselineRating() { return baselineRating; }
    public void setBaselineRating(double baselineRating) { this.baselineRating = baselineRating; }

    public double getCurrentRating() { return currentRating; }
    public void setCurrentRating(double currentRating) { this.currentRating = currentRating; }

    public double getFormSignal() { return formSignal; }
    public void setFormSignal(double formSignal) { this.formSignal = formSignal; }

    public int getMatchesPlayed() { return matchesPlayed; }
    public void setMatchesPlayed(int matchesPlayed) { this.matchesPlayed = matchesPlayed; }

    public int getWins() { return wins; }
    public void setWins(int wins) { this.wins = wins; }

    public int getLosses() { return losses; }
    public void setLosses(int losses) { this.losses = losses; }

    public double getPeakRating() { return peakRating; }
    public void setPeakRating(double peakRating) { this.peakRating = peakRating; }

    public LocalDate getPeakDate() { return peakDate; }
    public void setPeakDate(LocalDate peakDate) { this.peakDate = peakDate; }

    public LocalDate getLastActiveDate() { return lastActiveDate; }
    public void setLastActiveDate(LocalDate lastActiveDate) { this.lastActiveDate = lastActiveDate; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public LocalDate getAsOf() { return asOf; }
    public void setAsOf(LocalDate asOf) { this.asOf = asOf; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
