package com.tennis.rating.model;

import java.time.LocalDate;

/**
 * Mutable rating state of one player for the lifetime of a rating run.
 *
 * Two rating speeds are kept: {@code baselineRating} moves by a small share of every
 * delta and tracks long-run ability, {@code currentRating} absorbs the full delta.
 * {@code formSignal} is the decaying average of recent surprise and stays in [-1, 1].
 */
public class Player {

    private final String id;

    private double baselineRating;
    private double currentRating;
    private double formSignal;
    private LocalDate lastActiveDate;    // null until the first match

    private int matchesPlayed;
    private int wins;
    private int losses;

    private double peakRating;
    private LocalDate peakDate;

    public Player(String id, double initialRating) {
        this.id = id;
        this.baselineRating = initialRating;
        this.currentRating = initialRating;
        this.peakRating = initialRating;
    }

    /**
     * Write the post-match state. Only the rating store calls this, once per match.
     */
    public void applyResult(double newBaseline, double newCurrent, double newForm, LocalDate date, boolean won) {
        this.baselineRating = newBaseline;
        this.currentRating = newCurrent;
        this.formSignal = newForm;
        this.lastActiveDate = date;
        this.matchesPlayed++;

        if (won) {
            this.wins++;
        } else {
            this.losses++;
        }

        if (newCurrent > this.peakRating) {
            this.peakRating = newCurrent;
            this.peakDate = date;
        }
    }

    public String getWinLossRecord() {
        return wins + "-" + losses;
    }

    // ============ GETTERS ============

    public String getId() { return id; }

    public double getBaselineRating() { return baselineRating; }

    public double getCurrentRating() { return currentRating; }

    public double getFormSignal() { return formSignal; }

    public LocalDate getLastActiveDate() { return lastActiveDate; }

    public int getMatchesPlayed() { return matchesPlayed; }

    public int getWins() { return wins; }

    public int getLosses() { return losses; }

    public double getPeakRating() { return peakRating; }

    public LocalDate getPeakDate() { return peakDate; }

    @Override
    public String toString() {
        return String.format("Player[%s baseline=%.1f current=%.1f form=%+.3f]",
                id, baselineRating, currentRating, formSignal);
    }
}
