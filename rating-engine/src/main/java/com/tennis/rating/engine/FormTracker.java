package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Player;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Exponentially weighted average of a player's recent surprise ({@code actual - expected}),
 * decaying toward zero with a half-life in days while the player is inactive.
 */
public class FormTracker {

    private final double halfLifeDays;
    private final double updateRate;

    public FormTracker(double halfLifeDays, double updateRate) {
        if (!(halfLifeDays > 0) || Double.isInfinite(halfLifeDays)) {
            throw new ConfigurationException("form.half-life-days must be positive, got " + halfLifeDays);
        }
        if (!(updateRate > 0 && updateRate <= 1)) {
            throw new ConfigurationException("form.update-rate must be within (0, 1], got " + updateRate);
        }
        this.halfLifeDays = halfLifeDays;
        this.updateRate = updateRate;
    }

    /**
     * Form value observed on {@code asOf} given its value on {@code lastActive}.
     */
    public double decay(double form, LocalDate lastActive, LocalDate asOf) {
        if (lastActive == null || form == 0.0) {
            return 0.0;
        }
        long days = ChronoUnit.DAYS.between(lastActive, asOf);
        if (days <= 0) {
            return form;
        }
        return form * Math.pow(0.5, days / halfLifeDays);
    }

    public double formAsOf(Player player, LocalDate asOf) {
        return decay(player.getFormSignal(), player.getLastActiveDate(), asOf);
    }

    /**
     * Form after a match on {@code date} with the given surprise. Tier weight and margin play no part.
     */
    public double next(Player player, double surprise, LocalDate date) {
        double decayed = formAsOf(player, date);
        double updated = decayed * (1 - updateRate) + surprise * updateRate;
        return Math.max(-1.0, Math.min(1.0, updated));
    }

    public double getHalfLifeDays() { return halfLifeDays; }

    public double getUpdateRate() { return updateRate; }
}
