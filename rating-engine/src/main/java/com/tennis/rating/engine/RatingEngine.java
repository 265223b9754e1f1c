package com.tennis.rating.engine;

import com.tennis.rating.model.Match;
import com.tennis.rating.model.MatchPrediction;
import com.tennis.rating.model.Player;
import com.tennis.rating.model.RatingDelta;
import com.tennis.rating.model.RatingSnapshot;
import com.tennis.rating.model.RatingUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Sequential, temporally causal sweep over matches.
 *
 * Each match is first read against the ratings produced by earlier matches only,
 * then folded into the store. Matches must arrive in non-decreasing date order.
 */
public class RatingEngine {

    private static final Logger log = LoggerFactory.getLogger(RatingEngine.class);

    private final RatingModel model;
    private final RatingStore store;
    private final UpdateRule updateRule;

    private LocalDate processedThrough;
    private int processedMatches;
    private int dataQualityWarnings;

    public RatingEngine(RatingModel model, RatingStore store) {
        this.model = model;
        this.store = store;
        this.updateRule = model.updateRule();
    }

    /**
     * Effective rating of a player for a match on {@code asOf}, with form decayed to that date.
     */
    public double effectiveRating(Player player, LocalDate asOf) {
        double form = model.formTracker().formAsOf(player, asOf);
        return model.blender().effectiveRating(player.getBaselineRating(), player.getCurrentRating(), form);
    }

    /**
     * Pre-match prediction. Registers unseen players but does not change any rating.
     */
    public MatchPrediction predict(Match match) {
        requireInOrder(match);
        Player a = store.get(match.playerA());
        Player b = store.get(match.playerB());
        double effectiveA = effectiveRating(a, match.date());
        double effectiveB = effectiveRating(b, match.date());
        double probabilityA = model.predictor().winProbability(effectiveA, effectiveB);
        double winnerProbability = match.playerAWon() ? probabilityA : 1.0 - probabilityA;

        return new MatchPrediction(
                match.matchKey(),
                match.date(),
                match.playerA(),
                match.playerB(),
                match.winner(),
                match.tier(),
                effectiveA,
                effectiveB,
                probabilityA,
                winnerProbability
        );
    }

    /**
     * Fold one completed match into the ratings.
     */
    public RatingUpdate process(Match match) {
        requireInOrder(match);
        if (!model.marginFunction().isUsable(match.score())) {
            dataQualityWarnings++;
            log.warn("Match {} on {} has a missing or malformed score ({}), using neutral margin",
                    match.matchKey(), match.date(), match.score());
        }

        Player a = store.get(match.playerA());
        Player b = store.get(match.playerB());
        RatingDelta delta = updateRule.compute(match, effectiveRating(a, match.date()), effectiveRating(b, match.date()));

        FormTracker formTracker = model.formTracker();
        Blender blender = model.blender();
        RatingUpdate update = new RatingUpdate(
                delta,
                blender.baselineDelta(delta.deltaA()),
                blender.baselineDelta(delta.deltaB()),
                formTracker.next(a, delta.surpriseA(), match.date()),
                formTracker.next(b, delta.surpriseB(), match.date())
        );
        store.apply(match, update);

        processedThrough = match.date();
        processedMatches++;

        if (log.isDebugEnabled()) {
            log.debug("Match {}: {} vs {} won by {} (E_a={}, K={}, M={}) delta {}",
                    match.matchKey(), match.playerA(), match.playerB(), match.winner(),
                    String.format("%.3f", delta.expectedA()), delta.tierWeight(),
                    String.format("%.3f", delta.marginMultiplier()), delta.getDeltaAFormatted());
        }
        return update;
    }

    public RatingSnapshot snapshot(LocalDate asOf) {
        return store.snapshot(asOf, model.blender(), model.formTracker());
    }

    private void requireInOrder(Match match) {
        if (processedThrough != null && match.date().isBefore(processedThrough)) {
            throw new IllegalStateException(String.format(
                    "Match %s on %s arrived after matches up to %s had been processed",
                    match.matchKey(), match.date(), processedThrough));
        }
    }

    public RatingStore getStore() { return store; }

    public LocalDate getProcessedThrough() { return processedThrough; }

    public int getProcessedMatches() { return processedMatches; }

    public int getDataQualityWarnings() { return dataQualityWarnings; }
}
