package com.tennis.rating.engine;

import com.tennis.rating.model.EvaluationReport;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.RatingSnapshot;
import com.tennis.rating.model.RunConfig;
import com.tennis.rating.model.RunResult;
import com.tennis.rating.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One complete rating run: configuration checks, fit-window sweep, held-out evaluation
 * and the snapshots taken at the end of each window.
 */
public class RatingRunner {

    private static final Logger log = LoggerFactory.getLogger(RatingRunner.class);

    private final RatingModel model;
    private final TemporalSplitter splitter;
    private final Evaluator evaluator;

    public RatingRunner(RatingModel model, TemporalSplitter splitter, Evaluator evaluator) {
        this.model = model;
        this.splitter = splitter;
        this.evaluator = evaluator;
    }

    /**
     * Run from a fresh rating store. Every configuration problem is raised before the first match is rated.
     */
    public RunResult run(RunConfig config, List<Match> matches) {
        MatchSplit split = splitter.split(config, matches);

        Set<Tier> tiersInUse = EnumSet.noneOf(Tier.class);
        split.fitMatches().forEach(m -> tiersInUse.add(m.tier()));
        split.evaluationMatches().forEach(m -> tiersInUse.add(m.tier()));
        model.tierWeights().requireAll(tiersInUse);

        RatingEngine engine = model.newEngine();
        for (Match match : split.fitMatches()) {
            engine.process(match);
        }
        LocalDate fitEnd = LocalDate.of(config.evaluationStartYear(), 1, 1).minusDays(1);
        RatingSnapshot fitSnapshot = engine.snapshot(fitEnd);
        log.info("Fit window rated {} matches across {} players", split.fitMatches().size(), engine.getStore().size());

        EvaluationReport report = evaluator.evaluate(split.evaluationMatches(), engine);
        RatingSnapshot finalSnapshot = engine.snapshot(LocalDate.of(config.yearTo(), 12, 31));

        if (engine.getDataQualityWarnings() > 0) {
            log.warn("{} matches were rated with a neutral margin because of missing or malformed scores",
                    engine.getDataQualityWarnings());
        }

        return new RunResult(
                config,
                split.fitMatches().size(),
                split.excludedMatches(),
                report,
                fitSnapshot,
                finalSnapshot,
                engine.getDataQualityWarnings()
        );
    }
}
