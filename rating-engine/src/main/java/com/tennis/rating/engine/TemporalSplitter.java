package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits matches by calendar year: fit window {@code [yearFrom, yearTo - testSize)},
 * evaluation window {@code [yearTo - testSize, yearTo]}. Anything outside
 * {@code [yearFrom, yearTo]} is dropped and never warms up a rating.
 */
public class TemporalSplitter {

    private static final Logger log = LoggerFactory.getLogger(TemporalSplitter.class);

    /**
     * Earliest year with results reliable enough to rate from.
     */
    public static final int RECOMMENDED_FIRST_YEAR = 2010;

    public void validate(RunConfig config) {
        if (config.yearFrom() >= config.yearTo()) {
            throw new ConfigurationException(String.format(
                    "yearFrom (%d) must be before yearTo (%d)", config.yearFrom(), config.yearTo()));
        }
        if (config.testSizeYears() < 1) {
            throw new ConfigurationException("testSize must be at least one year, got " + config.testSizeYears());
        }
        if (config.testSizeYears() >= config.yearTo() - config.yearFrom()) {
            throw new ConfigurationException(String.format(
                    "testSize (%d) must be smaller than the year range %d-%d",
                    config.testSizeYears(), config.yearFrom(), config.yearTo()));
        }
        if (config.yearFrom() < RECOMMENDED_FIRST_YEAR) {
            log.warn("yearFrom {} precedes {}; older results are of lower quality",
                    config.yearFrom(), RECOMMENDED_FIRST_YEAR);
        }
    }

    /**
     * @throws ConfigurationException if the year range or test size is invalid
     */
    public MatchSplit split(RunConfig config, List<Match> matches) {
        validate(config);

        List<Match> ordered = new ArrayList<>(matches);
        ordered.sort(Comparator.comparing(Match::date));

        int evaluationStart = config.evaluationStartYear();
        List<Match> fit = new ArrayList<>();
        List<Match> evaluation = new ArrayList<>();
        int excluded = 0;

        for (Match match : ordered) {
            int year = match.year();
            if (year < config.yearFrom() || year > config.yearTo()) {
                excluded++;
            } else if (year < evaluationStart) {
                fit.add(match);
            } else {
                evaluation.add(match);
            }
        }

        log.info("Split {} matches: fit {}-{} = {}, evaluation {}-{} = {}, excluded = {}",
                matches.size(), config.yearFrom(), evaluationStart - 1, fit.size(),
                evaluationStart, config.yearTo(), evaluation.size(), excluded);
        return new MatchSplit(fit, evaluation, excluded);
    }
}
