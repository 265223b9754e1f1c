package com.tennis.rating.feed;

import com.tennis.rating.model.Match;
import com.tennis.rating.model.Score;
import com.tennis.rating.model.Surface;
import com.tennis.rating.model.Tier;
import com.tennis.rating.model.readonly.MatchDocument;
import com.tennis.rating.repository.readonly.MatchReadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Match feed over the {@code matches} collection written by the match data adapter.
 */
@Component
public class MongoMatchFeed implements MatchFeed {

    private static final Logger log = LoggerFactory.getLogger(MongoMatchFeed.class);

    private static final Sort CHRONOLOGICAL = Sort.by(Sort.Order.asc("matchDate"), Sort.Order.asc("matchKey"));

    private final MatchReadRepository matchRepository;

    public MongoMatchFeed(MatchReadRepository matchRepository) {
        this.matchRepository = matchRepository;
    }

    @Override
    public MatchFeedResult load(int yearFrom, int yearTo) {
        LocalDate start = LocalDate.of(yearFrom, 1, 1);
        LocalDate end = LocalDate.of(yearTo, 12, 31);
        List<MatchDocument> documents = matchRepository.findByDateRange(start, end, CHRONOLOGICAL);
        log.info("Loaded {} match records from {} to {}", documents.size(), start, end);

        List<Match> matches = new ArrayList<>(documents.size());
        Map<String, String> names = new HashMap<>();
        int skipped = 0;

        for (MatchDocument doc : documents) {
            Match match = toMatch(doc);
            if (match == null) {
                skipped++;
                continue;
            }
            matches.add(match);
            if (doc.getPlayerAName() != null) names.put(doc.getPlayerAKey(), doc.getPlayerAName());
            if (doc.getPlayerBName() != null) names.put(doc.getPlayerBKey(), doc.getPlayerBName());
        }

        if (skipped > 0) {
            log.warn("Skipped {} match records without a usable result", skipped);
        }
        return new MatchFeedResult(matches, names, skipped);
    }

    /**
     * Convert a stored record, or return null if it cannot be rated at all.
     * An unknown tier is a configuration problem and is not absorbed here.
     */
    Match toMatch(MatchDocument doc) {
        String a = doc.getPlayerAKey();
        String b = doc.getPlayerBKey();
        String winner = doc.getWinnerKey();

        if (doc.getMatchDate() == null || a == null || b == null || winner == null) {
            log.warn("Match {} is missing its date, players or winner, skipping", doc.getMatchKey());
            return null;
        }
        if (a.equals(b) || (!winner.equals(a) && !winner.equals(b))) {
            log.warn("Match {} has an inconsistent result ({} vs {}, winner {}), skipping",
                    doc.getMatchKey(), a, b, winner);
            return null;
        }

        Tier tier = Tier.fromCode(doc.getTier());
        Score score = doc.hasScore()
                ? new Score(doc.getWinnerGames(), doc.getWinnerSets(), doc.getLoserGames(), doc.getLoserSets())
                : null;

        return new Match(
                doc.getMatchKey() != null ? doc.getMatchKey() : doc.getId(),
                doc.getMatchDate(),
                a,
                b,
                winner,
                score,
                tier,
                Surface.fromName(doc.getSurface())
        );
    }
}
