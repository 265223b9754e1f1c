package com.tennis.matchdata.parser;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Reads set scores such as {@code 7-6(4) 3-6 6-2}. Tie-break details in brackets are dropped
 * and tokens that are not a set score ({@code RET}, {@code W/O}, {@code DEF}) are ignored.
 */
@Component
public class ScoreParser {

    public static final int MIN_WINNER_GAMES = 12;
    public static final int MIN_WINNER_SETS = 2;

    private static final Pattern BRACKETED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern SET_SCORE = Pattern.compile("(\\d+)-(\\d+)");

    /**
     * @return the parsed score, or null if the text is missing or describes an incomplete match
     */
    public ParsedScore parse(String score) {
        if (score == null || score.isBlank()) {
            return null;
        }

        String cleaned = BRACKETED.matcher(score).replaceAll("").trim();
        int winnerGames = 0;
        int loserGames = 0;
        int winnerSets = 0;
        int loserSets = 0;

        for (String token : cleaned.split("\\s+")) {
            var m = SET_SCORE.matcher(token);
            if (!m.matches()) continue;

            int w = Integer.parseInt(m.group(1));
            int l = Integer.parseInt(m.group(2));
            winnerGames += w;
            loserGames += l;
            if (w > l) {
                winnerSets++;
            } else if (l > w) {
                loserSets++;
            }
        }

        if (winnerGames < MIN_WINNER_GAMES || winnerSets < MIN_WINNER_SETS) {
            return null;
        }
        return new ParsedScore(winnerGames, winnerSets, loserGames, loserSets);
    }
}
