package com.tennis.rating.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Read-only view of a normalized match written by the match data adapter.
 */
@Document(collection = "matches")
public class MatchDocument {

    @Id
    private String id;

    private String matchKey;
    private LocalDate matchDate;         // inferred from tournament start and round
    private String tier;                 // tier name or source code
    private String surface;

    private String tournamentKey;
    private String tournamentName;
    private String round;

    private String playerAKey;
    private String playerAName;
    private String playerBKey;
    private String playerBName;
    private String winnerKey;

    private String rawScore;
    private Integer winnerGames;         // null when the score could not be used
    private Integer winnerSets;
    private Integer loserGames;
    private Integer loserSets;

    public boolean hasScore() {
        return winnerGames != null && winnerSets != null && loserGames != null && loserSets != null;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getMatchKey() { return matchKey; }
    public void setMatchKey(String matchKey) { this.matchKey = matchKey; }

    public LocalDate getMatchDate() { return matchDate; }
    public void setMatchDate(LocalDate matchDate) { this.matchDate = matchDate; }

    public String getTier() { return tier; }
    public void setTier(String tier) { this.tier = tier; }

    public String getSurface() { return surface; }
    public void setSurface(String surface) { this.surface = surface; }

    public String getTournamentKey() { return tournamentKey; }
    public void setTournamentKey(String tournamentKey) { this.tournamentKey = tournamentKey; }

    public String getTournamentName() { return tournamentName; }
    public void setTournamentName(String tournamentName) { this.tournamentName = tournamentName; }

    public String getRound() { return round; }
    public void setRound(String round) { this.round = round; }

    public String getPlayerAKey() { return playerAKey; }
    public void setPlayerAKey(String playerAKey) { this.playerAKey = playerAKey; }

    public String getPlayerAName() { return playerAName; }
    public void setPlayerAName(String playerAName) { this.playerAName = playerAName; }

    public String getPlayerBKey() { return playerBKey; }
    public void setPlayerBKey(String playerBKey) { this.playerBKey = playerBKey; }

    public String getPlayerBName() { return playerBName; }
    public void setPlayerBName(String playerBName) { this.playerBName = playerBName; }

    public String getWinnerKey() { return winnerKey; }
    public void setWinnerKey(String winnerKey) { this.winnerKey = winnerKey; }

    public String getRawScore() { return rawScore; }
    public void setRawScore(String rawScore) { this.rawScore = rawScore; }

    public Integer getWinnerGames() { return winnerGames; }
    public void setWinnerGames(Integer winnerGames) { this.winnerGames = winnerGames; }

    public Integer getWinnerSets() { return winnerSets; }
    public void setWinnerSets(Integer winnerSets) { this.winnerSets = winnerSets; }

    public Integer getLoserGames() { return loserGames; }
    public void setLoserGames(Integer loserGames) { this.loserGames = loserGames; }

    public Integer getLoserSets() { return loserSets; }
    public void setLoserSets(Integer loserSets) { this.loserSets = loserSets; }
}
