package com.tennis.rating.controller;

import com.tennis.rating.model.EvaluationRunDocument;
import com.tennis.rating.model.PlayerRatingDocument;
import com.tennis.rating.model.PredictionResultDocument;
import com.tennis.rating.service.RatingRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ratings")
@Tag(name = "Ratings", description = "Rating runs, rankings and held-out evaluation")
public class RatingController {

    private final RatingRunService ratingRunService;

    public RatingController(RatingRunService ratingRunService) {
        this.ratingRunService = ratingRunService;
    }

    // ============ RUNS ============

    @PostMapping("/runs")
    @Operation(summary = "Run the rating engine",
            description = "Rate all stored matches from yearFrom to yearTo, hold out the last testSize years for evaluation and export the rankings")
    public RatingRunService.RunSummary run(
            @RequestParam int yearFrom,
            @RequestParam int yearTo,
            @RequestParam int testSize
    ) {
        return ratingRunService.run(yearFrom, yearTo, testSize);
    }

    @GetMapping("/runs")
    @Operation(summary = "Recent runs", description = "Configuration, metrics and calibration of the most recent rating runs")
    public List<EvaluationRunDocument> recentRuns(@RequestParam(defaultValue = "10") int limit) {
        return ratingRunService.getRecentRuns(limit);
    }

    @GetMapping("/runs/{runId}/predictions")
    @Operation(summary = "Run predictions", description = "Pre-match predictions of every evaluation-window match of a run")
    public List<PredictionResultDocument> predictions(@PathVariable String runId) {
        return ratingRunService.getPredictions(runId);
    }

    // ============ RANKINGS ============

    @GetMapping("/leaderboard")
    @Operation(summary = "Leaderboard", description = "Players ranked by effective rating as of the end of the latest run")
    public List<PlayerRatingDocument> leaderboard(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int minMatches
    ) {
        return ratingRunService.getLeaderboard(limit, minMatches);
    }

    @GetMapping("/players/{playerKey}")
    @Operation(summary = "Player rating", description = "Baseline, current, form and effective rating of one player")
    public PlayerRatingDocument player(@PathVariable String playerKey) {
        return ratingRunService.getPlayer(playerKey);
    }

    @GetMapping("/players/search")
    @Operation(summary = "Search players", description = "Case-insensitive name search over the exported rankings")
    public List<PlayerRatingDocument> search(@RequestParam String query) {
        return ratingRunService.searchPlayers(query);
    }
}
