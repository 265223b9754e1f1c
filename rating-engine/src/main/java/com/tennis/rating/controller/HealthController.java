package com.tennis.rating.controller;

import com.tennis.rating.repository.PlayerRatingRepository;
import com.tennis.rating.repository.readonly.MatchReadRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final MatchReadRepository matchRepository;
    private final PlayerRatingRepository playerRatingRepository;

    public HealthController(
            MatchReadRepository matchRepository,
            PlayerRatingRepository playerRatingRepository
    ) {
        this.matchRepository = matchRepository;
        this.playerRatingRepository = playerRatingRepository;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        // read access to adapter data
        try {
            health.put("matchDataAccess", "OK");
            health.put("matchCount", matchRepository.count());
        } catch (Exception e) {
            health.put("matchDataAccess", "ERROR: " + e.getMessage());
        }

        // write side
        try {
            health.put("ratingDataAccess", "OK");
            health.put("ratedPlayers", playerRatingRepository.count());
        } catch (Exception e) {
            health.put("ratingDataAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }
}
