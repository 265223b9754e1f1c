package com.tennis.matchdata.controller;

import com.tennis.matchdata.exception.ResourceNotFoundException;
import com.tennis.matchdata.model.MatchDocument;
import com.tennis.matchdata.repository.MatchRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to stored matches.
 */
@RestController
@RequestMapping("/api/matches")
@Tag(name = "Matches", description = "Query normalized matches stored in MongoDB")
public class MatchController {

    private static final int MAX_PAGE_SIZE = 500;

    private final MatchRepository matchRepository;

    public MatchController(MatchRepository matchRepository) {
        this.matchRepository = matchRepository;
    }

    @GetMapping
    @Operation(summary = "List matches", description = "Paginated matches between two dates (inclusive), in date order")
    public Page<MatchDocument> getMatches(
            @Parameter(description = "Start date (YYYY-MM-DD)", example = "2019-01-01")
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @Parameter(description = "End date (YYYY-MM-DD)", example = "2019-12-31")
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE),
                Sort.by(Sort.Order.asc("matchDate"), Sort.Order.asc("matchKey")));
        return matchRepository.findByMatchDateBetween(from, to, pageable);
    }

    @GetMapping("/count")
    @Operation(summary = "Count matches", description = "Total stored matches, or the count for one season split by tier")
    public Map<String, Object> count(@RequestParam(required = false) Integer year) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (year == null) {
            response.put("total", matchRepository.count());
            return response;
        }
        response.put("year", year);
        response.put("total", matchRepository.countBySourceYear(year));
        response.put("tour", matchRepository.countBySourceYearAndTier(year, "TOUR"));
        response.put("itf", matchRepository.countBySourceYearAndTier(year, "ITF"));
        return response;
    }

    @GetMapping("/{matchKey}")
    @Operation(summary = "Get match by key")
    public MatchDocument getMatch(@PathVariable String matchKey) {
        return matchRepository.findByMatchKey(matchKey)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchKey));
    }

    @GetMapping("/player/{playerKey}")
    @Operation(summary = "Matches of a player")
    public List<MatchDocument> getPlayerMatches(@PathVariable String playerKey) {
        List<MatchDocument> matches = matchRepository.findByPlayerKey(playerKey);
        if (matches.isEmpty()) {
            throw new ResourceNotFoundException("Player", playerKey);
        }
        return matches;
    }
}
