package com.tennis.matchdata.controller;

import com.tennis.matchdata.model.IngestionResult;
import com.tennis.matchdata.model.SourceTier;
import com.tennis.matchdata.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints to trigger results ingestion.
 */
@RestController
@RequestMapping("/api/ingest")
@Tag(name = "Ingestion", description = "Download yearly results files and store them in MongoDB")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/years")
    @Operation(summary = "Ingest a range of years",
               description = "Download tour and ITF results for every year in the range. A failing file does not stop the others")
    public ResponseEntity<Map<String, Object>> ingestYears(
            @Parameter(description = "First year", example = "2010")
            @RequestParam int yearFrom,
            @Parameter(description = "Last year (inclusive)", example = "2020")
            @RequestParam int yearTo
    ) {
        return buildResponse(ingestionService.ingestYears(yearFrom, yearTo));
    }

    @PostMapping("/years/{year}")
    @Operation(summary = "Ingest one results file", description = "Download one year of results for a single tier")
    public ResponseEntity<Map<String, Object>> ingestYear(
            @Parameter(description = "Season", example = "2019")
            @PathVariable int year,
            @Parameter(description = "TOUR or ITF")
            @RequestParam(defaultValue = "TOUR") SourceTier tier
    ) {
        return buildResponse(ingestionService.ingestYear(year, tier));
    }

    /**
     * Build a consistent response from an IngestionResult
     */
    private ResponseEntity<Map<String, Object>> buildResponse(IngestionResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isSuccess());
        response.put("message", result.getMessage());
        response.put("count", result.getCount());
        response.put("skipped", result.getSkipped());

        if (result.getErrorType() != null) {
            response.put("errorType", result.getErrorType());
        }

        // the success flag carries the business outcome
        return ResponseEntity.ok(response);
    }
}
