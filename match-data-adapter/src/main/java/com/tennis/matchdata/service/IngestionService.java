package com.tennis.matchdata.service;

import com.tennis.matchdata.client.ResultsFileClient;
import com.tennis.matchdata.model.IngestionResult;
import com.tennis.matchdata.model.MatchDocument;
import com.tennis.matchdata.model.SourceTier;
import com.tennis.matchdata.parser.ParsedResults;
import com.tennis.matchdata.parser.ParsedScore;
import com.tennis.matchdata.parser.ResultRow;
import com.tennis.matchdata.parser.ResultsCsvParser;
import com.tennis.matchdata.parser.RoundSchedule;
import com.tennis.matchdata.parser.ScoreParser;
import com.tennis.matchdata.repository.MatchRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Downloads yearly results files and stores one normalized document per match.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final int BATCH_SIZE = 1000;

    private final ResultsFileClient resultsClient;
    private final ResultsCsvParser csvParser;
    private final ScoreParser scoreParser;
    private final RoundSchedule roundSchedule;
    private final MatchRepository matchRepository;

    public IngestionService(
            ResultsFileClient resultsClient,
            ResultsCsvParser csvParser,
            ScoreParser scoreParser,
            RoundSchedule roundSchedule,
            MatchRepository matchRepository
    ) {
        this.resultsClient = resultsClient;
        this.csvParser = csvParser;
        this.scoreParser = scoreParser;
        this.roundSchedule = roundSchedule;
        this.matchRepository = matchRepository;
    }

    /**
     * Ingest every tier for each year in {@code [yearFrom, yearTo]}.
     * A failing file is reported and the remaining files are still ingested.
     */
    public IngestionResult ingestYears(int yearFrom, int yearTo) {
        if (yearFrom > yearTo) {
            throw new IllegalArgumentException(String.format(
                    "yearFrom (%d) must not be after yearTo (%d)", yearFrom, yearTo));
        }
        log.info("Ingesting results for {}-{}", yearFrom, yearTo);

        int totalCount = 0;
        int totalSkipped = 0;
        int files = 0;
        List<String> failures = new ArrayList<>();

        for (int year = yearFrom; year <= yearTo; year++) {
            for (SourceTier tier : SourceTier.values()) {
                files++;
                IngestionResult result = ingestYear(year, tier);
                if (result.isSuccess()) {
                    totalCount += result.getCount();
                    totalSkipped += result.getSkipped();
                } else {
                    failures.add(year + " " + tier + ": " + result.getMessage());
                }
            }
        }

        if (failures.isEmpty()) {
            log.info("Ingested {} matches from {} files ({} skipped)", totalCount, files, totalSkipped);
            return IngestionResult.success(totalCount, totalSkipped,
                    String.format("Ingested %d matches from %d files", totalCount, files));
        }
        if (failures.size() == files) {
            log.error("All {} results files failed", files);
            return IngestionResult.failure("All files failed: " + String.join("; ", failures), "ALL_FAILED");
        }

        log.warn("Ingested {} matches, {} of {} files failed", totalCount, failures.size(), files);
        return IngestionResult.partialSuccess(totalCount, totalSkipped, String.format(
                "Ingested %d matches; %d of %d files failed: %s",
                totalCount, failures.size(), files, String.join("; ", failures)));
    }

    /**
     * Ingest one results file. Re-ingesting a year overwrites its matches in place.
     */
    public IngestionResult ingestYear(int year, SourceTier tier) {
        log.info("Ingesting {} results for {}", tier, year);

        try {
            String content = resultsClient.fetchYear(tier, year);
            ParsedResults parsed = csvParser.parse(content);
            Map<ResultRow, LocalDate> dates = roundSchedule.inferDates(parsed.rows());

            List<MatchDocument> documents = new ArrayList<>(parsed.rows().size());
            int skipped = parsed.skippedLines();
            int withoutScore = 0;

            for (ResultRow row : parsed.rows()) {
                MatchDocument doc = toDocument(row, tier, year, dates.get(row));
                if (doc == null) {
                    skipped++;
                    continue;
                }
                if (!doc.hasScore()) {
                    withoutScore++;
                }
                documents.add(doc);
            }

            for (int i = 0; i < documents.size(); i += BATCH_SIZE) {
                matchRepository.saveAll(documents.subList(i, Math.min(i + BATCH_SIZE, documents.size())));
            }

            if (withoutScore > 0) {
                log.warn("{} {} matches in {} have no usable score", withoutScore, tier, year);
            }
            log.info("Ingested {} {} matches for {} ({} skipped)", documents.size(), tier, year, skipped);
            return IngestionResult.success(documents.size(), skipped,
                    String.format("Ingested %d %s matches for %d", documents.size(), tier, year));

        } catch (WebClientResponseException e) {
            log.error("HTTP error while downloading {} results for {}: {}", tier, year, e.getStatusCode());
            return IngestionResult.sourceError(e.getStatusCode().value(), extractErrorHint(e));
        } catch (Exception e) {
            log.error("Error ingesting {} results for {}: {}", tier, year, e.getMessage(), e);
            return IngestionResult.failure("Error ingesting " + tier + " " + year + ": " + e.getMessage());
        }
    }

    /**
     * Normalize a row, or return null if both sides name the same player.
     */
    MatchDocument toDocument(ResultRow row, SourceTier tier, int year, LocalDate matchDate) {
        String winnerKey = row.winnerKey();
        String loserKey = row.loserKey();
        if (winnerKey.equals(loserKey)) {
            log.warn("Skipping {} match {} in {}: same player on both sides ({})",
                    tier, row.matchNum(), row.tourneyName(), winnerKey);
            return null;
        }

        boolean winnerIsA = winnerKey.compareTo(loserKey) < 0;
        String tournamentKey = tournamentKey(row);

        MatchDocument doc = new MatchDocument();
        String matchKey = matchKey(tier, tournamentKey, row);
        doc.setId(matchKey);
        doc.setMatchKey(matchKey);
        doc.setMatchDate(matchDate != null ? matchDate : row.tourneyDate());
        doc.setTier(tier.name());
        doc.setSourceCode(tier.getCode());
        doc.setSurface(row.surface());
        doc.setSourceYear(year);

        doc.setTournamentKey(tournamentKey);
        doc.setTournamentName(row.tourneyName());
        doc.setTournamentStart(row.tourneyDate());
        doc.setRound(row.round());
        doc.setMatchNum(row.matchNum());

        doc.setPlayerAKey(winnerIsA ? winnerKey : loserKey);
        doc.setPlayerAName(winnerIsA ? row.winnerName() : row.loserName());
        doc.setPlayerBKey(winnerIsA ? loserKey : winnerKey);
        doc.setPlayerBName(winnerIsA ? row.loserName() : row.winnerName());
        doc.setWinnerKey(winnerKey);

        doc.setRawScore(row.score());
        ParsedScore score = scoreParser.parse(row.score());
        if (score != null) {
            doc.setWinnerGames(score.winnerGames());
            doc.setWinnerSets(score.winnerSets());
            doc.setLoserGames(score.loserGames());
            doc.setLoserSets(score.loserSets());
        }

        Document raw = new Document();
        row.columns().forEach(raw::append);
        doc.setRaw(raw);
        doc.setFetchedAt(Instant.now());
        return doc;
    }

    private static String tournamentKey(ResultRow row) {
        if (row.tourneyId() != null) {
            return row.tourneyId();
        }
        return row.tourneyDate().format(DateTimeFormatter.BASIC_ISO_DATE) + "-" + row.tourneyName();
    }

    private static String matchKey(SourceTier tier, String tournamentKey, ResultRow row) {
        String within = row.matchNum() != null
                ? row.matchNum()
                : row.round() + "-" + row.winnerKey() + "-" + row.loserKey();
        return tier.name() + "-" + tournamentKey + "-" + within;
    }

    private String extractErrorHint(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == 404) {
            return "No results file published for this year";
        }
        if (status == 429) {
            return "Rate limited by the results host";
        }
        if (status >= 500) {
            return "Results host error";
        }
        return e.getStatusText();
    }
}
