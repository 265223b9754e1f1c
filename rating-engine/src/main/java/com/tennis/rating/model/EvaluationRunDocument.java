package com.tennis.rating.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration and aggregate metrics of one rating run.
 */
@Document(collection = "evaluation_runs")
public class EvaluationRunDocument {

    public static final int FIT_LEADERS = 10;

    @Id
    private String id;

    @Indexed(unique = true)
    private String runId;

    private int yearFrom;
    private int yearTo;
    private int testSizeYears;

    private int fitMatches;
    private int evaluatedMatches;
    private int excludedMatches;
    private int dataQualityWarnings;
    private int playersRated;

    private int correct;
    private double accuracy;
    private double brierScore;
    private double logLoss;

    private List<CalibrationBucket> calibration = new ArrayList<>();

    // ranking at the end of the fit window, before any held-out match
    private LocalDate fitSnapshotDate;
    private List<String> fitLeaders = new ArrayList<>();

    @Indexed
    private Instant createdAt;

    public EvaluationRunDocument() {
        this.createdAt = Instant.now();
    }

    public static EvaluationRunDocument from(String runId, RunResult result) {
        EvaluationReport report = result.evaluation();
        EvaluationRunDocument doc = new EvaluationRunDocument();
        doc.id = runId;
        doc.runId = runId;
        doc.yearFrom = result.config().yearFrom();
        doc.yearTo = result.config().yearTo();
        doc.testSizeYears = result.config().testSizeYears();
        doc.fitMatches = result.fitMatches();
        doc.evaluatedMatches = report.totalMatches();
        doc.excludedMatches = result.excludedMatches();
        doc.dataQualityWarnings = result.dataQualityWarnings();
        doc.playersRated = result.finalSnapshot().size();
        doc.correct = report.correct();
        doc.accuracy = report.accuracy();
        doc.brierScore = report.brierScore();
        doc.logLoss = report.logLoss();
        doc.calibration = new ArrayList<>(report.calibration());
        doc.fitSnapshotDate = result.fitSnapshot().asOf();
        doc.fitLeaders = result.fitSnapshot().ratings().stream()
                .limit(FIT_LEADERS)
                .map(PlayerRating::playerId)
                .toList();
        return doc;
    }

    public String getAccuracyPercent() {
        return String.format("%.1f%%", accuracy * 100);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public int getYearFrom() { return yearFrom; }
    public void setYearFrom(int yearFrom) { this.yearFrom = yearFrom; }

    public int getYearTo() { return yearTo; }
    public void setYearTo(int yearTo) { this.yearTo = yearTo; }

    public int getTestSizeYears() { return testSizeYears; }
    public void setTestSizeYears(int testSizeYears) { this.testSizeYears = testSizeYears; }

    public int getFitMatches() { return fitMatches; }
    public void setFitMatches(int fitMatches) { this.fitMatches = fitMatches; }

    public int getEvaluatedMatches() { return evaluatedMatches; }
    public void setEvaluatedMatches(int evaluatedMatches) { this.evaluatedMatches = evaluatedMatches; }

    public int getExcludedMatches() { return excludedMatches; }
    public void setExcludedMatches(int excludedMatches) { this.excludedMatches = excludedMatches; }

    public int getDataQualityWarnings() { return dataQualityWarnings; }
    public void setDataQualityWarnings(int dataQualityWarnings) { this.dataQualityWarnings = dataQualityWarnings; }

    public int getPlayersRated() { return playersRated; }
    public void setPlayersRated(int playersRated) { this.playersRated = playersRated; }

    public int getCorrect() { return correct; }
    public void setCorrect(int correct) { this.correct = correct; }

    public double getAccuracy() { return accuracy; }
    public void setAccuracy(double accuracy) { this.accuracy = accuracy; }

    public double getBrierScore() { return brierScore; }
    public void setBrierScore(double brierScore) { this.brierScore = brierScore; }

    public double getLogLoss() { return logLoss; }
    public void setLogLoss(double logLoss) { this.logLoss = logLoss; }

    public List<CalibrationBucket> getCalibration() { return calibration; }
    public void setCalibration(List<CalibrationBucket> calibration) { this.calibration = calibration; }

    public LocalDate getFitSnapshotDate() { return fitSnapshotDate; }
    public void setFitSnapshotDate(LocalDate fitSnapshotDate) { this.fitSnapshotDate = fitSnapshotDate; }

    public List<String> getFitLeaders() { return fitLeaders; }
    public void setFitLeaders(List<String> fitLeaders) { this.fitLeaders = fitLeaders; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
