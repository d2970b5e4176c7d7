package com.dnsguard.detection.testutil;

import com.dnsguard.detection.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final long T0 = 1_739_886_764_000L;

    private TestDataFactory() {}

    public static QueryRecord query(String subject, String sourceKey, long observedAt) {
        return QueryRecord.builder()
                .subject(subject)
                .sourceKey(sourceKey)
                .observedAt(observedAt)
                .build();
    }

    /** Ordinary lookups from a handful of clients, one second apart. */
    public static List<QueryRecord> benignTraffic(int count) {
        return benignTraffic(count, T0);
    }

    public static List<QueryRecord> benignTraffic(int count, long start) {
        String[] domains = {"www.google.com", "mail.example.com", "api.github.com", "cdn.jsdelivr.net",
                "login.microsoftonline.com", "news.ycombinator.com", "static.xx.fbcdn.net"};
        List<QueryRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(query(domains[i % domains.length], "10.0.0." + (i % 5), start + i * 1000L));
        }
        return records;
    }

    public static String tunnelSubject(int i) {
        return String.format("%08x9f3a7c1e5b2d%04d.4a6e8c0b2f.t.evil-exfil.com", i * 2654435761L & 0xffffffffL, i);
    }

    public static FeatureVector uniformVector(double value) {
        double[] values = new double[Feature.COUNT];
        Arrays.fill(values, value);
        return FeatureVector.of(values);
    }

    public static ThresholdState thresholds(double suspicious, double high) {
        return new ThresholdState(suspicious, high);
    }

    public static FeedbackRequest feedback(String subjectId, boolean falsePositive, double score) {
        return FeedbackRequest.builder()
                .subjectId(subjectId)
                .falsePositive(falsePositive)
                .score(score)
                .analyst("soc-analyst-1")
                .build();
    }

    public static BaselineCalibration calibration(double min, double max) {
        return new BaselineCalibration(min, max, (min + max) / 2, (max - min) / 4);
    }

    public static AnalysisResult analysisResult(String subject, String sourceKey, double score, Severity severity) {
        return AnalysisResult.builder()
                .subject(subject)
                .sourceKey(sourceKey)
                .observedAt(T0)
                .features(uniformVector(1.0))
                .score(score)
                .severity(severity)
                .mode(ScoreMode.CALIBRATED)
                .build();
    }

    public static ThresholdChangeEvent change(double oldSuspicious, double newSuspicious,
                                              double oldHigh, double newHigh, AdjustmentReason reason) {
        return ThresholdChangeEvent.builder()
                .oldSuspicious(oldSuspicious)
                .newSuspicious(newSuspicious)
                .oldHigh(oldHigh)
                .newHigh(newHigh)
                .reason(reason)
                .description(reason.name())
                .falsePositiveRate(0.13)
                .alertVolume(40)
                .changedAt(T0)
                .build();
    }
}
