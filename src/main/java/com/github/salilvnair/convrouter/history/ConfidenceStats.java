package com.github.salilvnair.convrouter.history;

import java.util.List;

/**
 * Confidence summary. Percentiles use the nearest-rank method.
 */
public record ConfidenceStats(double avg, double min, double max, long count, double p50, double p90) {

    public static final ConfidenceStats EMPTY = new ConfidenceStats(0.0, 0.0, 0.0, 0, 0.0, 0.0);

    static ConfidenceStats of(List<Double> confidences) {
        if (confidences.isEmpty()) {
            return EMPTY;
        }
        double[] sorted = confidences.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double sum = 0.0;
        for (double c : sorted) {
            sum += c;
        }
        return new ConfidenceStats(
                sum / sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                sorted.length,
                percentile(sorted, 50),
                percentile(sorted, 90)
        );
    }

    private static double percentile(double[] sorted, int p) {
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }
}
