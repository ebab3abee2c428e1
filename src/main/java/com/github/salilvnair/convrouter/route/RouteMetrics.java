package com.github.salilvnair.convrouter.route;

import java.time.Duration;
import java.time.Instant;

/**
 * Execution statistics of one route. Each {@link #record} returns a new value.
 * <p>
 * The hour and day counters are tumbling windows: once a window has elapsed the next execution
 * starts a fresh one.
 */
public record RouteMetrics(
        String routeId,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        double avgExecutionTimeMs,
        double minExecutionTimeMs,
        double maxExecutionTimeMs,
        double avgConfidence,
        Instant lastExecution,
        long executionsLastHour,
        Instant hourWindowStart,
        long executionsLastDay,
        Instant dayWindowStart
) {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    public static RouteMetrics empty(String routeId) {
        return new RouteMetrics(routeId, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, null, 0, null, 0, null);
    }

    public RouteMetrics record(boolean success, double executionTimeMs, double confidence, Instant now) {
        long total = totalExecutions + 1;
        boolean first = totalExecutions == 0;

        boolean newHour = hourWindowStart == null || !now.isBefore(hourWindowStart.plus(HOUR));
        boolean newDay = dayWindowStart == null || !now.isBefore(dayWindowStart.plus(DAY));

        return new RouteMetrics(
                routeId,
                total,
                successfulExecutions + (success ? 1 : 0),
                failedExecutions + (success ? 0 : 1),
                first ? executionTimeMs : (avgExecutionTimeMs * (total - 1) + executionTimeMs) / total,
                first ? executionTimeMs : Math.min(minExecutionTimeMs, executionTimeMs),
                first ? executionTimeMs : Math.max(maxExecutionTimeMs, executionTimeMs),
                first ? confidence : (avgConfidence * (total - 1) + confidence) / total,
                now,
                newHour ? 1 : executionsLastHour + 1,
                newHour ? now : hourWindowStart,
                newDay ? 1 : executionsLastDay + 1,
                newDay ? now : dayWindowStart
        );
    }

    /** Percentage in [0,100]; 0 before the first execution. */
    public double successRate() {
        return totalExecutions == 0 ? 0.0 : successfulExecutions * 100.0 / totalExecutions;
    }

    public double errorRate() {
        return totalExecutions == 0 ? 0.0 : failedExecutions * 100.0 / totalExecutions;
    }
}
