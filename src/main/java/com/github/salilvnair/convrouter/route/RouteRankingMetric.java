package com.github.salilvnair.convrouter.route;

import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;

import java.util.Comparator;
import java.util.Locale;

public enum RouteRankingMetric {

    EXECUTIONS("executions", Comparator.comparingLong(RouteMetrics::totalExecutions).reversed()),
    SUCCESS_RATE("success_rate", Comparator.comparingDouble(RouteMetrics::successRate).reversed()),
    AVG_LATENCY("avg_time", Comparator.comparingDouble(RouteMetrics::avgExecutionTimeMs));

    private final String code;
    private final Comparator<RouteMetrics> order;

    RouteRankingMetric(String code, Comparator<RouteMetrics> order) {
        this.code = code;
        this.order = order;
    }

    public String code() {
        return code;
    }

    Comparator<RouteMetrics> order() {
        return order;
    }

    public static RouteRankingMetric fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (RouteRankingMetric metric : values()) {
                if (metric.code.equals(normalized) || metric.name().equalsIgnoreCase(normalized)) {
                    return metric;
                }
            }
        }
        throw new IntentRoutingException(IntentRoutingErrorCode.UNSUPPORTED_METRIC, "Unknown route metric: " + code);
    }
}
