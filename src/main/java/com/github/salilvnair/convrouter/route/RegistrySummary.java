package com.github.salilvnair.convrouter.route;

import com.github.salilvnair.convrouter.intent.IntentType;

import java.util.Map;

public record RegistrySummary(
        int totalRoutes,
        int enabledRoutes,
        int disabledRoutes,
        Map<IntentType, Integer> routesByIntent,
        long totalExecutions,
        long totalSuccesses,
        long totalFailures,
        double overallSuccessRate
) {

    public RegistrySummary {
        routesByIntent = Map.copyOf(routesByIntent);
    }
}
