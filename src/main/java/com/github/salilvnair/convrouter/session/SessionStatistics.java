package com.github.salilvnair.convrouter.session;

import java.util.Map;

public record SessionStatistics(
        int totalSessions,
        long totalInteractions,
        double avgInteractionsPerSession,
        double avgSessionAgeMinutes,
        Map<String, Integer> sessionsByLanguage,
        long sessionTimeoutMinutes
) {

    public SessionStatistics {
        sessionsByLanguage = Map.copyOf(sessionsByLanguage);
    }
}
