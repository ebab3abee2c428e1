package com.github.salilvnair.convrouter.history;

import java.util.List;

public record UserPatterns(
        String userId,
        long totalIntents,
        List<IntentCount> topIntents,
        double avgConfidence,
        String preferredLanguage,
        int mostActiveHour,
        long intentsLast24h
) {

    public UserPatterns {
        topIntents = List.copyOf(topIntents);
    }
}
