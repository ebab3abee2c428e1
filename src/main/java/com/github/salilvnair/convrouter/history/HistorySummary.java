package com.github.salilvnair.convrouter.history;

import com.github.salilvnair.convrouter.intent.ConfidenceLevel;
import com.github.salilvnair.convrouter.intent.Sentiment;

import java.util.List;
import java.util.Map;

public record HistorySummary(
        long totalIntents,
        int uniqueUsers,
        long intentsLastHour,
        long intentsLast24h,
        List<IntentCount> topIntents,
        ConfidenceStats confidence,
        Map<ConfidenceLevel, Long> confidenceDistribution,
        Map<Sentiment, Long> sentimentDistribution
) {

    public HistorySummary {
        topIntents = List.copyOf(topIntents);
        confidenceDistribution = Map.copyOf(confidenceDistribution);
        sentimentDistribution = Map.copyOf(sentimentDistribution);
    }
}
