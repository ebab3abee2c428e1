package com.github.salilvnair.convrouter.history;

import com.github.salilvnair.convrouter.intent.IntentType;
import lombok.Builder;

import java.time.Instant;

/**
 * Filters for {@link IntentHistoryTracker#getHistory}. Null fields do not filter; {@code limit} keeps
 * the most recent entries.
 */
@Builder
public record HistoryQuery(String userId, IntentType type, Instant since, Integer limit) {

    public static HistoryQuery all() {
        return HistoryQuery.builder().build();
    }

    public static HistoryQuery forUser(String userId) {
        return HistoryQuery.builder().userId(userId).build();
    }
}
