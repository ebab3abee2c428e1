package com.github.salilvnair.convrouter.history;

import com.github.salilvnair.convrouter.intent.IntentType;

public record IntentCount(IntentType type, long count) {
}
