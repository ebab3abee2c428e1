package com.github.salilvnair.convrouter.history;

import com.github.salilvnair.convrouter.intent.Intent;

/**
 * A history entry. The user id is kept with the entry so eviction can find the index it lives in.
 */
public record TrackedIntent(Intent intent, String userId, long sequence) {
}
