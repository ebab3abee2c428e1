package com.github.salilvnair.convrouter.history;

import java.time.Instant;

/**
 * Intents tracked within the UTC hour starting at {@code hour}.
 */
public record HourlyVolume(Instant hour, long count) {
}
