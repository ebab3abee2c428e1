package com.github.salilvnair.convrouter.fallback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FallbackResult {

    private final FallbackStrategy strategyUsed;
    private final Intent intent;
    private final boolean handled;
    private final String response;
    @Singular
    private final List<String> suggestedActions;
    @Singular
    private final List<String> clarificationOptions;
    /** Best guess of what the user is continuing with, when history suggests one. */
    private final IntentType continuationIntent;
    private final Instant timestamp;
}
