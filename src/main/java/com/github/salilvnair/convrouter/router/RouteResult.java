package com.github.salilvnair.convrouter.router;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.util.JsonUtil;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResult {

    public static final String FALLBACK_ROUTE_ID = "fallback";

    private final String routeId;
    private final Intent intent;
    private final boolean success;
    private final Object response;
    private final String error;
    private final RouteErrorKind errorKind;
    private final double executionTimeMs;
    private final boolean requiresFollowup;
    private final IntentType followupIntent;
    private final FallbackStrategy fallbackStrategy;
    private final Instant timestamp;

    public boolean isFallback() {
        return FALLBACK_ROUTE_ID.equals(routeId);
    }

    /**
     * Flat view used when a result is stored in session context data.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("route_id", routeId);
        summary.put("intent_id", intent == null ? null : intent.getIntentId());
        summary.put("intent_type", intent == null ? null : intent.getType().code());
        summary.put("success", success);
        summary.put("response", response);
        if (error != null) {
            summary.put("error", error);
        }
        if (errorKind != null) {
            summary.put("error_kind", errorKind.name());
        }
        summary.put("execution_time_ms", executionTimeMs);
        if (followupIntent != null) {
            summary.put("followup_intent", followupIntent.code());
        }
        if (fallbackStrategy != null) {
            summary.put("fallback_strategy", fallbackStrategy.code());
        }
        return summary;
    }

    /**
     * {@link #summary()} as JSON text. A response Jackson cannot write is stored as its string form.
     */
    public String summaryJson() {
        Map<String, Object> summary = summary();
        try {
            return JsonUtil.toJson(summary);
        } catch (IllegalStateException e) {
            summary.put("response", String.valueOf(response));
            return JsonUtil.toJson(summary);
        }
    }
}
