package com.github.salilvnair.convrouter.route;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.intent.IntentType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Where an intent type may be sent. Lower priority values are tried first.
 * <p>
 * {@code rateLimit} is descriptive only; nothing enforces it.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Route {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    private final String routeId;
    private final IntentType intentType;
    private final String handlerName;
    private final int priority;
    private final boolean requiresAuth;
    private final List<String> requiredContextKeys;
    private final double minConfidence;
    private final Integer maxConcurrent;
    private final Integer rateLimit;
    private final String description;
    private final List<String> tags;
    private final boolean enabled;

    @Builder(toBuilder = true)
    private Route(String routeId,
                  IntentType intentType,
                  String handlerName,
                  Integer priority,
                  boolean requiresAuth,
                  List<String> requiredContextKeys,
                  Double minConfidence,
                  Integer maxConcurrent,
                  Integer rateLimit,
                  String description,
                  List<String> tags,
                  Boolean enabled) {
        if (routeId == null || routeId.isBlank()) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_ROUTE, "Route id is required");
        }
        if (intentType == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_ROUTE, "Route " + routeId + " has no intent type");
        }
        int effectivePriority = priority == null ? DEFAULT_PRIORITY : priority;
        if (effectivePriority < MIN_PRIORITY || effectivePriority > MAX_PRIORITY) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.INVALID_ROUTE,
                    "Route " + routeId + " priority must be within [1,10], got " + effectivePriority
            );
        }
        double effectiveMin = minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence;
        if (effectiveMin < 0.0 || effectiveMin > 1.0) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.INVALID_ROUTE,
                    "Route " + routeId + " minConfidence must be within [0,1], got " + effectiveMin
            );
        }
        this.routeId = routeId;
        this.intentType = intentType;
        this.handlerName = handlerName == null ? routeId : handlerName;
        this.priority = effectivePriority;
        this.requiresAuth = requiresAuth;
        this.requiredContextKeys = requiredContextKeys == null ? List.of() : List.copyOf(requiredContextKeys);
        this.minConfidence = effectiveMin;
        this.maxConcurrent = maxConcurrent;
        this.rateLimit = rateLimit;
        this.description = description == null ? "" : description;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.enabled = enabled == null || enabled;
    }

    public Route withEnabled(boolean value) {
        return enabled == value ? this : toBuilder().enabled(value).build();
    }
}
