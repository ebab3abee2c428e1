package com.github.salilvnair.convrouter.exception;

public enum IntentRoutingErrorCode {

    // =========================
    // Classification errors
    // =========================
    INVALID_INPUT(
            "Classifier input must be non-null text",
            false
    ),

    INVALID_PATTERN(
            "Intent pattern definition is invalid",
            false
    ),

    PATTERN_LOAD_FAILED(
            "Failed to load intent pattern library",
            false
    ),

    // =========================
    // Route registry errors
    // =========================
    ROUTE_ALREADY_REGISTERED(
            "Route is already registered",
            false
    ),

    ROUTE_NOT_FOUND(
            "Route not found",
            true
    ),

    INVALID_ROUTE(
            "Route definition is invalid",
            false
    ),

    UNSUPPORTED_METRIC(
            "Unsupported route ranking metric",
            false
    ),

    // =========================
    // Fallback errors
    // =========================
    FALLBACK_RESOLVER_MISSING(
            "No fallback resolver registered for strategy",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    IntentRoutingErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
