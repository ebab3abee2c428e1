package com.github.salilvnair.convrouter.intent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {

    VERY_HIGH(0.9),
    HIGH(0.75),
    MEDIUM(0.5),
    LOW(0.3),
    VERY_LOW(0.0);

    private final double lowerBound;

    ConfidenceLevel(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static ConfidenceLevel of(double score) {
        if (score >= VERY_HIGH.lowerBound) return VERY_HIGH;
        if (score >= HIGH.lowerBound) return HIGH;
        if (score >= MEDIUM.lowerBound) return MEDIUM;
        if (score >= LOW.lowerBound) return LOW;
        return VERY_LOW;
    }

    public boolean isLowOrBelow() {
        return this == LOW || this == VERY_LOW;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
