package com.github.salilvnair.convrouter.intent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
