package com.github.salilvnair.convrouter.fallback;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FallbackStrategy {
    ASK_CLARIFICATION("ask_clarification"),
    USE_DEFAULT("use_default"),
    USE_HISTORY("use_history"),
    ESCALATE_TO_HUMAN("escalate_to_human"),
    PROVIDE_OPTIONS("provide_options");

    private final String code;

    FallbackStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
