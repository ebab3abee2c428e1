package com.github.salilvnair.convrouter.intent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum IntentType {

    // core
    GREETING,
    QUESTION,
    COMMAND,
    FEEDBACK,

    // lending
    LOAN_APPLICATION,
    COLLATERAL_CHECK,
    CREDIT_HISTORY,
    DOCUMENT_UPLOAD,

    // career
    PROFILE_ANALYSIS,
    JOB_MATCHING,
    SKILL_RECOMMENDATION,

    // system
    HELP,
    STATUS,
    SETTINGS,

    // composite
    MULTI_INTENT,
    CLARIFICATION_NEEDED,
    UNKNOWN;

    /**
     * Lower-case code, also used as the session topic value.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return code().replace('_', ' ');
    }

    public static Optional<IntentType> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (IntentType value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static IntentType fromJson(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown intent type: " + code));
    }
}
