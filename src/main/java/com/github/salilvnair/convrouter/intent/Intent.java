package com.github.salilvnair.convrouter.intent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.model.Attributes;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One classification result. Immutable; the confidence level is always derived from the score.
 * The timestamp comes from the caller's clock and is required.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "intentId")
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Intent {

    public static final String DEFAULT_LANGUAGE = "en";

    private final String intentId;
    private final IntentType type;
    private final double confidence;
    private final String userInput;
    private final Attributes entities;
    private final Attributes parameters;
    private final String language;
    private final Sentiment sentiment;
    private final Instant timestamp;

    @Builder(toBuilder = true)
    private Intent(String intentId,
                   IntentType type,
                   double confidence,
                   String userInput,
                   Attributes entities,
                   Attributes parameters,
                   String language,
                   Sentiment sentiment,
                   Instant timestamp) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.INVALID_INPUT,
                    "Intent confidence must be within [0,1], got " + confidence
            );
        }
        if (timestamp == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_INPUT, "Intent timestamp is required");
        }
        this.intentId = intentId == null || intentId.isBlank() ? newId() : intentId;
        this.type = Objects.requireNonNullElse(type, IntentType.UNKNOWN);
        this.confidence = confidence;
        this.userInput = userInput == null ? "" : userInput;
        this.entities = entities == null ? Attributes.empty() : entities;
        this.parameters = parameters == null ? Attributes.empty() : parameters;
        this.language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        this.sentiment = sentiment;
        this.timestamp = timestamp;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    public boolean isUnknown() {
        return type == IntentType.UNKNOWN;
    }

    public static String newId() {
        return "intent_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
