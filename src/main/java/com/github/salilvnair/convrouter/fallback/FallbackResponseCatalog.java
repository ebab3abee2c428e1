package com.github.salilvnair.convrouter.fallback;

import com.github.salilvnair.convrouter.intent.IntentType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-type default replies. Types without an entry get {@link #GENERIC_RESPONSE}.
 */
@Component
public class FallbackResponseCatalog {

    public static final String GENERIC_RESPONSE =
            "I'm not sure how to help with that. Could you try asking in a different way?";

    private final Map<IntentType, String> responses = new ConcurrentHashMap<>(Map.of(
            IntentType.GREETING, "Hello! How can I help you today?",
            IntentType.QUESTION, "I'm not sure I understand your question. Could you rephrase it?",
            IntentType.COMMAND, "I'm not sure what you want me to do. Could you be more specific?",
            IntentType.HELP, "I'm here to help! What do you need assistance with?",
            IntentType.UNKNOWN, GENERIC_RESPONSE
    ));

    public String responseFor(IntentType type) {
        return get(type).orElse(GENERIC_RESPONSE);
    }

    public Optional<String> get(IntentType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(responses.get(type));
    }

    public void put(IntentType type, String response) {
        responses.put(type, response);
    }
}
