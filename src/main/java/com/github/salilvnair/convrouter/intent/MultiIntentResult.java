package com.github.salilvnair.convrouter.intent;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record MultiIntentResult(
        Intent primaryIntent,
        List<Intent> secondaryIntents,
        List<String> executionOrder,
        boolean requiresClarification
) {

    public MultiIntentResult {
        Objects.requireNonNull(primaryIntent, "primaryIntent");
        secondaryIntents = secondaryIntents == null ? List.of() : List.copyOf(secondaryIntents);
        executionOrder = executionOrder == null ? List.of(primaryIntent.getIntentId()) : List.copyOf(executionOrder);
    }

    @JsonIgnore
    public List<Intent> allIntents() {
        List<Intent> all = new ArrayList<>(secondaryIntents.size() + 1);
        all.add(primaryIntent);
        all.addAll(secondaryIntents);
        return all;
    }

    public int intentCount() {
        return 1 + secondaryIntents.size();
    }

    public Optional<Intent> findIntent(String intentId) {
        if (intentId == null) {
            return Optional.empty();
        }
        return allIntents().stream()
                .filter(i -> intentId.equals(i.getIntentId()))
                .findFirst();
    }
}
