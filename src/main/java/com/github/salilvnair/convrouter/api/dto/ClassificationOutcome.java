package com.github.salilvnair.convrouter.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.MultiIntentResult;

import java.util.List;

/**
 * Either a single intent or a multi-intent result; {@link #primaryIntent()} works for both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationOutcome(Intent intent, MultiIntentResult multiIntent) {

    public static ClassificationOutcome single(Intent intent) {
        return new ClassificationOutcome(intent, null);
    }

    public static ClassificationOutcome multi(MultiIntentResult result) {
        return new ClassificationOutcome(null, result);
    }

    @JsonIgnore
    public boolean isMulti() {
        return multiIntent != null;
    }

    @JsonIgnore
    public Intent primaryIntent() {
        return isMulti() ? multiIntent.primaryIntent() : intent;
    }

    @JsonIgnore
    public List<Intent> allIntents() {
        return isMulti() ? multiIntent.allIntents() : List.of(intent);
    }
}
