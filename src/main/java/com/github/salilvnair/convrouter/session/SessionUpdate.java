package com.github.salilvnair.convrouter.session;

import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.model.Attributes;
import lombok.Builder;

/**
 * One turn's worth of changes to a session. Every field is optional.
 */
@Builder
public record SessionUpdate(
        Intent intent,
        Attributes contextData,
        Attributes preferences,
        String topic
) {

    public static SessionUpdate ofIntent(Intent intent) {
        return SessionUpdate.builder().intent(intent).build();
    }
}
