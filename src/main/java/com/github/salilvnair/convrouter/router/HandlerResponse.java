package com.github.salilvnair.convrouter.router;

import com.github.salilvnair.convrouter.intent.IntentType;

/**
 * Handler return value that also asks for a follow-up turn.
 */
public record HandlerResponse(Object payload, IntentType followupIntent) {

    public static HandlerResponse of(Object payload) {
        return new HandlerResponse(payload, null);
    }

    public static HandlerResponse withFollowup(Object payload, IntentType followupIntent) {
        return new HandlerResponse(payload, followupIntent);
    }
}
