package com.github.salilvnair.convrouter.route;

import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.session.IntentContext;

/**
 * Business logic behind a route. Return a {@code HandlerResponse} to also suggest a follow-up intent;
 * any other value is used as the response payload as is.
 */
@FunctionalInterface
public interface RouteHandler {

    Object execute(Intent intent, IntentContext context) throws Exception;
}
