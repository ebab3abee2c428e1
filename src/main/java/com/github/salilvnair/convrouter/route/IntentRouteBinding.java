package com.github.salilvnair.convrouter.route;

/**
 * A handler bean that carries its own route. Every binding in the application context is
 * registered with the {@link RouteRegistry} at startup.
 */
public interface IntentRouteBinding extends RouteHandler {

    Route route();
}
