package com.github.salilvnair.convrouter.router;

import com.github.salilvnair.convrouter.fallback.FallbackHandler;
import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.MultiIntentResult;
import com.github.salilvnair.convrouter.model.Attributes;
import com.github.salilvnair.convrouter.route.Route;
import com.github.salilvnair.convrouter.route.RouteHandler;
import com.github.salilvnair.convrouter.route.RouteRegistry;
import com.github.salilvnair.convrouter.session.IntentContext;
import com.github.salilvnair.convrouter.session.SessionUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sends an intent to the first eligible route registered for its type, or to the fallback handler.
 * <p>
 * Ineligible routes are skipped and logged. Handler failures, timeouts and fallbacks are all
 * reported through {@link RouteResult}; nothing is rethrown to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentRouter {

    public static final String RESULT_KEY_PREFIX = "result_";

    private final RouteRegistry registry;
    private final FallbackHandler fallbackHandler;
    private final HandlerInvoker handlerInvoker;
    private final Clock clock;

    public RouteResult route(Intent intent, IntentContext context, boolean authenticated) {
        return route(intent, context, authenticated, null);
    }

    public RouteResult route(Intent intent, IntentContext context, boolean authenticated, Duration timeout) {
        List<Route> candidates = registry.getRoutesForIntent(intent.getType(), true);
        if (candidates.isEmpty()) {
            log.warn("No routes registered for intent {}", intent.getType());
            return fallback(intent, context);
        }

        for (Route route : candidates) {
            List<String> problems = ineligibility(route, intent, context, authenticated);
            if (!problems.isEmpty()) {
                log.warn("Skipping route {} for intent {}: {}", route.getRouteId(), intent.getIntentId(), problems);
                continue;
            }
            return execute(route, intent, context, timeout);
        }

        log.info("No eligible route for intent {} ({}), using fallback", intent.getIntentId(), intent.getType());
        return fallback(intent, context);
    }

    /**
     * Routes every intent in execution order. After each step the context records the intent and
     * the step's result summary under {@code result_<intentId>}, so later handlers see earlier results.
     */
    public List<RouteResult> routeMulti(MultiIntentResult multi, IntentContext context, boolean authenticated) {
        List<RouteResult> results = new ArrayList<>(multi.executionOrder().size());
        for (String intentId : multi.executionOrder()) {
            Optional<Intent> intent = multi.findIntent(intentId);
            if (intent.isEmpty()) {
                log.warn("Intent {} listed in execution order but not in the result, skipping", intentId);
                continue;
            }
            RouteResult result = route(intent.get(), context, authenticated);
            results.add(result);
            if (context != null) {
                SessionUpdate update = SessionUpdate.builder()
                        .intent(intent.get())
                        .contextData(Attributes.empty().with(RESULT_KEY_PREFIX + intentId, result.summaryJson()))
                        .build();
                context.apply(update, clock.instant());
            }
        }
        return results;
    }

    public RouteValidation validateRoute(String routeId, Intent intent, IntentContext context, boolean authenticated) {
        Optional<Route> route = registry.getRoute(routeId);
        if (route.isEmpty()) {
            return RouteValidation.of(List.of("Route " + routeId + " not found"));
        }
        Route r = route.get();
        List<String> reasons = new ArrayList<>();
        if (!r.isEnabled()) {
            reasons.add("Route is disabled");
        }
        if (r.getIntentType() != intent.getType()) {
            reasons.add("Route expects " + r.getIntentType().code() + ", got " + intent.getType().code());
        }
        reasons.addAll(ineligibility(r, intent, context, authenticated));
        return RouteValidation.of(reasons);
    }

    private RouteResult execute(Route route, Intent intent, IntentContext context, Duration timeout) {
        long start = System.nanoTime();
        Optional<RouteHandler> handler = registry.getHandler(route.getRouteId());
        if (handler.isEmpty()) {
            double elapsed = elapsedMs(start);
            registry.updateMetrics(route.getRouteId(), false, elapsed, intent.getConfidence());
            log.error("Route {} has no handler", route.getRouteId());
            return failure(route, intent, "Handler not found for route: " + route.getRouteId(), RouteErrorKind.HANDLER_MISSING, elapsed);
        }

        HandlerOutcome outcome = handlerInvoker.invoke(handler.get(), intent, context, timeout);
        double elapsed = elapsedMs(start);
        boolean success = outcome instanceof HandlerOutcome.Completed;
        registry.updateMetrics(route.getRouteId(), success, elapsed, intent.getConfidence());

        if (outcome instanceof HandlerOutcome.Completed completed) {
            log.debug("Route {} handled intent {} in {} ms", route.getRouteId(), intent.getIntentId(), elapsed);
            return completed(route, intent, completed.response(), elapsed);
        }
        if (outcome instanceof HandlerOutcome.TimedOut timedOut) {
            log.error("Route {} timed out after {} ms", route.getRouteId(), timedOut.timeout().toMillis());
            return failure(route, intent, "Handler timed out after " + timedOut.timeout().toMillis() + " ms",
                    RouteErrorKind.TIMEOUT, elapsed);
        }
        if (outcome instanceof HandlerOutcome.Cancelled cancelled) {
            log.error("Route {} was cancelled: {}", route.getRouteId(), cancelled.reason());
            return failure(route, intent, cancelled.reason(), RouteErrorKind.CANCELLED, elapsed);
        }
        Throwable cause = ((HandlerOutcome.Failed) outcome).cause();
        log.error("Route {} failed for intent {}: {}", route.getRouteId(), intent.getIntentId(), cause.getMessage(), cause);
        return failure(route, intent, String.valueOf(cause.getMessage()), RouteErrorKind.HANDLER_FAILURE, elapsed);
    }

    private RouteResult completed(Route route, Intent intent, Object response, double elapsed) {
        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .routeId(route.getRouteId())
                .intent(intent)
                .success(true)
                .executionTimeMs(elapsed)
                .timestamp(clock.instant());
        if (response instanceof HandlerResponse handlerResponse) {
            builder.response(handlerResponse.payload())
                    .requiresFollowup(handlerResponse.followupIntent() != null)
                    .followupIntent(handlerResponse.followupIntent());
        } else {
            builder.response(response);
        }
        return builder.build();
    }

    private RouteResult failure(Route route, Intent intent, String error, RouteErrorKind kind, double elapsed) {
        return RouteResult.builder()
                .routeId(route.getRouteId())
                .intent(intent)
                .success(false)
                .error(error)
                .errorKind(kind)
                .executionTimeMs(elapsed)
                .timestamp(clock.instant())
                .build();
    }

    private RouteResult fallback(Intent intent, IntentContext context) {
        FallbackResult fallback = fallbackHandler.handle(intent, context);
        return RouteResult.builder()
                .routeId(RouteResult.FALLBACK_ROUTE_ID)
                .intent(intent)
                .success(fallback.isHandled())
                .response(fallback.getResponse())
                .executionTimeMs(0.0)
                .requiresFollowup(fallback.getContinuationIntent() != null)
                .followupIntent(fallback.getContinuationIntent())
                .fallbackStrategy(fallback.getStrategyUsed())
                .timestamp(clock.instant())
                .build();
    }

    private static List<String> ineligibility(Route route, Intent intent, IntentContext context, boolean authenticated) {
        List<String> problems = new ArrayList<>();
        if (intent.getConfidence() < route.getMinConfidence()) {
            problems.add("Confidence " + intent.getConfidence() + " below minimum " + route.getMinConfidence());
        }
        if (route.isRequiresAuth() && !authenticated) {
            problems.add("Route requires authentication");
        }
        if (!route.getRequiredContextKeys().isEmpty()) {
            if (context == null) {
                problems.add("Route requires context but none provided");
            } else {
                Attributes data = context.getContextData();
                List<String> missing = route.getRequiredContextKeys().stream()
                        .filter(key -> !data.containsKey(key))
                        .toList();
                if (!missing.isEmpty()) {
                    problems.add("Missing context keys " + missing);
                }
            }
        }
        return problems;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
