package com.github.salilvnair.convrouter.route;

import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.intent.IntentType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes, their handlers and their execution metrics.
 * <p>
 * Routes for one intent type are ordered by priority, then by the order they were registered in.
 * Metrics are immutable values replaced atomically per route id.
 */
@Slf4j
@Component
public class RouteRegistry {

    private final Clock clock;
    private final List<IntentRouteBinding> bindings;

    private final Map<String, RegisteredRoute> routes = new ConcurrentHashMap<>();
    private final Map<String, RouteMetrics> metrics = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public RouteRegistry(Clock clock, List<IntentRouteBinding> bindings) {
        this.clock = clock;
        this.bindings = bindings == null ? List.of() : bindings;
    }

    @PostConstruct
    public void init() {
        for (IntentRouteBinding binding : bindings) {
            register(binding.route(), binding, false);
        }
        if (!bindings.isEmpty()) {
            log.info("Registered {} route binding(s) from the application context", bindings.size());
        }
    }

    public void register(Route route, RouteHandler handler) {
        register(route, handler, false);
    }

    public void register(Route route, RouteHandler handler, boolean override) {
        if (route == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_ROUTE, "Route is required");
        }
        if (handler == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_ROUTE, "Route " + route.getRouteId() + " has no handler");
        }
        routes.compute(route.getRouteId(), (id, existing) -> {
            if (existing != null && !override) {
                throw new IntentRoutingException(
                        IntentRoutingErrorCode.ROUTE_ALREADY_REGISTERED,
                        "Route " + id + " already registered; pass override=true to replace it"
                );
            }
            return new RegisteredRoute(route, handler, sequence.incrementAndGet());
        });
        metrics.putIfAbsent(route.getRouteId(), RouteMetrics.empty(route.getRouteId()));
        log.info("Registered route {} for intent {} (priority {})", route.getRouteId(), route.getIntentType(), route.getPriority());
    }

    public void unregister(String routeId) {
        if (routeId == null || routes.remove(routeId) == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.ROUTE_NOT_FOUND, "Route " + routeId + " not found");
        }
        log.info("Unregistered route {}", routeId);
    }

    public Optional<Route> getRoute(String routeId) {
        return Optional.ofNullable(routeId).map(routes::get).map(RegisteredRoute::route);
    }

    public Optional<RouteHandler> getHandler(String routeId) {
        return Optional.ofNullable(routeId).map(routes::get).map(RegisteredRoute::handler);
    }

    public List<Route> getRoutesForIntent(IntentType type, boolean enabledOnly) {
        return routes.values().stream()
                .filter(r -> r.route().getIntentType() == type)
                .filter(r -> !enabledOnly || r.route().isEnabled())
                .sorted(RegisteredRoute.ORDER)
                .map(RegisteredRoute::route)
                .toList();
    }

    public List<Route> getRoutesForIntent(IntentType type) {
        return getRoutesForIntent(type, true);
    }

    public List<Route> listRoutes(IntentType type, boolean enabledOnly) {
        return routes.values().stream()
                .filter(r -> type == null || r.route().getIntentType() == type)
                .filter(r -> !enabledOnly || r.route().isEnabled())
                .sorted(Comparator.comparing((RegisteredRoute r) -> r.route().getIntentType()).thenComparing(RegisteredRoute.ORDER))
                .map(RegisteredRoute::route)
                .toList();
    }

    public boolean enable(String routeId) {
        return setEnabled(routeId, true);
    }

    public boolean disable(String routeId) {
        return setEnabled(routeId, false);
    }

    public RouteMetrics updateMetrics(String routeId, boolean success, double executionTimeMs, double confidence) {
        return metrics.compute(routeId, (id, current) ->
                (current == null ? RouteMetrics.empty(id) : current)
                        .record(success, executionTimeMs, confidence, clock.instant()));
    }

    public Optional<RouteMetrics> getMetrics(String routeId) {
        return Optional.ofNullable(routeId).map(metrics::get);
    }

    public Map<String, RouteMetrics> getAllMetrics() {
        return Map.copyOf(metrics);
    }

    public List<RouteRanking> getTopRoutes(int n, RouteRankingMetric by) {
        if (by == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.UNSUPPORTED_METRIC, "Ranking metric is required");
        }
        return metrics.values().stream()
                .sorted(by.order().thenComparing(RouteMetrics::routeId))
                .limit(Math.max(0, n))
                .map(m -> new RouteRanking(m.routeId(), m))
                .toList();
    }

    public void resetMetrics(String routeId) {
        if (routeId != null) {
            metrics.computeIfPresent(routeId, (id, current) -> RouteMetrics.empty(id));
            log.info("Reset metrics for route {}", routeId);
            return;
        }
        metrics.clear();
        routes.keySet().forEach(id -> metrics.put(id, RouteMetrics.empty(id)));
        log.info("Reset metrics for all routes");
    }

    public RegistrySummary getSummary() {
        List<Route> all = routes.values().stream().map(RegisteredRoute::route).toList();
        int enabled = (int) all.stream().filter(Route::isEnabled).count();
        Map<IntentType, Integer> byIntent = new EnumMap<>(IntentType.class);
        all.forEach(r -> byIntent.merge(r.getIntentType(), 1, Integer::sum));

        long executions = 0;
        long successes = 0;
        long failures = 0;
        for (RouteMetrics m : metrics.values()) {
            executions += m.totalExecutions();
            successes += m.successfulExecutions();
            failures += m.failedExecutions();
        }
        return new RegistrySummary(
                all.size(),
                enabled,
                all.size() - enabled,
                new LinkedHashMap<>(byIntent),
                executions,
                successes,
                failures,
                executions == 0 ? 0.0 : successes * 100.0 / executions
        );
    }

    private boolean setEnabled(String routeId, boolean enabled) {
        if (routeId == null) {
            return false;
        }
        RegisteredRoute updated = routes.computeIfPresent(routeId,
                (id, current) -> new RegisteredRoute(current.route().withEnabled(enabled), current.handler(), current.sequence()));
        if (updated == null) {
            log.warn("Cannot {} unknown route {}", enabled ? "enable" : "disable", routeId);
            return false;
        }
        log.info("{} route {}", enabled ? "Enabled" : "Disabled", routeId);
        return true;
    }

    private record RegisteredRoute(Route route, RouteHandler handler, long sequence) {
        static final Comparator<RegisteredRoute> ORDER = Comparator
                .comparingInt((RegisteredRoute r) -> r.route().getPriority())
                .thenComparingLong(RegisteredRoute::sequence);
    }
}
