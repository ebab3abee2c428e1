package com.github.salilvnair.convrouter.engine.provider;

import com.github.salilvnair.convrouter.api.dto.ClassificationOutcome;
import com.github.salilvnair.convrouter.api.dto.ClassifyRequest;
import com.github.salilvnair.convrouter.api.dto.RouteRequest;
import com.github.salilvnair.convrouter.api.dto.RouteResponse;
import com.github.salilvnair.convrouter.engine.core.IntentRoutingEngine;
import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.history.ConfidenceStats;
import com.github.salilvnair.convrouter.history.HistoryQuery;
import com.github.salilvnair.convrouter.history.HourlyVolume;
import com.github.salilvnair.convrouter.history.IntentCount;
import com.github.salilvnair.convrouter.history.IntentHistoryTracker;
import com.github.salilvnair.convrouter.history.UserPatterns;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentClassifier;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.model.Attributes;
import com.github.salilvnair.convrouter.route.RegistrySummary;
import com.github.salilvnair.convrouter.route.Route;
import com.github.salilvnair.convrouter.route.RouteHandler;
import com.github.salilvnair.convrouter.route.RouteMetrics;
import com.github.salilvnair.convrouter.route.RouteRanking;
import com.github.salilvnair.convrouter.route.RouteRankingMetric;
import com.github.salilvnair.convrouter.route.RouteRegistry;
import com.github.salilvnair.convrouter.router.IntentRouter;
import com.github.salilvnair.convrouter.router.RouteResult;
import com.github.salilvnair.convrouter.session.ContextManager;
import com.github.salilvnair.convrouter.session.IntentContext;
import com.github.salilvnair.convrouter.session.SessionUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultIntentRoutingEngine implements IntentRoutingEngine {

    public static final String LAST_RESULT_KEY = "last_result";

    private final IntentClassifier classifier;
    private final IntentRouter router;
    private final RouteRegistry registry;
    private final ContextManager contextManager;
    private final IntentHistoryTracker historyTracker;
    private final Clock clock;

    @Override
    public ClassificationOutcome classify(ClassifyRequest request) {
        requireText(request == null ? null : request.getText());
        IntentContext context = contextManager.getSession(request.getSessionId()).orElse(null);
        ClassificationOutcome outcome = request.isDetectMultiple()
                ? ClassificationOutcome.multi(classifier.classifyMulti(request.getText(), context))
                : ClassificationOutcome.single(classifier.classify(request.getText(), context));
        outcome.allIntents().forEach(intent -> historyTracker.track(intent, request.getUserId()));
        return outcome;
    }

    @Override
    public RouteResponse route(RouteRequest request) {
        requireText(request == null ? null : request.getText());
        IntentContext context = contextManager.getOrCreateSession(request.getSessionId(), request.getUserId(), null, null);
        Intent intent = classifier.classify(request.getText(), context);
        historyTracker.track(intent, request.getUserId());

        RouteResult result = router.route(intent, context, request.isAuthenticated());
        contextManager.updateSession(context.getSessionId(), SessionUpdate.builder()
                .intent(intent)
                .contextData(Attributes.empty().with(LAST_RESULT_KEY, result.summaryJson()))
                .build());
        log.debug("Routed intent {} for session {} via {}", intent.getType(), context.getSessionId(), result.getRouteId());
        return new RouteResponse(context.getSessionId(), result);
    }

    @Override
    public void registerRoute(Route route, RouteHandler handler, boolean override) {
        registry.register(route, handler, override);
    }

    @Override
    public boolean enableRoute(String routeId) {
        return registry.enable(routeId);
    }

    @Override
    public boolean disableRoute(String routeId) {
        return registry.disable(routeId);
    }

    @Override
    public String createSession(String userId, String language, Attributes preferences) {
        return contextManager.createSession(userId, language, preferences).getSessionId();
    }

    @Override
    public Optional<IntentContext> getSession(String sessionId) {
        return contextManager.getSession(sessionId);
    }

    @Override
    public boolean endSession(String sessionId) {
        return contextManager.endSession(sessionId);
    }

    @Override
    public List<Intent> getHistory(String userId, IntentType type, Integer sinceHours, Integer limit) {
        return historyTracker.getHistory(HistoryQuery.builder()
                .userId(userId)
                .type(type)
                .since(since(sinceHours))
                .limit(limit)
                .build());
    }

    @Override
    public Map<IntentType, Long> getFrequency(String userId, Integer sinceHours) {
        return historyTracker.getFrequency(userId, since(sinceHours));
    }

    @Override
    public List<IntentCount> getTopIntents(int n, String userId, Integer sinceHours) {
        return historyTracker.getTopIntents(n, userId, since(sinceHours));
    }

    @Override
    public Optional<UserPatterns> getUserPatterns(String userId) {
        return historyTracker.getUserPatterns(userId);
    }

    @Override
    public ConfidenceStats getConfidenceStats(IntentType type, String userId, Integer sinceHours) {
        return historyTracker.getConfidenceStats(type, userId, since(sinceHours));
    }

    @Override
    public List<HourlyVolume> getHourlyVolume(int hours, String userId) {
        return historyTracker.getHourlyVolume(hours, userId);
    }

    @Override
    public Optional<RouteMetrics> getRouteMetrics(String routeId) {
        return registry.getMetrics(routeId);
    }

    @Override
    public RegistrySummary getMetricsSummary() {
        return registry.getSummary();
    }

    @Override
    public List<RouteRanking> getTopRoutes(int n, RouteRankingMetric by) {
        return registry.getTopRoutes(n, by);
    }

    private Instant since(Integer hours) {
        return hours == null ? null : clock.instant().minus(Duration.ofHours(hours));
    }

    private static void requireText(String text) {
        if (text == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_INPUT, "Request text is required");
        }
    }
}
