package com.github.salilvnair.convrouter.engine.core;

import com.github.salilvnair.convrouter.api.dto.ClassificationOutcome;
import com.github.salilvnair.convrouter.api.dto.ClassifyRequest;
import com.github.salilvnair.convrouter.api.dto.RouteRequest;
import com.github.salilvnair.convrouter.api.dto.RouteResponse;
import com.github.salilvnair.convrouter.history.ConfidenceStats;
import com.github.salilvnair.convrouter.history.HourlyVolume;
import com.github.salilvnair.convrouter.history.IntentCount;
import com.github.salilvnair.convrouter.history.UserPatterns;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.model.Attributes;
import com.github.salilvnair.convrouter.route.RegistrySummary;
import com.github.salilvnair.convrouter.route.Route;
import com.github.salilvnair.convrouter.route.RouteHandler;
import com.github.salilvnair.convrouter.route.RouteMetrics;
import com.github.salilvnair.convrouter.route.RouteRanking;
import com.github.salilvnair.convrouter.route.RouteRankingMetric;
import com.github.salilvnair.convrouter.session.IntentContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point over classification, routing, sessions and history.
 */
public interface IntentRoutingEngine {

    ClassificationOutcome classify(ClassifyRequest request);

    /**
     * Classifies the text against the caller's session (created when missing), routes the intent and
     * records the turn on the session.
     */
    RouteResponse route(RouteRequest request);

    void registerRoute(Route route, RouteHandler handler, boolean override);

    boolean enableRoute(String routeId);

    boolean disableRoute(String routeId);

    String createSession(String userId, String language, Attributes preferences);

    Optional<IntentContext> getSession(String sessionId);

    boolean endSession(String sessionId);

    List<Intent> getHistory(String userId, IntentType type, Integer sinceHours, Integer limit);

    Map<IntentType, Long> getFrequency(String userId, Integer sinceHours);

    List<IntentCount> getTopIntents(int n, String userId, Integer sinceHours);

    Optional<UserPatterns> getUserPatterns(String userId);

    ConfidenceStats getConfidenceStats(IntentType type, String userId, Integer sinceHours);

    List<HourlyVolume> getHourlyVolume(int hours, String userId);

    Optional<RouteMetrics> getRouteMetrics(String routeId);

    RegistrySummary getMetricsSummary();

    List<RouteRanking> getTopRoutes(int n, RouteRankingMetric by);
}
