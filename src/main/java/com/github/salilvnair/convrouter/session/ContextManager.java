package com.github.salilvnair.convrouter.session;

import com.github.salilvnair.convrouter.config.ConvRouterSessionConfig;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.model.AttributeValue;
import com.github.salilvnair.convrouter.model.Attributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store with lazy expiry.
 * <p>
 * Every lookup checks the session's idle time first; an expired session is evicted on the spot, so it
 * is never handed out again. {@link #cleanupExpiredSessions()} does the same eagerly for the whole map.
 */
@Slf4j
@Component
public class ContextManager {

    private final ConvRouterSessionConfig config;
    private final Clock clock;
    private final Map<String, IntentContext> sessions = new ConcurrentHashMap<>();

    public ContextManager(ConvRouterSessionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public IntentContext createSession(String userId, String language, Attributes preferences) {
        String sessionId = UUID.randomUUID().toString();
        IntentContext context = new IntentContext(
                sessionId,
                userId,
                language == null || language.isBlank() ? config.getDefaultLanguage() : language,
                preferences,
                clock.instant()
        );
        sessions.put(sessionId, context);
        log.info("Created session {} for user {}", sessionId, userId);
        return context;
    }

    public IntentContext createSession(String userId) {
        return createSession(userId, null, null);
    }

    public Optional<IntentContext> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        IntentContext context = sessions.get(sessionId);
        if (context == null) {
            return Optional.empty();
        }
        if (context.isExpired(clock.instant(), timeout())) {
            if (sessions.remove(sessionId, context)) {
                log.info("Session {} expired after {} idle minute(s)", sessionId, config.getTimeoutMinutes());
            }
            return Optional.empty();
        }
        return Optional.of(context);
    }

    public IntentContext getOrCreateSession(String sessionId, String userId, String language, Attributes preferences) {
        return getSession(sessionId).orElseGet(() -> createSession(userId, language, preferences));
    }

    /**
     * Records one turn on a live session.
     *
     * @return {@code false} when the session is unknown or has expired
     */
    public boolean updateSession(String sessionId, SessionUpdate update) {
        Optional<IntentContext> context = getSession(sessionId);
        if (context.isEmpty()) {
            log.warn("Cannot update session {}: not found or expired", sessionId);
            return false;
        }
        context.get().apply(update == null ? SessionUpdate.builder().build() : update, clock.instant());
        log.debug("Updated session {} (interactions={}, topic={})",
                sessionId, context.get().getInteractionCount(), context.get().getCurrentTopic());
        return true;
    }

    public boolean endSession(String sessionId) {
        if (sessionId == null || sessions.remove(sessionId) == null) {
            return false;
        }
        log.info("Ended session {}", sessionId);
        return true;
    }

    public int cleanupExpiredSessions() {
        Instant now = clock.instant();
        Duration timeout = timeout();
        int removed = 0;
        for (Map.Entry<String, IntentContext> entry : sessions.entrySet()) {
            if (entry.getValue().isExpired(now, timeout) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} expired session(s)", removed);
        }
        return removed;
    }

    public List<Intent> getConversationHistory(String sessionId, int lastN) {
        return getSession(sessionId)
                .map(c -> lastN > 0 ? c.getRecentIntents(lastN) : c.getConversationHistory())
                .orElse(List.of());
    }

    public List<Intent> getConversationHistory(String sessionId) {
        return getConversationHistory(sessionId, 0);
    }

    public Optional<AttributeValue> getContextData(String sessionId, String key) {
        return getSession(sessionId).flatMap(c -> c.getContextData().get(key));
    }

    public boolean setContextData(String sessionId, String key, AttributeValue value) {
        Optional<IntentContext> context = getSession(sessionId);
        context.ifPresent(c -> c.putContextData(key, value, clock.instant()));
        return context.isPresent();
    }

    public Optional<AttributeValue> getUserPreference(String sessionId, String key) {
        return getSession(sessionId).flatMap(c -> c.getUserPreferences().get(key));
    }

    public boolean setUserPreference(String sessionId, String key, AttributeValue value) {
        Optional<IntentContext> context = getSession(sessionId);
        context.ifPresent(c -> c.putUserPreference(key, value, clock.instant()));
        return context.isPresent();
    }

    public Optional<String> getCurrentTopic(String sessionId) {
        return getSession(sessionId).map(IntentContext::getCurrentTopic);
    }

    public boolean setCurrentTopic(String sessionId, String topic) {
        Optional<IntentContext> context = getSession(sessionId);
        context.ifPresent(c -> c.setCurrentTopic(topic, clock.instant()));
        return context.isPresent();
    }

    public boolean clearHistory(String sessionId) {
        Optional<IntentContext> context = getSession(sessionId);
        context.ifPresent(IntentContext::clearHistory);
        return context.isPresent();
    }

    public List<String> getActiveSessionIds() {
        cleanupExpiredSessions();
        return new ArrayList<>(sessions.keySet());
    }

    public int getSessionCount() {
        cleanupExpiredSessions();
        return sessions.size();
    }

    public List<IntentContext> getUserSessions(String userId) {
        cleanupExpiredSessions();
        if (userId == null) {
            return List.of();
        }
        return sessions.values().stream()
                .filter(c -> userId.equals(c.getUserId()))
                .toList();
    }

    public SessionStatistics getStatistics() {
        cleanupExpiredSessions();
        Instant now = clock.instant();
        List<IntentContext> live = new ArrayList<>(sessions.values());
        long interactions = 0;
        double ageSeconds = 0;
        Map<String, Integer> byLanguage = new LinkedHashMap<>();
        for (IntentContext context : live) {
            interactions += context.getInteractionCount();
            ageSeconds += Duration.between(context.getCreatedAt(), now).toMillis() / 1000.0;
            byLanguage.merge(context.getLanguage(), 1, Integer::sum);
        }
        int total = live.size();
        return new SessionStatistics(
                total,
                interactions,
                total == 0 ? 0.0 : (double) interactions / total,
                total == 0 ? 0.0 : ageSeconds / total / 60.0,
                byLanguage,
                config.getTimeoutMinutes()
        );
    }

    private Duration timeout() {
        return Duration.ofMinutes(config.getTimeoutMinutes());
    }
}
