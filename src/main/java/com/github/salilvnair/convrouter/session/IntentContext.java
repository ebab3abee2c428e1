package com.github.salilvnair.convrouter.session;

import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.model.AttributeValue;
import com.github.salilvnair.convrouter.model.Attributes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversational state of one session.
 * <p>
 * All access is synchronized on the instance, so mutations of the same session are serialized.
 * Readers return copies; the intent history itself never leaves this object.
 */
public class IntentContext {

    private final String sessionId;
    private final String userId;
    private final String language;
    private final Instant createdAt;

    private final List<Intent> conversationHistory = new ArrayList<>();
    private String currentTopic;
    private Attributes contextData = Attributes.empty();
    private Attributes userPreferences;
    private Instant lastInteraction;
    private int interactionCount;

    public IntentContext(String sessionId, String userId, String language, Attributes userPreferences, Instant now) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.userId = userId;
        this.language = language == null || language.isBlank() ? Intent.DEFAULT_LANGUAGE : language;
        this.userPreferences = userPreferences == null ? Attributes.empty() : userPreferences;
        this.createdAt = Objects.requireNonNull(now, "now");
        this.lastInteraction = now;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getLanguage() {
        return language;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized List<Intent> getConversationHistory() {
        return List.copyOf(conversationHistory);
    }

    public synchronized int getHistorySize() {
        return conversationHistory.size();
    }

    public synchronized boolean hasHistory() {
        return !conversationHistory.isEmpty();
    }

    public synchronized List<Intent> getRecentIntents(int n) {
        if (n <= 0 || conversationHistory.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, conversationHistory.size() - n);
        return List.copyOf(conversationHistory.subList(from, conversationHistory.size()));
    }

    public synchronized Optional<Intent> getLastIntent() {
        if (conversationHistory.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(conversationHistory.get(conversationHistory.size() - 1));
    }

    public synchronized String getCurrentTopic() {
        return currentTopic;
    }

    public synchronized Attributes getContextData() {
        return contextData;
    }

    public synchronized Attributes getUserPreferences() {
        return userPreferences;
    }

    public synchronized Instant getLastInteraction() {
        return lastInteraction;
    }

    public synchronized int getInteractionCount() {
        return interactionCount;
    }

    public synchronized boolean isExpired(Instant now, Duration timeout) {
        return Duration.between(lastInteraction, now).compareTo(timeout) > 0;
    }

    /**
     * Applies one turn: appends the intent (a known intent also becomes the current topic), merges
     * context data and preferences, applies an explicit topic, then bumps the interaction clock and counter.
     */
    public synchronized void apply(SessionUpdate update, Instant now) {
        if (update.intent() != null) {
            conversationHistory.add(update.intent());
            if (!update.intent().isUnknown()) {
                currentTopic = update.intent().getType().code();
            }
        }
        contextData = contextData.merge(update.contextData());
        userPreferences = userPreferences.merge(update.preferences());
        if (update.topic() != null && !update.topic().isBlank()) {
            currentTopic = update.topic();
        }
        touch(now);
        interactionCount++;
    }

    public synchronized void putContextData(String key, AttributeValue value, Instant now) {
        contextData = contextData.with(key, value);
        touch(now);
    }

    public synchronized void putUserPreference(String key, AttributeValue value, Instant now) {
        userPreferences = userPreferences.with(key, value);
        touch(now);
    }

    public synchronized void setCurrentTopic(String topic, Instant now) {
        currentTopic = topic;
        touch(now);
    }

    public synchronized void clearHistory() {
        conversationHistory.clear();
    }

    // last interaction only moves forward
    private void touch(Instant now) {
        if (now != null && now.isAfter(lastInteraction)) {
            lastInteraction = now;
        }
    }
}
