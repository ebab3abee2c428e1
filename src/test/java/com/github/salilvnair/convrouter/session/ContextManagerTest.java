package com.github.salilvnair.convrouter.session;

import com.github.salilvnair.convrouter.config.ConvRouterSessionConfig;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.model.AttributeValue;
import com.github.salilvnair.convrouter.model.Attributes;
import com.github.salilvnair.convrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.convrouter.support.TestConstants.EPSILON;
import static com.github.salilvnair.convrouter.support.TestConstants.OTHER_USER_ID;
import static com.github.salilvnair.convrouter.support.TestConstants.SESSION_ID_UNKNOWN;
import static com.github.salilvnair.convrouter.support.TestConstants.T0;
import static com.github.salilvnair.convrouter.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextManagerTest {

    private MutableClock clock;
    private ContextManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        manager = new ContextManager(new ConvRouterSessionConfig(), clock);
    }

    @Test
    void createdSessionStartsEmpty() {
        IntentContext context = manager.createSession(USER_ID);

        assertEquals(USER_ID, context.getUserId());
        assertEquals("en", context.getLanguage());
        assertEquals(T0, context.getCreatedAt());
        assertEquals(T0, context.getLastInteraction());
        assertEquals(0, context.getInteractionCount());
        assertFalse(context.hasHistory());
        assertNull(context.getCurrentTopic());
        assertSame(context, manager.getSession(context.getSessionId()).orElseThrow());
    }

    @Test
    void sessionIdsAreUnique() {
        assertNotEquals(manager.createSession(USER_ID).getSessionId(), manager.createSession(USER_ID).getSessionId());
    }

    @Test
    void sessionExpiresOnlyAfterTimeoutElapses() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        clock.advance(Duration.ofMinutes(30));
        assertTrue(manager.getSession(sessionId).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(manager.getSession(sessionId).isEmpty());
        assertTrue(manager.getSession(sessionId).isEmpty());
        assertFalse(manager.endSession(sessionId));
        assertEquals(0, manager.getSessionCount());
    }

    @Test
    void updateKeepsSessionAlive() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        clock.advance(Duration.ofMinutes(20));
        assertTrue(manager.updateSession(sessionId, SessionUpdate.ofIntent(intent(IntentType.HELP))));
        clock.advance(Duration.ofMinutes(20));

        assertTrue(manager.getSession(sessionId).isPresent());
    }

    @Test
    void updateOfUnknownOrExpiredSessionReportsFalse() {
        assertFalse(manager.updateSession(SESSION_ID_UNKNOWN, SessionUpdate.ofIntent(intent(IntentType.HELP))));

        String sessionId = manager.createSession(USER_ID).getSessionId();
        clock.advance(Duration.ofMinutes(31));

        assertFalse(manager.updateSession(sessionId, SessionUpdate.ofIntent(intent(IntentType.HELP))));
    }

    @Test
    void updateAppendsIntentSetsTopicAndCountsOnce() {
        String sessionId = manager.createSession(USER_ID).getSessionId();
        Intent loan = intent(IntentType.LOAN_APPLICATION);
        clock.advance(Duration.ofMinutes(1));

        manager.updateSession(sessionId, SessionUpdate.builder()
                .intent(loan)
                .contextData(Attributes.empty().with("stage", "intake"))
                .preferences(Attributes.empty().with("channel", "sms"))
                .build());

        IntentContext context = manager.getSession(sessionId).orElseThrow();
        assertEquals(List.of(loan), context.getConversationHistory());
        assertEquals("loan_application", context.getCurrentTopic());
        assertEquals(1, context.getInteractionCount());
        assertEquals(T0.plus(Duration.ofMinutes(1)), context.getLastInteraction());
        assertEquals("intake", context.getContextData().getText("stage").orElseThrow());
        assertEquals("sms", context.getUserPreferences().getText("channel").orElseThrow());
    }

    @Test
    void unknownIntentLeavesTopicAndExplicitTopicWins() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        manager.updateSession(sessionId, SessionUpdate.ofIntent(intent(IntentType.CREDIT_HISTORY)));
        manager.updateSession(sessionId, SessionUpdate.ofIntent(intent(IntentType.UNKNOWN)));
        assertEquals("credit_history", manager.getCurrentTopic(sessionId).orElseThrow());

        manager.updateSession(sessionId, SessionUpdate.builder()
                .intent(intent(IntentType.HELP))
                .topic("onboarding")
                .build());
        assertEquals("onboarding", manager.getCurrentTopic(sessionId).orElseThrow());
        assertEquals(3, manager.getSession(sessionId).orElseThrow().getInteractionCount());
    }

    @Test
    void contextDataMergeIsLastWriteWins() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        manager.updateSession(sessionId, SessionUpdate.builder()
                .contextData(Attributes.builder().text("stage", "intake").flag("verified", false).build())
                .build());
        manager.updateSession(sessionId, SessionUpdate.builder()
                .contextData(Attributes.builder().flag("verified", true).build())
                .build());

        Attributes data = manager.getSession(sessionId).orElseThrow().getContextData();
        assertEquals("intake", data.getText("stage").orElseThrow());
        assertTrue(data.getFlag("verified").orElseThrow());
    }

    @Test
    void conversationHistoryCanBeSlicedAndCleared() {
        String sessionId = manager.createSession(USER_ID).getSessionId();
        Intent first = intent(IntentType.GREETING);
        Intent second = intent(IntentType.HELP);
        Intent third = intent(IntentType.STATUS);
        manager.updateSession(sessionId, SessionUpdate.ofIntent(first));
        manager.updateSession(sessionId, SessionUpdate.ofIntent(second));
        manager.updateSession(sessionId, SessionUpdate.ofIntent(third));

        assertEquals(List.of(second, third), manager.getConversationHistory(sessionId, 2));
        assertEquals(3, manager.getConversationHistory(sessionId).size());
        assertEquals(third, manager.getSession(sessionId).orElseThrow().getLastIntent().orElseThrow());

        assertTrue(manager.clearHistory(sessionId));
        assertTrue(manager.getConversationHistory(sessionId).isEmpty());
        assertTrue(manager.getConversationHistory(SESSION_ID_UNKNOWN).isEmpty());
    }

    @Test
    void keyedAccessorsWorkOnLiveSessionsOnly() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        assertTrue(manager.setContextData(sessionId, "amount", new AttributeValue.Numeric(1200)));
        assertTrue(manager.setUserPreference(sessionId, "tone", new AttributeValue.Text("formal")));
        assertTrue(manager.setCurrentTopic(sessionId, "loan_application"));

        assertEquals(new AttributeValue.Numeric(1200), manager.getContextData(sessionId, "amount").orElseThrow());
        assertEquals(new AttributeValue.Text("formal"), manager.getUserPreference(sessionId, "tone").orElseThrow());
        assertFalse(manager.setContextData(SESSION_ID_UNKNOWN, "amount", new AttributeValue.Numeric(1)));
        assertTrue(manager.getContextData(SESSION_ID_UNKNOWN, "amount").isEmpty());
    }

    @Test
    void getOrCreateReusesLiveSessionAndReplacesUnknownOne() {
        IntentContext existing = manager.createSession(USER_ID);

        assertSame(existing, manager.getOrCreateSession(existing.getSessionId(), USER_ID, null, null));

        IntentContext created = manager.getOrCreateSession(SESSION_ID_UNKNOWN, USER_ID, "fr", null);
        assertNotEquals(SESSION_ID_UNKNOWN, created.getSessionId());
        assertEquals("fr", created.getLanguage());
    }

    @Test
    void endSessionRemovesIt() {
        String sessionId = manager.createSession(USER_ID).getSessionId();

        assertTrue(manager.endSession(sessionId));
        assertFalse(manager.endSession(sessionId));
        assertTrue(manager.getSession(sessionId).isEmpty());
    }

    @Test
    void cleanupRemovesOnlyExpiredSessions() {
        manager.createSession(USER_ID);
        clock.advance(Duration.ofMinutes(20));
        String fresh = manager.createSession(OTHER_USER_ID).getSessionId();
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, manager.cleanupExpiredSessions());
        assertEquals(List.of(fresh), manager.getActiveSessionIds());
    }

    @Test
    void userSessionsAreFilteredByUser() {
        manager.createSession(USER_ID);
        manager.createSession(USER_ID);
        manager.createSession(OTHER_USER_ID);

        assertEquals(2, manager.getUserSessions(USER_ID).size());
        assertTrue(manager.getUserSessions(null).isEmpty());
    }

    @Test
    void statisticsAggregateLiveSessions() {
        String first = manager.createSession(USER_ID, "en", null).getSessionId();
        manager.createSession(OTHER_USER_ID, "es", null);
        manager.updateSession(first, SessionUpdate.ofIntent(intent(IntentType.HELP)));
        manager.updateSession(first, SessionUpdate.ofIntent(intent(IntentType.STATUS)));
        manager.updateSession(first, SessionUpdate.ofIntent(intent(IntentType.GREETING)));
        clock.advance(Duration.ofMinutes(10));

        SessionStatistics stats = manager.getStatistics();

        assertEquals(2, stats.totalSessions());
        assertEquals(3, stats.totalInteractions());
        assertEquals(1.5, stats.avgInteractionsPerSession(), EPSILON);
        assertEquals(10.0, stats.avgSessionAgeMinutes(), EPSILON);
        assertEquals(1, stats.sessionsByLanguage().get("en"));
        assertEquals(1, stats.sessionsByLanguage().get("es"));
        assertEquals(30L, stats.sessionTimeoutMinutes());
    }

    @Test
    void concurrentUpdatesOnOneSessionAreAllCounted() throws Exception {
        String sessionId = manager.createSession(USER_ID).getSessionId();
        int threads = 8;
        int updatesPerThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < updatesPerThread; i++) {
                        assertTrue(manager.updateSession(sessionId, SessionUpdate.ofIntent(intent(IntentType.HELP))));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        IntentContext context = manager.getSession(sessionId).orElseThrow();
        assertEquals(threads * updatesPerThread, context.getInteractionCount());
        assertEquals("help", context.getCurrentTopic());
    }

    private static Intent intent(IntentType type) {
        return Intent.builder().type(type).confidence(0.8).timestamp(T0).build();
    }
}
