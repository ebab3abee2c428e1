package com.github.salilvnair.convrouter.fallback;

import com.github.salilvnair.convrouter.config.ConvRouterFallbackConfig;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.fallback.factory.FallbackStrategyResolverFactory;
import com.github.salilvnair.convrouter.fallback.provider.UseDefaultFallbackResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.session.IntentContext;
import com.github.salilvnair.convrouter.session.SessionUpdate;
import com.github.salilvnair.convrouter.support.MutableClock;
import com.github.salilvnair.convrouter.support.TestComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.github.salilvnair.convrouter.support.TestConstants.BOOM;
import static com.github.salilvnair.convrouter.support.TestConstants.T0;
import static com.github.salilvnair.convrouter.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FallbackHandlerTest {

    @Mock
    private FallbackStrategyResolver failingClarification;

    @Mock
    private FallbackStrategyResolver failingDefault;

    private MutableClock clock;
    private ConvRouterFallbackConfig config;
    private FallbackHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        config = new ConvRouterFallbackConfig();
        handler = TestComponents.fallbackHandler(config, clock);
    }

    @Test
    void veryLowConfidenceAsksForClarification() {
        FallbackResult result = handler.handle(intent(IntentType.UNKNOWN, 0.1), context());

        assertEquals(FallbackStrategy.ASK_CLARIFICATION, result.getStrategyUsed());
        assertTrue(result.isHandled());
        assertEquals("I need a bit more information to help you. Could you please provide more details?", result.getResponse());
        assertEquals(3, result.getClarificationOptions().size());
    }

    @Test
    void clarificationQuestionsDependOnIntentType() {
        FallbackResult result = handler.handle(intent(IntentType.LOAN_APPLICATION, 0.1), null);

        assertEquals("What type of loan are you interested in? (business, personal, auto, home)",
                result.getClarificationOptions().get(0));
    }

    @Test
    void unknownIntentListsOptions() {
        FallbackResult result = handler.handle(intent(IntentType.UNKNOWN, 0.35), context());

        assertEquals(FallbackStrategy.PROVIDE_OPTIONS, result.getStrategyUsed());
        assertEquals(9, result.getSuggestedActions().size());
        assertEquals("Apply for a loan", result.getSuggestedActions().get(0));
    }

    @Test
    void historyGuessesMostFrequentRecentType() {
        IntentContext context = context();
        record(context, IntentType.LOAN_APPLICATION, IntentType.CREDIT_HISTORY, IntentType.CREDIT_HISTORY);

        FallbackResult result = handler.handle(intent(IntentType.COLLATERAL_CHECK, 0.6), context);

        assertEquals(FallbackStrategy.USE_HISTORY, result.getStrategyUsed());
        assertEquals(IntentType.CREDIT_HISTORY, result.getContinuationIntent());
        assertEquals("Based on our conversation, I think you're asking about credit_history. Is that correct?",
                result.getResponse());
    }

    @Test
    void historyWindowOnlyLooksAtRecentTurns() {
        IntentContext context = context();
        record(context, IntentType.HELP, IntentType.HELP, IntentType.HELP,
                IntentType.STATUS, IntentType.LOAN_APPLICATION, IntentType.STATUS);

        FallbackResult result = handler.handle(intent(IntentType.COLLATERAL_CHECK, 0.6), context);

        assertEquals(IntentType.STATUS, result.getContinuationIntent());
    }

    @Test
    void historyTieGoesToFirstSeenType() {
        IntentContext context = context();
        record(context, IntentType.STATUS, IntentType.HELP);

        FallbackResult result = handler.handle(intent(IntentType.COLLATERAL_CHECK, 0.6), context);

        assertEquals(IntentType.STATUS, result.getContinuationIntent());
    }

    @Test
    void repeatedLowConfidenceEscalatesWhenHistoryIsDisabled() {
        config.setHistoryEnabled(false);
        IntentContext context = context();
        context.apply(SessionUpdate.ofIntent(intent(IntentType.HELP, 0.35)), T0);
        context.apply(SessionUpdate.ofIntent(intent(IntentType.HELP, 0.2)), T0);
        context.apply(SessionUpdate.ofIntent(intent(IntentType.STATUS, 0.8)), T0);
        context.apply(SessionUpdate.ofIntent(intent(IntentType.HELP, 0.4)), T0);

        FallbackResult result = handler.handle(intent(IntentType.COLLATERAL_CHECK, 0.6), context);

        assertEquals(FallbackStrategy.ESCALATE_TO_HUMAN, result.getStrategyUsed());
        assertTrue(result.getResponse().contains("human agent"));
    }

    @Test
    void configuredDefaultAppliesWhenNothingElseMatches() {
        config.setDefaultStrategy(FallbackStrategy.USE_DEFAULT);

        FallbackResult result = handler.handle(intent(IntentType.GREETING, 0.6), context());

        assertEquals(FallbackStrategy.USE_DEFAULT, result.getStrategyUsed());
        assertEquals("Hello! How can I help you today?", result.getResponse());
    }

    @Test
    void defaultResponsesCanBeReplaced() {
        config.setDefaultStrategy(FallbackStrategy.USE_DEFAULT);
        handler.setDefaultResponse(IntentType.STATUS, "Your application is being processed.");

        FallbackResult result = handler.handle(intent(IntentType.STATUS, 0.6), null);

        assertEquals("Your application is being processed.", result.getResponse());
        assertEquals("Your application is being processed.", handler.getDefaultResponse(IntentType.STATUS).orElseThrow());
        assertTrue(handler.getDefaultResponse(IntentType.SETTINGS).isEmpty());
        assertEquals(FallbackResponseCatalog.GENERIC_RESPONSE,
                handler.handle(intent(IntentType.SETTINGS, 0.6), null).getResponse());
    }

    @Test
    void failingStrategyDegradesToDefaultReply() {
        when(failingClarification.strategy()).thenReturn(FallbackStrategy.ASK_CLARIFICATION);
        when(failingClarification.resolve(any(), any())).thenThrow(new IllegalStateException(BOOM));
        FallbackResponseCatalog catalog = new FallbackResponseCatalog();
        FallbackStrategyResolverFactory factory = new FallbackStrategyResolverFactory(
                List.of(failingClarification, new UseDefaultFallbackResolver(catalog, clock)));
        FallbackHandler degraded = new FallbackHandler(config, factory, catalog, clock);

        FallbackResult result = degraded.handle(intent(IntentType.HELP, 0.1), null);

        assertEquals(FallbackStrategy.USE_DEFAULT, result.getStrategyUsed());
        assertTrue(result.isHandled());
        assertEquals("I'm here to help! What do you need assistance with?", result.getResponse());
    }

    @Test
    void failingDefaultYieldsUnhandledApology() {
        when(failingClarification.strategy()).thenReturn(FallbackStrategy.ASK_CLARIFICATION);
        when(failingClarification.resolve(any(), any())).thenThrow(new IllegalStateException(BOOM));
        when(failingDefault.strategy()).thenReturn(FallbackStrategy.USE_DEFAULT);
        when(failingDefault.resolve(any(), any())).thenThrow(new IllegalStateException(BOOM));
        FallbackStrategyResolverFactory factory = new FallbackStrategyResolverFactory(List.of(failingClarification, failingDefault));
        FallbackHandler degraded = new FallbackHandler(config, factory, new FallbackResponseCatalog(), clock);

        FallbackResult result = degraded.handle(intent(IntentType.HELP, 0.1), null);

        assertFalse(result.isHandled());
        assertEquals(FallbackHandler.APOLOGY, result.getResponse());
        assertEquals(FallbackStrategy.ASK_CLARIFICATION, result.getStrategyUsed());
        assertNull(result.getContinuationIntent());
    }

    private static void record(IntentContext context, IntentType... types) {
        for (IntentType type : types) {
            context.apply(SessionUpdate.ofIntent(intent(type, 0.8)), T0);
        }
    }

    private static Intent intent(IntentType type, double confidence) {
        return Intent.builder().type(type).confidence(confidence).timestamp(T0).build();
    }

    private static IntentContext context() {
        return new IntentContext("session-1", USER_ID, "en", null, T0);
    }
}
