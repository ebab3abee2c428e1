package com.github.salilvnair.convrouter.fallback;

import com.github.salilvnair.convrouter.config.ConvRouterFallbackConfig;
import com.github.salilvnair.convrouter.fallback.factory.FallbackStrategyResolverFactory;
import com.github.salilvnair.convrouter.intent.ConfidenceLevel;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Answers intents that no route could take.
 * <p>
 * Strategy selection, first match wins:
 * <ol>
 *     <li>very low confidence: ask for clarification</li>
 *     <li>unknown intent: list the supported options</li>
 *     <li>session with history: guess the continuation from history</li>
 *     <li>repeated low-confidence turns: escalate to a human</li>
 *     <li>otherwise the configured default</li>
 * </ol>
 * A failing strategy degrades to the default reply, and after that to an unhandled apology.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackHandler {

    static final String APOLOGY = "Sorry, something went wrong while handling your request. Please try again.";

    private final ConvRouterFallbackConfig config;
    private final FallbackStrategyResolverFactory resolverFactory;
    private final FallbackResponseCatalog responseCatalog;
    private final Clock clock;

    public FallbackResult handle(Intent intent, IntentContext context) {
        FallbackStrategy strategy = selectStrategy(intent, context);
        log.debug("Fallback strategy {} selected for intent {}", strategy, intent.getIntentId());
        try {
            return resolverFactory.get(strategy).resolve(intent, context);
        } catch (RuntimeException e) {
            log.error("Fallback strategy {} failed for intent {}: {}", strategy, intent.getIntentId(), e.getMessage(), e);
        }
        if (strategy != FallbackStrategy.USE_DEFAULT) {
            try {
                return resolverFactory.get(FallbackStrategy.USE_DEFAULT).resolve(intent, context);
            } catch (RuntimeException e) {
                log.error("Default fallback failed for intent {}: {}", intent.getIntentId(), e.getMessage(), e);
            }
        }
        return FallbackResult.builder()
                .strategyUsed(strategy)
                .intent(intent)
                .handled(false)
                .response(APOLOGY)
                .timestamp(clock.instant())
                .build();
    }

    public FallbackStrategy selectStrategy(Intent intent, IntentContext context) {
        if (intent.getConfidenceLevel() == ConfidenceLevel.VERY_LOW) {
            return FallbackStrategy.ASK_CLARIFICATION;
        }
        if (intent.isUnknown()) {
            return FallbackStrategy.PROVIDE_OPTIONS;
        }
        if (context != null && config.isHistoryEnabled() && context.hasHistory()) {
            return FallbackStrategy.USE_HISTORY;
        }
        if (context != null && config.isEscalationEnabled()) {
            long lowConfidenceTurns = context.getRecentIntents(config.getEscalationWindow()).stream()
                    .filter(i -> i.getConfidenceLevel().isLowOrBelow())
                    .count();
            if (lowConfidenceTurns >= config.getEscalationThreshold()) {
                return FallbackStrategy.ESCALATE_TO_HUMAN;
            }
        }
        return config.getDefaultStrategy() == null ? FallbackStrategy.ASK_CLARIFICATION : config.getDefaultStrategy();
    }

    public void setDefaultResponse(IntentType type, String response) {
        responseCatalog.put(type, response);
        log.info("Default fallback response for {} updated", type);
    }

    public Optional<String> getDefaultResponse(IntentType type) {
        return responseCatalog.get(type);
    }
}
