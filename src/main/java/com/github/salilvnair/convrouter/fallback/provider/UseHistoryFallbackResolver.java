package com.github.salilvnair.convrouter.fallback.provider;

import com.github.salilvnair.convrouter.config.ConvRouterFallbackConfig;
import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guesses the topic the user is continuing with from the most frequent type among their recent
 * intents. Ties go to the type seen first. Without history this degrades to the default reply.
 */
@Component
@RequiredArgsConstructor
public class UseHistoryFallbackResolver implements FallbackStrategyResolver {

    private final ConvRouterFallbackConfig config;
    private final UseDefaultFallbackResolver defaultResolver;
    private final Clock clock;

    @Override
    public FallbackStrategy strategy() {
        return FallbackStrategy.USE_HISTORY;
    }

    @Override
    public FallbackResult resolve(Intent intent, IntentContext context) {
        List<Intent> recent = context == null ? List.of() : context.getRecentIntents(config.getHistoryWindow());
        if (recent.isEmpty()) {
            return defaultResolver.resolve(intent, context);
        }

        Map<IntentType, Integer> counts = new LinkedHashMap<>();
        recent.forEach(i -> counts.merge(i.getType(), 1, Integer::sum));
        IntentType mostCommon = null;
        int best = 0;
        for (Map.Entry<IntentType, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mostCommon = entry.getKey();
            }
        }

        String topic = mostCommon.code();
        return FallbackResult.builder()
                .strategyUsed(strategy())
                .intent(intent)
                .handled(true)
                .response("Based on our conversation, I think you're asking about " + topic + ". Is that correct?")
                .suggestedAction("Continue with " + topic)
                .suggestedAction("Try a different topic")
                .continuationIntent(mostCommon)
                .timestamp(clock.instant())
                .build();
    }
}
