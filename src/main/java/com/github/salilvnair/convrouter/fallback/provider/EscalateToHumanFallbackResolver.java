package com.github.salilvnair.convrouter.fallback.provider;

import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class EscalateToHumanFallbackResolver implements FallbackStrategyResolver {

    static final String RESPONSE = "I'm having trouble understanding your request. "
            + "Let me connect you with a human agent who can better assist you. "
            + "Please wait a moment...";

    private final Clock clock;

    @Override
    public FallbackStrategy strategy() {
        return FallbackStrategy.ESCALATE_TO_HUMAN;
    }

    @Override
    public FallbackResult resolve(Intent intent, IntentContext context) {
        log.info("Escalating session {} to a human agent", context == null ? null : context.getSessionId());
        return FallbackResult.builder()
                .strategyUsed(strategy())
                .intent(intent)
                .handled(true)
                .response(RESPONSE)
                .suggestedAction("Wait for human agent")
                .suggestedAction("Try rephrasing your request")
                .timestamp(clock.instant())
                .build();
    }
}
