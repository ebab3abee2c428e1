package com.github.salilvnair.convrouter.fallback.provider;

import com.github.salilvnair.convrouter.fallback.FallbackResponseCatalog;
import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class UseDefaultFallbackResolver implements FallbackStrategyResolver {

    private final FallbackResponseCatalog responseCatalog;
    private final Clock clock;

    @Override
    public FallbackStrategy strategy() {
        return FallbackStrategy.USE_DEFAULT;
    }

    @Override
    public FallbackResult resolve(Intent intent, IntentContext context) {
        return FallbackResult.builder()
                .strategyUsed(strategy())
                .intent(intent)
                .handled(true)
                .response(responseCatalog.responseFor(intent.getType()))
                .timestamp(clock.instant())
                .build();
    }
}
