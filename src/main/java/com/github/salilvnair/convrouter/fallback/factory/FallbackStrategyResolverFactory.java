package com.github.salilvnair.convrouter.fallback.factory;

import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FallbackStrategyResolverFactory {

    private final List<FallbackStrategyResolver> resolvers;

    public FallbackStrategyResolverFactory(List<FallbackStrategyResolver> resolvers) {
        this.resolvers = resolvers;
    }

    public FallbackStrategyResolver get(FallbackStrategy strategy) {
        return resolvers.stream()
                .filter(r -> r.strategy() == strategy)
                .findFirst()
                .orElseThrow(() -> new IntentRoutingException(
                        IntentRoutingErrorCode.FALLBACK_RESOLVER_MISSING,
                        "No FallbackStrategyResolver for strategy=" + strategy
                ));
    }
}
