package com.github.salilvnair.convrouter.fallback.provider;

import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
@RequiredArgsConstructor
public class ProvideOptionsFallbackResolver implements FallbackStrategyResolver {

    static final String RESPONSE = "I'm not sure what you need. Here are some things I can help with:";

    static final List<String> CAPABILITIES = List.of(
            "Apply for a loan",
            "Check collateral requirements",
            "View credit history",
            "Upload documents",
            "Analyze LinkedIn profile",
            "Find job matches",
            "Get skill recommendations",
            "Get help",
            "Check application status"
    );

    private final Clock clock;

    @Override
    public FallbackStrategy strategy() {
        return FallbackStrategy.PROVIDE_OPTIONS;
    }

    @Override
    public FallbackResult resolve(Intent intent, IntentContext context) {
        return FallbackResult.builder()
                .strategyUsed(strategy())
                .intent(intent)
                .handled(true)
                .response(RESPONSE)
                .suggestedActions(CAPABILITIES)
                .timestamp(clock.instant())
                .build();
    }
}
