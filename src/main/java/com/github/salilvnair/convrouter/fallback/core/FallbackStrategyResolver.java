package com.github.salilvnair.convrouter.fallback.core;

import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.session.IntentContext;

public interface FallbackStrategyResolver {

    FallbackStrategy strategy();

    FallbackResult resolve(Intent intent, IntentContext context);
}
