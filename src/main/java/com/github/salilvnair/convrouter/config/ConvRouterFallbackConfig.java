package com.github.salilvnair.convrouter.config;

import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convrouter.fallback")
@Getter
@Setter
public class ConvRouterFallbackConfig {

    private FallbackStrategy defaultStrategy = FallbackStrategy.ASK_CLARIFICATION;
    private boolean historyEnabled = true;
    private boolean escalationEnabled = true;
    private int historyWindow = 3;
    private int escalationWindow = 5;
    private int escalationThreshold = 3;
}
