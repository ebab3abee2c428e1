package com.github.salilvnair.convrouter.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "convrouter.session", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class ConvRouterSchedulingConfig {
}
