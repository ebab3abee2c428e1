package com.github.salilvnair.convrouter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convrouter.session")
@Getter
@Setter
public class ConvRouterSessionConfig {

    private long timeoutMinutes = 30L;
    private boolean cleanupEnabled = true;
    private long cleanupIntervalMs = 60_000L;
    private String defaultLanguage = "en";
}
