package com.github.salilvnair.convrouter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convrouter.dispatch")
@Getter
@Setter
public class ConvRouterDispatchConfig {

    /**
     * Upper bound for a single handler call. Zero or negative runs handlers inline, unbounded.
     */
    private long handlerTimeoutMs = 30_000L;
    private int workerThreads = 4;
    private int queueCapacity = 1000;
    private long keepAliveSeconds = 60;
}
