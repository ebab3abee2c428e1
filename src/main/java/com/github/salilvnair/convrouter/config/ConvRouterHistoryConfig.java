package com.github.salilvnair.convrouter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convrouter.history")
@Getter
@Setter
public class ConvRouterHistoryConfig {

    private int maxSize = 10_000;
}
