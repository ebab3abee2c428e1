package com.github.salilvnair.convrouter.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.convrouter")
public class ConvRouterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock convRouterClock() {
        return Clock.systemUTC();
    }
}
