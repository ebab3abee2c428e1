package com.github.salilvnair.convrouter.config;

import com.github.salilvnair.convrouter.intent.pattern.IntentPatternLoader;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convrouter.classifier")
@Getter
@Setter
public class ConvRouterClassifierConfig {

    private double minConfidence = 0.3;
    private double multiIntentThreshold = 0.6;
    private double clarificationMargin = 0.15;
    private double topicBonus = 0.10;
    private double frequentIntentBonus = 0.05;
    private String frequentIntentsKey = "frequent_intents";
    private String defaultLanguage = "en";
    private String patternsLocation = IntentPatternLoader.DEFAULT_LOCATION;
}
