package com.github.salilvnair.convrouter.intent.pattern;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the intent pattern table from a JSON resource of the form {@code {"patterns": [...]}}.
 */
@Slf4j
@Component
public class IntentPatternLoader {

    public static final String DEFAULT_LOCATION = "classpath:convrouter/intent-patterns.json";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper;

    public IntentPatternLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.mapper = JsonUtil.mapper().copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static IntentPatternLibrary loadDefault() {
        return new IntentPatternLoader(new DefaultResourceLoader()).load(DEFAULT_LOCATION);
    }

    public IntentPatternLibrary load(String location) {
        String effective = location == null || location.isBlank() ? DEFAULT_LOCATION : location;
        Resource resource = resourceLoader.getResource(effective);
        if (!resource.exists()) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.PATTERN_LOAD_FAILED,
                    "Intent pattern resource not found: " + effective
            );
        }
        try (InputStream in = resource.getInputStream()) {
            PatternDocument document = mapper.readValue(in, PatternDocument.class);
            List<IntentPattern> patterns = document.patterns() == null ? List.of() : document.patterns();
            IntentPatternLibrary library = IntentPatternLibrary.of(patterns);
            log.info("Loaded {} intent patterns from {}", library.size(), effective);
            return library;
        } catch (IOException e) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.PATTERN_LOAD_FAILED,
                    "Failed to read intent patterns from " + effective,
                    e
            );
        }
    }

    public record PatternDocument(List<IntentPattern> patterns) {
    }
}
