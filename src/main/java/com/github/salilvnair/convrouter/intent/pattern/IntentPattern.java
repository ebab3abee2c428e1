package com.github.salilvnair.convrouter.intent.pattern;

import com.github.salilvnair.convrouter.intent.IntentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matching rules for one intent type. Weights default to 0.3 / 0.5 / 0.2 (keyword / phrase / regex).
 */
public record IntentPattern(
        String patternId,
        IntentType intentType,
        List<String> keywords,
        List<String> phrases,
        List<String> regexPatterns,
        Double keywordWeight,
        Double phraseWeight,
        Double regexWeight,
        Map<String, String> entityPatterns
) {

    public static final double DEFAULT_KEYWORD_WEIGHT = 0.3;
    public static final double DEFAULT_PHRASE_WEIGHT = 0.5;
    public static final double DEFAULT_REGEX_WEIGHT = 0.2;

    public IntentPattern {
        Objects.requireNonNull(intentType, "intentType");
        if (patternId == null || patternId.isBlank()) {
            patternId = "pattern_" + intentType.code();
        }
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
        regexPatterns = regexPatterns == null ? List.of() : List.copyOf(regexPatterns);
        keywordWeight = keywordWeight == null ? DEFAULT_KEYWORD_WEIGHT : keywordWeight;
        phraseWeight = phraseWeight == null ? DEFAULT_PHRASE_WEIGHT : phraseWeight;
        regexWeight = regexWeight == null ? DEFAULT_REGEX_WEIGHT : regexWeight;
        entityPatterns = entityPatterns == null
                ? Map.of()
                : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(entityPatterns));
    }

    public static IntentPattern of(IntentType intentType,
                                   List<String> keywords,
                                   List<String> phrases,
                                   List<String> regexPatterns) {
        return new IntentPattern(null, intentType, keywords, phrases, regexPatterns, null, null, null, null);
    }
}
