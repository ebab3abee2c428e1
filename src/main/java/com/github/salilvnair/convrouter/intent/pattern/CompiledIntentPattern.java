package com.github.salilvnair.convrouter.intent.pattern;

import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.model.Attributes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link IntentPattern} with every rule precompiled. Keywords and phrases match whole words only.
 */
public final class CompiledIntentPattern {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    private final IntentPattern source;
    private final List<Pattern> keywords;
    private final List<Pattern> phrases;
    private final List<Pattern> regexes;
    private final Map<String, Pattern> entityPatterns;

    private CompiledIntentPattern(IntentPattern source) {
        this.source = source;
        this.keywords = source.keywords().stream().map(CompiledIntentPattern::wholeWord).toList();
        this.phrases = source.phrases().stream().map(CompiledIntentPattern::wholeWord).toList();
        this.regexes = source.regexPatterns().stream().map(r -> compile(source, r)).toList();
        Map<String, Pattern> entities = new LinkedHashMap<>();
        source.entityPatterns().forEach((name, regex) -> entities.put(name, compile(source, regex)));
        this.entityPatterns = java.util.Collections.unmodifiableMap(entities);
    }

    public static CompiledIntentPattern compile(IntentPattern pattern) {
        validateWeights(pattern);
        return new CompiledIntentPattern(pattern);
    }

    public IntentPattern source() {
        return source;
    }

    public IntentType intentType() {
        return source.intentType();
    }

    /**
     * Weighted sum of keyword, phrase and regex match ratios. Empty signal lists contribute nothing.
     */
    public double score(String text) {
        double score = 0.0;
        if (!keywords.isEmpty()) {
            score += ratio(keywords, text) * source.keywordWeight();
        }
        if (!phrases.isEmpty()) {
            score += ratio(phrases, text) * source.phraseWeight();
        }
        if (!regexes.isEmpty()) {
            score += ratio(regexes, text) * source.regexWeight();
        }
        return score;
    }

    public Attributes extractEntities(String text) {
        if (entityPatterns.isEmpty()) {
            return Attributes.empty();
        }
        Attributes.Builder entities = Attributes.builder();
        entityPatterns.forEach((name, pattern) -> {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                String value = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group();
                entities.text(name, value);
            }
        });
        return entities.build();
    }

    private static double ratio(List<Pattern> patterns, String text) {
        long matches = patterns.stream().filter(p -> p.matcher(text).find()).count();
        return (double) matches / patterns.size();
    }

    private static Pattern wholeWord(String term) {
        return Pattern.compile(WORD_START + Pattern.quote(term.trim()) + WORD_END, FLAGS);
    }

    private static Pattern compile(IntentPattern owner, String regex) {
        try {
            return Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException e) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.INVALID_PATTERN,
                    "Invalid regex in " + owner.patternId() + ": " + regex,
                    e
            );
        }
    }

    private static void validateWeights(IntentPattern pattern) {
        if (pattern.keywordWeight() < 0 || pattern.phraseWeight() < 0 || pattern.regexWeight() < 0) {
            throw new IntentRoutingException(
                    IntentRoutingErrorCode.INVALID_PATTERN,
                    "Negative signal weight in " + pattern.patternId()
            );
        }
    }
}
