package com.github.salilvnair.convrouter.intent;

import com.github.salilvnair.convrouter.config.ConvRouterClassifierConfig;
import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.intent.pattern.CompiledIntentPattern;
import com.github.salilvnair.convrouter.intent.pattern.IntentPattern;
import com.github.salilvnair.convrouter.intent.pattern.IntentPatternLibrary;
import com.github.salilvnair.convrouter.intent.pattern.IntentPatternLoader;
import com.github.salilvnair.convrouter.model.Attributes;
import com.github.salilvnair.convrouter.session.IntentContext;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keyword, phrase and regex scoring over the configured {@link IntentPatternLibrary}.
 * <p>
 * The library is swapped as a whole on {@link #addPattern} / {@link #removePattern}, so a
 * classification in flight always sees one consistent table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternIntentClassifier implements IntentClassifier {

    private final ConvRouterClassifierConfig config;
    private final IntentPatternLoader patternLoader;
    private final SentimentDetector sentimentDetector;
    private final Clock clock;

    private volatile IntentPatternLibrary library = IntentPatternLibrary.empty();

    @PostConstruct
    public void init() {
        library = patternLoader.load(config.getPatternsLocation());
        log.info("Intent classifier initialized with {} pattern(s)", library.size());
    }

    @Override
    public Intent classify(String text, IntentContext context) {
        String input = normalize(text);
        if (input.isEmpty()) {
            return unknown(text, context, 0.0);
        }

        List<ScoredType> scores = score(input, context);
        if (scores.isEmpty()) {
            return unknown(input, context, 0.0);
        }
        ScoredType best = scores.get(0);
        if (best.score() < config.getMinConfidence()) {
            log.debug("Best intent {} scored {} below minimum {}", best.type(), best.score(), config.getMinConfidence());
            return unknown(input, context, best.score());
        }
        log.debug("Classified '{}' as {} ({})", input, best.type(), best.score());
        return toIntent(best, input, context);
    }

    @Override
    public MultiIntentResult classifyMulti(String text, IntentContext context) {
        String input = normalize(text);
        List<ScoredType> accepted = new ArrayList<>();
        if (!input.isEmpty()) {
            for (ScoredType scored : score(input, context)) {
                if (scored.score() >= config.getMultiIntentThreshold()) {
                    accepted.add(scored);
                }
            }
        }

        if (accepted.isEmpty()) {
            Intent unknown = unknown(input.isEmpty() ? text : input, context, 0.0);
            return new MultiIntentResult(unknown, List.of(), List.of(unknown.getIntentId()), true);
        }

        List<Intent> intents = new ArrayList<>(accepted.size());
        for (ScoredType scored : accepted) {
            intents.add(toIntent(scored, input, context));
        }
        boolean requiresClarification = accepted.size() > 1
                && accepted.get(0).score() - accepted.get(1).score() < config.getClarificationMargin();

        log.debug("Detected {} intent(s) in '{}', clarification={}", intents.size(), input, requiresClarification);
        return new MultiIntentResult(
                intents.get(0),
                intents.subList(1, intents.size()),
                intents.stream().map(Intent::getIntentId).toList(),
                requiresClarification
        );
    }

    public void addPattern(IntentPattern pattern) {
        if (pattern == null || pattern.intentType() == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_PATTERN, "Pattern and its intent type are required");
        }
        synchronized (this) {
            library = library.withPattern(pattern);
        }
        log.info("Added intent pattern {} for {}", pattern.patternId(), pattern.intentType());
    }

    public boolean removePattern(IntentType type) {
        synchronized (this) {
            if (!library.contains(type)) {
                return false;
            }
            library = library.withoutPattern(type);
        }
        log.info("Removed intent pattern for {}", type);
        return true;
    }

    public IntentPatternLibrary patterns() {
        return library;
    }

    /**
     * Scores every type in the library, highest first. Equal scores keep enum declaration order.
     */
    private List<ScoredType> score(String input, IntentContext context) {
        IntentPatternLibrary snapshot = library;
        String topic = context == null ? null : context.getCurrentTopic();
        List<String> frequent = context == null
                ? List.of()
                : context.getUserPreferences().getTextList(config.getFrequentIntentsKey());

        List<ScoredType> scores = new ArrayList<>(snapshot.size());
        for (CompiledIntentPattern pattern : snapshot.compiled()) {
            double score = pattern.score(input);
            String code = pattern.intentType().code();
            if (code.equals(topic)) {
                score += config.getTopicBonus();
            }
            if (frequent.contains(code)) {
                score += config.getFrequentIntentBonus();
            }
            scores.add(new ScoredType(pattern, Math.min(1.0, score)));
        }
        scores.sort(Comparator.comparingDouble(ScoredType::score).reversed());
        return scores;
    }

    private Intent toIntent(ScoredType scored, String input, IntentContext context) {
        return Intent.builder()
                .type(scored.type())
                .confidence(scored.score())
                .userInput(input)
                .entities(scored.pattern().extractEntities(input))
                .language(languageOf(context))
                .sentiment(sentimentDetector.detect(input))
                .timestamp(clock.instant())
                .build();
    }

    private Intent unknown(String input, IntentContext context, double confidence) {
        return Intent.builder()
                .type(IntentType.UNKNOWN)
                .confidence(confidence)
                .userInput(input)
                .entities(Attributes.empty())
                .language(languageOf(context))
                .sentiment(sentimentDetector.detect(input))
                .timestamp(clock.instant())
                .build();
    }

    private String languageOf(IntentContext context) {
        return context != null ? context.getLanguage() : config.getDefaultLanguage();
    }

    private static String normalize(String text) {
        if (text == null) {
            throw new IntentRoutingException(IntentRoutingErrorCode.INVALID_INPUT);
        }
        return text.trim();
    }

    private record ScoredType(CompiledIntentPattern pattern, double score) {
        IntentType type() {
            return pattern.intentType();
        }
    }
}
