package com.github.salilvnair.convrouter.intent;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-count sentiment: whichever side has more hits wins, ties are neutral.
 */
@Component
public class SentimentDetector {

    private static final List<String> POSITIVE_KEYWORDS =
            List.of("great", "excellent", "good", "thanks", "thank you", "love", "perfect");
    private static final List<String> NEGATIVE_KEYWORDS =
            List.of("bad", "terrible", "hate", "issue", "problem", "error", "fail", "wrong");

    public Sentiment detect(String text) {
        if (text == null || text.isBlank()) {
            return Sentiment.NEUTRAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long positive = POSITIVE_KEYWORDS.stream().filter(lower::contains).count();
        long negative = NEGATIVE_KEYWORDS.stream().filter(lower::contains).count();
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }
}
