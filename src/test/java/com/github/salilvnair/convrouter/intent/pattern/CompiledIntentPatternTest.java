package com.github.salilvnair.convrouter.intent.pattern;

import com.github.salilvnair.convrouter.exception.IntentRoutingErrorCode;
import com.github.salilvnair.convrouter.exception.IntentRoutingException;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.model.Attributes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convrouter.support.TestConstants.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompiledIntentPatternTest {

    @Test
    void keywordsMatchWholeWordsOnly() {
        CompiledIntentPattern pattern = CompiledIntentPattern.compile(
                new IntentPattern(null, IntentType.GREETING, List.of("hi"), List.of(), List.of(), 1.0, 0.0, 0.0, null));

        assertEquals(0.0, pattern.score("this is shipping"), EPSILON);
        assertEquals(1.0, pattern.score("oh, hi!"), EPSILON);
        assertEquals(1.0, pattern.score("HI"), EPSILON);
    }

    @Test
    void scoreIsWeightedSumOfMatchRatios() {
        CompiledIntentPattern pattern = CompiledIntentPattern.compile(new IntentPattern(null, IntentType.STATUS,
                List.of("status", "progress"), List.of("check status"), List.of("\\bstatus\\b", "\\border\\b"),
                0.3, 0.3, 0.4, null));

        // keywords 1/2, phrases 1/1, regexes 1/2
        assertEquals(0.15 + 0.3 + 0.2, pattern.score("check status please"), EPSILON);
    }

    @Test
    void emptySignalListsContributeNothing() {
        CompiledIntentPattern pattern = CompiledIntentPattern.compile(IntentPattern.of(IntentType.HELP, List.of("help"), List.of(), List.of()));

        assertEquals(IntentPattern.DEFAULT_KEYWORD_WEIGHT, pattern.score("help"), EPSILON);
    }

    @Test
    void entityUsesFirstGroupOrWholeMatch() {
        CompiledIntentPattern pattern = CompiledIntentPattern.compile(new IntentPattern(null, IntentType.LOAN_APPLICATION,
                List.of("loan"), List.of(), List.of(), null, null, null,
                Map.of("amount", "\\$(\\d+)", "term", "\\d+ months")));

        Attributes entities = pattern.extractEntities("loan of $1200 over 24 months");

        assertEquals("1200", entities.getText("amount").orElseThrow());
        assertEquals("24 months", entities.getText("term").orElseThrow());
        assertTrue(pattern.extractEntities("no numbers").isEmpty());
    }

    @Test
    void invalidRegexIsReported() {
        IntentRoutingException ex = assertThrows(IntentRoutingException.class, () -> CompiledIntentPattern.compile(
                IntentPattern.of(IntentType.HELP, List.of(), List.of(), List.of("[oops"))));

        assertTrue(ex.is(IntentRoutingErrorCode.INVALID_PATTERN));
    }

    @Test
    void negativeWeightIsReported() {
        assertThrows(IntentRoutingException.class, () -> CompiledIntentPattern.compile(
                new IntentPattern(null, IntentType.HELP, List.of("help"), List.of(), List.of(), -0.1, null, null, null)));
    }
}
