package com.github.salilvnair.convrouter.fallback.provider;

import com.github.salilvnair.convrouter.fallback.FallbackResult;
import com.github.salilvnair.convrouter.fallback.FallbackStrategy;
import com.github.salilvnair.convrouter.fallback.core.FallbackStrategyResolver;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.session.IntentContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AskClarificationFallbackResolver implements FallbackStrategyResolver {

    static final String LEAD = "I need a bit more information to help you. ";

    private static final List<String> GENERIC_QUESTIONS = List.of(
            "Could you please provide more details?",
            "I'm not sure I understand. Could you rephrase that?",
            "What specifically would you like help with?"
    );

    private static final Map<IntentType, List<String>> QUESTIONS = new EnumMap<>(IntentType.class);

    static {
        QUESTIONS.put(IntentType.LOAN_APPLICATION, List.of(
                "What type of loan are you interested in? (business, personal, auto, home)",
                "How much would you like to borrow?",
                "What is the purpose of this loan?"));
        QUESTIONS.put(IntentType.COLLATERAL_CHECK, List.of(
                "What type of asset would you like to use as collateral? (property, vehicle, equipment)",
                "Do you have the asset information ready?"));
        QUESTIONS.put(IntentType.CREDIT_HISTORY, List.of(
                "Would you like to check your credit score?",
                "Would you like to see your credit report?",
                "Are you looking for ways to improve your credit?"));
        QUESTIONS.put(IntentType.DOCUMENT_UPLOAD, List.of(
                "What type of document would you like to upload? (tax return, bank statement, ID, etc.)",
                "Is this for a loan application or another purpose?"));
        QUESTIONS.put(IntentType.PROFILE_ANALYSIS, List.of(
                "Would you like me to analyze your LinkedIn profile?",
                "Are you looking for profile improvement suggestions?"));
        QUESTIONS.put(IntentType.JOB_MATCHING, List.of(
                "What type of job are you looking for?",
                "Would you like job recommendations based on your profile?"));
    }

    private final Clock clock;

    @Override
    public FallbackStrategy strategy() {
        return FallbackStrategy.ASK_CLARIFICATION;
    }

    @Override
    public FallbackResult resolve(Intent intent, IntentContext context) {
        List<String> questions = QUESTIONS.getOrDefault(intent.getType(), GENERIC_QUESTIONS);
        return FallbackResult.builder()
                .strategyUsed(strategy())
                .intent(intent)
                .handled(true)
                .response(LEAD + questions.get(0))
                .clarificationOptions(questions)
                .timestamp(clock.instant())
                .build();
    }
}
