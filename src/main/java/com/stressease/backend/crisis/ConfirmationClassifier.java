package com.stressease.backend.crisis;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies the reply to a pending crisis-resource offer.
 * Affirmative words are checked first, so "yes, not now" is affirmative.
 */
@Component
public class ConfirmationClassifier {

    private static final List<Pattern> AFFIRMATIVE = RiskDetector.compile(
            List.of("yes", "sure", "okay", "ok", "please", "help", "need"));

    private static final List<Pattern> NEGATIVE = RiskDetector.compile(
            List.of("no", "not", "don't", "later", "maybe"));

    public ConfirmationIntent classify(String reply) {
        if (reply == null || reply.isBlank()) {
            return ConfirmationIntent.UNCLEAR;
        }

        String lowered = RiskDetector.normalize(reply);
        if (matchesAny(AFFIRMATIVE, lowered)) {
            return ConfirmationIntent.AFFIRMATIVE;
        }
        if (matchesAny(NEGATIVE, lowered)) {
            return ConfirmationIntent.NEGATIVE;
        }
        return ConfirmationIntent.UNCLEAR;
    }

    private boolean matchesAny(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }
}
