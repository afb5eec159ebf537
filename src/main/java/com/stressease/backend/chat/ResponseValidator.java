package com.stressease.backend.chat;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last line of defence on model output before it reaches the user.
 *
 * Checks run in order: empty, high-risk language, diagnostic claims,
 * treatment or medication advice. The first hit replaces the whole text with
 * a fixed boundary message. Independent of the inbound risk detector.
 */
@Component
@Slf4j
public class ResponseValidator {

    static final String CRISIS_REDIRECT =
            "I notice you're mentioning something serious. If you're experiencing a crisis, please reach out "
            + "to a professional immediately. You can find crisis hotlines and emergency contacts in the "
            + "app's crisis support section, available any time. Would you like me to share some of them with you?";

    static final String DIAGNOSIS_BOUNDARY =
            "I'm here to listen and support you, but I can't provide medical diagnoses or clinical advice. "
            + "Consider discussing your feelings with a healthcare professional who can provide personalized "
            + "guidance. How else can I support you today?";

    static final String TREATMENT_BOUNDARY =
            "I'm here to provide emotional support, but I can't recommend specific treatments or medications. "
            + "A healthcare professional would be the best person to discuss treatment options with you. "
            + "Is there something else on your mind that you'd like to talk about?";

    // Word-bounded so that "diet" or "studied" do not trip "die"
    private static final List<Pattern> HIGH_RISK = List.of(
            bounded("suicide"), bounded("self-harm"), bounded("kill yourself"),
            bounded("end it all"), bounded("hurt myself"), bounded("die"));

    private static final List<String> DIAGNOSTIC = List.of(
            "you have ", "you are suffering from", "you might have", "you probably have",
            "sounds like you have", "diagnosis", "diagnose", "condition is", "disorder",
            "i diagnose", "you exhibit symptoms of", "clinical depression", "clinical anxiety",
            "you are experiencing", "you are exhibiting", "pathological", "psychiatric condition");

    private static final List<String> TREATMENT = List.of(
            "you should take", "you need to take", "prescribe", "medication", "dosage",
            "you should try", "treatment plan", "medical treatment", "therapy regimen");

    /**
     * @return empty for blank output, otherwise the text itself or its replacement
     */
    public Optional<String> validate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String lowered = text.toLowerCase(Locale.ROOT);

        if (HIGH_RISK.stream().anyMatch(p -> p.matcher(lowered).find())) {
            log.info("Generated reply contained high-risk language, redirecting to resources");
            return Optional.of(CRISIS_REDIRECT);
        }
        if (DIAGNOSTIC.stream().anyMatch(lowered::contains)) {
            log.info("Generated reply contained diagnostic language, replaced");
            return Optional.of(DIAGNOSIS_BOUNDARY);
        }
        if (TREATMENT.stream().anyMatch(lowered::contains)) {
            log.info("Generated reply contained treatment advice, replaced");
            return Optional.of(TREATMENT_BOUNDARY);
        }
        return Optional.of(text);
    }

    private static Pattern bounded(String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b");
    }
}
