package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.JsonNode;
import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.InputValidationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of the daily quiz payload.
 *
 * Works on the raw JSON tree so that "integer" means a JSON integral number:
 * "3", 3.0 and true are all rejected. Every failure names the sub-object it
 * was found in.
 */
@Component
public class DailyQuizValidator {

    static final int MIN_SCORE = 1;
    static final int MAX_SCORE = 5;
    static final int ROTATING_COUNT = 5;

    private static final List<String> CORE_KEYS = List.of("mood", "energy", "sleep", "stress");
    private static final List<String> ROTATING_KEYS = List.of("domain_name", "scores");
    private static final List<String> DASS_KEYS = List.of("depression", "anxiety", "stress");

    private final int maxNotesLength;

    public DailyQuizValidator(StressEaseProperties properties) {
        this.maxNotesLength = properties.getQuiz().getMaxNotesLength();
    }

    public ValidatedQuiz validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new InputValidationException("body", "JSON object body required");
        }

        JsonNode core = requireObject(payload, "core_scores", CORE_KEYS);
        JsonNode rotating = requireObject(payload, "rotating_scores", ROTATING_KEYS);
        JsonNode dass = requireObject(payload, "dass_today", DASS_KEYS);

        CoreScores coreScores = new CoreScores(
                score(core.get("mood"), "core_scores"),
                score(core.get("energy"), "core_scores"),
                score(core.get("sleep"), "core_scores"),
                score(core.get("stress"), "core_scores"));

        RotatingScores rotatingScores = rotating(rotating);

        DassScores dassToday = new DassScores(
                score(dass.get("depression"), "dass_today"),
                score(dass.get("anxiety"), "dass_today"),
                score(dass.get("stress"), "dass_today"));

        return new ValidatedQuiz(coreScores, rotatingScores, dassToday, date(payload), notes(payload));
    }

    private JsonNode requireObject(JsonNode payload, String field, List<String> keys) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw new InputValidationException(field, field + " is required");
        }
        if (!node.isObject()) {
            throw new InputValidationException(field, field + " must be an object");
        }

        for (String key : keys) {
            if (!node.has(key)) {
                throw new InputValidationException(field,
                        field + " must contain exactly " + String.join(", ", keys) + " (missing " + key + ")");
            }
        }

        Set<String> allowed = Set.copyOf(keys);
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new InputValidationException(field,
                        field + " must contain exactly " + String.join(", ", keys) + " (unexpected " + name + ")");
            }
        }
        return node;
    }

    private RotatingScores rotating(JsonNode rotating) {
        JsonNode domain = rotating.get("domain_name");
        if (!domain.isTextual() || domain.asText().isBlank()) {
            throw new InputValidationException("rotating_scores", "domain_name must be a non-empty string");
        }

        JsonNode scores = rotating.get("scores");
        if (!scores.isArray() || scores.size() != ROTATING_COUNT) {
            throw new InputValidationException("rotating_scores",
                    "scores must be a list of " + ROTATING_COUNT + " integers");
        }

        List<Integer> values = new ArrayList<>(ROTATING_COUNT);
        for (JsonNode score : scores) {
            values.add(score(score, "rotating_scores"));
        }
        return new RotatingScores(domain.asText(), List.copyOf(values));
    }

    private int score(JsonNode node, String field) {
        // isIntegralNumber is false for 3.0, "3" and booleans
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InputValidationException(field,
                    "All " + field + " values must be integers between " + MIN_SCORE + " and " + MAX_SCORE);
        }
        int value = node.intValue();
        if (value < MIN_SCORE || value > MAX_SCORE) {
            throw new InputValidationException(field,
                    "All " + field + " values must be integers between " + MIN_SCORE + " and " + MAX_SCORE);
        }
        return value;
    }

    private LocalDate date(JsonNode payload) {
        JsonNode date = payload.get("date");
        if (date == null || date.isNull()) {
            return null;
        }
        if (!date.isTextual()) {
            throw new InputValidationException("date", "date must be an ISO date string (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(date.asText());
        } catch (DateTimeParseException e) {
            throw new InputValidationException("date", "date must be an ISO date string (YYYY-MM-DD)");
        }
    }

    private String notes(JsonNode payload) {
        JsonNode notes = payload.get("additional_notes");
        if (notes == null || notes.isNull()) {
            return null;
        }
        if (!notes.isTextual()) {
            throw new InputValidationException("additional_notes", "additional_notes must be a string");
        }
        String text = notes.asText();
        if (text.length() > maxNotesLength) {
            throw new InputValidationException("additional_notes",
                    "additional_notes must be " + maxNotesLength + " characters or less");
        }
        return text.isBlank() ? null : text;
    }
}
