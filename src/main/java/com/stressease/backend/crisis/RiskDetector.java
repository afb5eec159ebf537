package com.stressease.backend.crisis;

import com.stressease.backend.config.StressEaseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical risk detector for inbound user messages.
 *
 * Each category owns a list of phrases compiled to word-boundary patterns.
 * Categories are tested in enum order (suicide, self_harm, general) and the
 * first category with any matching phrase wins.
 */
@Component
@Slf4j
public class RiskDetector {

    static final List<String> DEFAULT_SUICIDE = List.of(
            "suicide", "suicidal", "kill myself", "killing myself", "end my life",
            "take my own life", "want to die", "wanna die", "better off dead",
            "no reason to live", "end it all", "don't want to live");

    static final List<String> DEFAULT_SELF_HARM = List.of(
            "self harm", "self-harm", "hurt myself", "hurting myself", "harm myself",
            "cut myself", "cutting myself", "burn myself", "injure myself", "punish myself");

    static final List<String> DEFAULT_GENERAL = List.of(
            "hopeless", "can't go on", "cannot go on", "can't take it anymore",
            "no way out", "give up on everything", "worthless", "in crisis",
            "falling apart", "nobody would care");

    private static final Pattern APOSTROPHES = Pattern.compile("[\u2018\u2019\u02BC]");

    private final Map<RiskCategory, List<Pattern>> patterns;

    public RiskDetector(StressEaseProperties properties) {
        StressEaseProperties.Crisis.Patterns configured = properties.getCrisis().getPatterns();

        Map<RiskCategory, List<Pattern>> compiled = new EnumMap<>(RiskCategory.class);
        compiled.put(RiskCategory.SUICIDE, compile(orDefault(configured.getSuicide(), DEFAULT_SUICIDE)));
        compiled.put(RiskCategory.SELF_HARM, compile(orDefault(configured.getSelfHarm(), DEFAULT_SELF_HARM)));
        compiled.put(RiskCategory.GENERAL, compile(orDefault(configured.getGeneral(), DEFAULT_GENERAL)));
        this.patterns = Collections.unmodifiableMap(compiled);

        compiled.forEach((category, list) ->
                log.info("Risk detector category [{}] loaded with {} phrases", category.wireName(), list.size()));
    }

    public RiskDetectionResult detect(String text) {
        if (text == null || text.isBlank()) {
            return RiskDetectionResult.none();
        }

        String lowered = normalize(text);

        // EnumMap iterates in declaration order
        for (Map.Entry<RiskCategory, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(lowered).find()) {
                    return RiskDetectionResult.of(entry.getKey());
                }
            }
        }
        return RiskDetectionResult.none();
    }

    private static List<String> orDefault(List<String> configured, List<String> defaults) {
        return configured == null || configured.isEmpty() ? defaults : configured;
    }

    static List<Pattern> compile(List<String> phrases) {
        return phrases.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(p -> Pattern.compile("\\b" + Pattern.quote(normalize(p)) + "\\b"))
                .toList();
    }

    /** Lower-cases and folds typographic apostrophes (U+2018, U+2019, U+02BC) to {@code '}. */
    static String normalize(String text) {
        return APOSTROPHES.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("'");
    }
}
