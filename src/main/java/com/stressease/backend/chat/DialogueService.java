package com.stressease.backend.chat;

import com.stressease.backend.llm.GenerationOptions;
import com.stressease.backend.llm.LlmClient;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import com.stressease.backend.profile.UserProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Everything the chat flow asks of the generative model: opening a dialogue,
 * producing the next reply, and titling or summarizing a finished session.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DialogueService {

    static final GenerationOptions TITLE_OPTIONS = GenerationOptions.of(20, 0.3);
    static final GenerationOptions SUMMARY_OPTIONS = GenerationOptions.of(300, 0.5);

    static final String DEFAULT_TITLE = "Chat Session";
    static final int MAX_TITLE_LENGTH = 50;

    private final LlmClient llmClient;

    public Dialogue open(Optional<UserProfile> profile) {
        return Dialogue.open(PersonaPrompts.persona(profile.orElse(null)));
    }

    /**
     * Generates the assistant reply to {@code userMessage}. The dialogue itself
     * is not modified; the caller appends the exchange once it accepts the reply.
     */
    public LlmResponse reply(Dialogue dialogue, String userMessage) {
        List<Message> messages = dialogue.withUserTurn(userMessage);
        log.debug("Requesting reply with {} messages of context", messages.size());
        return llmClient.chat(messages, GenerationOptions.DEFAULT);
    }

    public String title(Dialogue dialogue) {
        LlmResponse response = llmClient.chat(
                List.of(Message.user(PersonaPrompts.title(PersonaPrompts.transcript(dialogue.turns())))),
                TITLE_OPTIONS);

        if (response.isDegraded() || response.getContent() == null) {
            return DEFAULT_TITLE;
        }

        String title = stripQuotes(response.getContent().strip());
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH - 3) + "...";
        }
        return title.isEmpty() ? DEFAULT_TITLE : title;
    }

    /**
     * @return the summary, or empty when the model produced nothing usable
     */
    public Optional<String> summarize(Dialogue dialogue) {
        LlmResponse response = llmClient.chat(
                List.of(Message.user(PersonaPrompts.summary(PersonaPrompts.transcript(dialogue.turns())))),
                SUMMARY_OPTIONS);

        if (response.isDegraded() || response.getContent() == null || response.getContent().isBlank()) {
            log.warn("Summary generation produced no usable text (degraded={})", response.isDegraded());
            return Optional.empty();
        }
        return Optional.of(response.getContent().strip());
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).strip();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
