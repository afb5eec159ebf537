package com.stressease.backend.chat;

import com.stressease.backend.model.Message;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The AI dialogue context owned by a single chat session: the persona
 * prompt followed by every committed user/assistant turn.
 *
 * Operations return new instances; a session swaps its dialogue only when a
 * turn completes, so a failed generation never leaves a half-written history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Dialogue {

    private List<Message> history = new ArrayList<>();

    public static Dialogue open(String personaPrompt) {
        List<Message> seeded = new ArrayList<>();
        seeded.add(Message.system(personaPrompt));
        return new Dialogue(seeded);
    }

    /** The history plus a pending user turn, as sent to the model. */
    public List<Message> withUserTurn(String userMessage) {
        List<Message> messages = new ArrayList<>(history);
        messages.add(Message.user(userMessage));
        return Collections.unmodifiableList(messages);
    }

    public Dialogue append(String userMessage, String assistantReply) {
        List<Message> messages = new ArrayList<>(history);
        messages.add(Message.user(userMessage));
        messages.add(Message.assistant(assistantReply));
        return new Dialogue(messages);
    }

    /** User and assistant turns only, without the persona prompt. */
    public List<Message> turns() {
        return history.stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
    }
}
