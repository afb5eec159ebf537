package com.stressease.backend.crisis;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Templated replies for the two-step crisis dialogue:
 * offer (crisis reply + confirmation prompt), then reveal (reply + full catalog).
 */
@Component
@RequiredArgsConstructor
public class CrisisResponseComposer {

    static final String SUICIDE_REPLY =
            "I'm really sorry you're feeling this way, and I'm glad you told me. "
            + "Your life matters, and you don't have to go through this alone. "
            + "If you are thinking about ending your life, please reach out to a crisis line "
            + "or emergency services right now. They are there to help, any time of day.";

    static final String SELF_HARM_REPLY =
            "Thank you for trusting me with something so painful. Wanting to hurt yourself "
            + "is a sign of how much you're carrying right now, and you deserve support and care. "
            + "Talking to someone trained to help can make this moment feel less overwhelming.";

    static final String GENERAL_REPLY =
            "It sounds like you are going through a lot right now, and it's brave of you to share that. "
            + "You don't have to handle this on your own. For immediate support, connecting with a "
            + "crisis hotline or a mental health professional can really help.";

    static final String CONFIRMATION_PROMPT =
            "Would you like me to share some crisis support contacts with you now? Please reply yes or no.";

    static final String AFFIRMATIVE_REVEAL =
            "Thank you for letting me help. Here are people you can reach out to right now. "
            + "If you are in immediate danger, please call your local emergency number first. "
            + "I'm still here with you, and we can keep talking whenever you're ready.";

    static final String DECLINED_REVEAL =
            "That's completely okay. I'll leave these contacts here so they're available whenever "
            + "you might need them. Reaching out is a sign of strength, not weakness. "
            + "I'm still here to listen if you want to keep talking.";

    private final CrisisContactCatalog catalog;

    public String composeCrisisReply(RiskCategory category) {
        if (category == null) {
            return GENERAL_REPLY;
        }
        return switch (category) {
            case SUICIDE -> SUICIDE_REPLY;
            case SELF_HARM -> SELF_HARM_REPLY;
            default -> GENERAL_REPLY;
        };
    }

    public String composeConfirmationPrompt() {
        return CONFIRMATION_PROMPT;
    }

    /** Crisis reply followed by the confirmation prompt, as sent when an offer opens. */
    public String composeOffer(RiskCategory category) {
        return composeCrisisReply(category) + "\n\n" + composeConfirmationPrompt();
    }

    public ResourceReveal composeResourceRevealReply(ConfirmationIntent intent) {
        String text = intent == ConfirmationIntent.AFFIRMATIVE ? AFFIRMATIVE_REVEAL : DECLINED_REVEAL;
        return new ResourceReveal(text, catalog.all());
    }

    public record ResourceReveal(String text, List<CrisisContact> contacts) {}
}
