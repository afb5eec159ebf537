package com.stressease.backend.chat;

import com.stressease.backend.model.Message;
import com.stressease.backend.profile.UserProfile;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt texts sent to the generative model.
 */
final class PersonaPrompts {

    private PersonaPrompts() {
    }

    static final String PERSONA = """
            CORE IDENTITY:
            You are StressBot, an AI companion from the StressEase app. Your primary purpose is to provide \
            a supportive, non-judgmental space for users to express their feelings and work through stress \
            and emotional challenges.

            TONE AND LANGUAGE:
            Your tone must always be warm, patient and empathetic. Use simple, clear language that feels \
            conversational and human. Avoid clinical jargon. Always validate the user's feelings first \
            (for example 'That sounds really tough') before offering gentle guidance.

            CRITICAL SAFETY BOUNDARY:
            You are NOT a licensed therapist, psychologist, psychiatrist or medical professional. You must never:
            - Diagnose any mental health condition or disorder
            - Prescribe medication or medical treatments
            - Provide medical advice or clinical assessments
            Your role is that of a supportive peer and emotional companion.

            CRISIS INTERVENTION PROTOCOL:
            If a user expresses thoughts of self-harm or suicide, or mentions being in immediate danger, \
            gently pivot the conversation to recommend professional help and point them to the crisis \
            support section of the app.

            CONVERSATION STYLE:
            - Keep responses concise (2-4 sentences)
            - Ask thoughtful, open-ended questions to encourage reflection
            - Offer practical coping strategies when appropriate
            - Encourage professional help when the situation warrants it""";

    static final String CLOSING =
            "Remember: be supportive, be concise and always put the user's emotional safety first.";

    static String persona(UserProfile profile) {
        StringBuilder prompt = new StringBuilder(PERSONA);

        if (profile != null) {
            prompt.append("\n\nUSER PROFILE CONTEXT (use gently, don't mention everything at once):\n");
            if (profile.getName() != null) {
                prompt.append("- Name: ").append(profile.getName()).append('\n');
            }
            if (profile.getAge() != null) {
                prompt.append("- Age: ").append(profile.getAge()).append('\n');
            }
            appendList(prompt, "Health considerations", profile.getHealthConditions());
            appendList(prompt, "Known stress triggers", profile.getStressTriggers());
            appendList(prompt, "Personal goals", profile.getGoals());
        }

        return prompt.append("\n\n").append(CLOSING).toString();
    }

    static String title(String transcript) {
        return """
                Read this conversation and generate a short, descriptive title (3-5 words max).
                Examples: 'Struggling with Work Stress', 'A Positive Day', 'Managing Anxiety Today'.
                Respond with only the title, no quotes or additional text.

                Conversation:
                %s

                Title:""".formatted(transcript);
    }

    static String summary(String transcript) {
        return """
                Summarize this mental health conversation in one paragraph. Cover the main concerns the \
                user shared, their emotional state and how it changed, any coping strategies that were \
                discussed, and the overall outcome.

                Conversation:
                %s

                Summary:""".formatted(transcript);
    }

    static String transcript(List<Message> turns) {
        return turns.stream()
                .map(m -> capitalize(m.getRole().name()) + ": " + m.getContent())
                .collect(Collectors.joining("\n"));
    }

    private static void appendList(StringBuilder prompt, String label, List<String> values) {
        if (values != null && !values.isEmpty()) {
            prompt.append("- ").append(label).append(": ").append(String.join(", ", values)).append('\n');
        }
    }

    private static String capitalize(String role) {
        return Character.toUpperCase(role.charAt(0)) + role.substring(1);
    }
}
