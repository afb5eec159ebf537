package com.stressease.backend.chat;

import com.stressease.backend.llm.LlmClient;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import com.stressease.backend.profile.UserProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DialogueServiceTest {

    @Mock LlmClient llmClient;

    @InjectMocks
    DialogueService service;

    @Test
    void open_withProfile_personalizesPersonaPrompt() {
        UserProfile profile = UserProfile.builder()
                .name("Asha")
                .age(24)
                .stressTriggers(List.of("exams", "deadlines"))
                .goals(List.of())
                .build();

        Dialogue dialogue = service.open(Optional.of(profile));

        assertThat(dialogue.getHistory()).hasSize(1);
        Message persona = dialogue.getHistory().get(0);
        assertThat(persona.getRole()).isEqualTo(Message.Role.system);
        assertThat(persona.getContent())
                .contains("StressBot")
                .contains("- Name: Asha")
                .contains("- Age: 24")
                .contains("- Known stress triggers: exams, deadlines")
                .doesNotContain("Personal goals");
    }

    @Test
    void open_withoutProfile_hasNoProfileSection() {
        Dialogue dialogue = service.open(Optional.empty());

        assertThat(dialogue.getHistory().get(0).getContent()).doesNotContain("USER PROFILE CONTEXT");
    }

    @Test
    @SuppressWarnings("unchecked")
    void reply_sendsHistoryPlusUserTurn_withoutModifyingDialogue() {
        Dialogue dialogue = Dialogue.open("persona").append("hi", "hello!");
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder().content("ok").build());

        service.reply(dialogue, "I'm tired");

        ArgumentCaptor<List<Message>> sent = ArgumentCaptor.forClass(List.class);
        verify(llmClient).chat(sent.capture(), any());
        assertThat(sent.getValue()).hasSize(4);
        assertThat(sent.getValue().get(3).getContent()).isEqualTo("I'm tired");
        assertThat(dialogue.getHistory()).hasSize(3);
    }

    @Test
    void title_stripsQuotesAndTruncates() {
        Dialogue dialogue = Dialogue.open("persona").append("work is a lot", "that sounds hard");
        when(llmClient.chat(anyList(), eq(DialogueService.TITLE_OPTIONS)))
                .thenReturn(LlmResponse.builder().content("\"Struggling with Work Stress\"").build());

        assertThat(service.title(dialogue)).isEqualTo("Struggling with Work Stress");
    }

    @Test
    void title_tooLong_isCutTo50Characters() {
        Dialogue dialogue = Dialogue.open("persona").append("a", "b");
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder().content("x".repeat(80)).build());

        String title = service.title(dialogue);

        assertThat(title).hasSize(50).endsWith("...");
    }

    @Test
    void title_degraded_returnsDefault() {
        Dialogue dialogue = Dialogue.open("persona").append("a", "b");
        when(llmClient.chat(anyList(), any()))
                .thenReturn(LlmResponse.builder().content("trouble connecting").degraded(true).build());

        assertThat(service.title(dialogue)).isEqualTo(DialogueService.DEFAULT_TITLE);
    }

    @Test
    void summarize_usesTranscriptWithoutPersona() {
        Dialogue dialogue = Dialogue.open("SECRET PERSONA").append("exams stress me", "what helps you?");
        when(llmClient.chat(anyList(), eq(DialogueService.SUMMARY_OPTIONS)))
                .thenReturn(LlmResponse.builder().content("  The user discussed exam stress.  ").build());

        Optional<String> summary = service.summarize(dialogue);

        assertThat(summary).contains("The user discussed exam stress.");
        verify(llmClient).chat(argThat(messages -> messages.size() == 1
                && messages.get(0).getContent().contains("User: exams stress me")
                && messages.get(0).getContent().contains("Assistant: what helps you?")
                && !messages.get(0).getContent().contains("SECRET PERSONA")), any());
    }

    @Test
    void summarize_blankResponse_isEmpty() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder().content(" ").build());

        assertThat(service.summarize(Dialogue.open("p").append("a", "b"))).isEmpty();
    }
}
