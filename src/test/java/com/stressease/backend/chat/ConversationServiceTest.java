package com.stressease.backend.chat;

import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.crisis.ConfirmationClassifier;
import com.stressease.backend.crisis.ConfirmationIntent;
import com.stressease.backend.crisis.CrisisContactCatalog;
import com.stressease.backend.crisis.CrisisResponseComposer;
import com.stressease.backend.crisis.RiskCategory;
import com.stressease.backend.crisis.RiskDetector;
import com.stressease.backend.exception.InputValidationException;
import com.stressease.backend.exception.SessionBusyException;
import com.stressease.backend.exception.SessionExpiredException;
import com.stressease.backend.llm.LlmClient;
import com.stressease.backend.model.ChatMessageResponse;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import com.stressease.backend.profile.UserProfileService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConversationServiceTest {

    private static final String USER = "user-1";

    private LlmClient llmClient;
    private InMemoryChatSessionStore store;
    private CrisisContactCatalog catalog;
    private ConversationService service;
    private UserProfileService profiles;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        profiles = mock(UserProfileService.class);
        when(profiles.findProfile(anyString())).thenReturn(Optional.empty());
        store = new InMemoryChatSessionStore();
        catalog = new CrisisContactCatalog();
        service = serviceOver(store);
    }

    /** Each call stands for one application instance: its own locks, a shared store. */
    private ConversationService serviceOver(ChatSessionStore sharedStore) {
        return new ConversationService(
                sharedStore,
                new SessionLocks(16, 2000),
                new RiskDetector(new StressEaseProperties()),
                new ConfirmationClassifier(),
                new CrisisResponseComposer(catalog),
                new ResponseValidator(),
                new DialogueService(llmClient),
                profiles,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void handleMessage_noSessionId_createsSessionAndRepliesWithGeneratedText() {
        replyWith("That sounds like a long day. What was the hardest part?");

        ChatMessageResponse response = service.handleMessage(USER, "  I had a long day  ", null);

        assertThat(response.getSessionId()).isNotBlank();
        assertThat(response.getUserMessage().content()).isEqualTo("I had a long day");
        assertThat(response.getUserMessage().role()).isEqualTo("user");
        assertThat(response.getAiResponse().content()).startsWith("That sounds like a long day");
        assertThat(response.getAiResponse().role()).isEqualTo("assistant");
        assertThat(response.getCrisisDetected()).isNull();
        assertThat(response.getShowResources()).isNull();

        ChatSession session = store.get(response.getSessionId()).orElseThrow();
        assertThat(session.getUserId()).isEqualTo(USER);
        assertThat(session.getCrisisOfferState()).isEqualTo(CrisisOfferState.NOT_OFFERED);
        assertThat(session.getDialogue().turns()).extracting(Message::getContent)
                .containsExactly("I had a long day", "That sounds like a long day. What was the hardest part?");
    }

    @Test
    void handleMessage_unknownSessionId_throwsSessionExpired() {
        assertThatThrownBy(() -> service.handleMessage(USER, "hello", "does-not-exist"))
                .isInstanceOf(SessionExpiredException.class);
        verifyNoInteractions(llmClient);
    }

    @Test
    void handleMessage_sessionOfAnotherUser_isTreatedAsExpired() {
        replyWith("Hi there!");
        String sessionId = service.handleMessage(USER, "hello", null).getSessionId();

        assertThatThrownBy(() -> service.handleMessage("intruder", "hello", sessionId))
                .isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void handleMessage_blankMessage_rejected() {
        assertThatThrownBy(() -> service.handleMessage(USER, "   ", null))
                .isInstanceOf(InputValidationException.class)
                .hasMessage("Message cannot be empty");
    }

    @Test
    void handleMessage_tooLongMessage_rejected() {
        assertThatThrownBy(() -> service.handleMessage(USER, "a".repeat(1001), null))
                .isInstanceOf(InputValidationException.class)
                .hasMessage("Message must be 1000 characters or less");
    }

    @Test
    void handleMessage_lengthCountsCharactersNotUtf16Units() {
        replyWith("Thanks for sharing.");
        String emoji = "😀";

        ChatMessageResponse response = service.handleMessage(USER, emoji.repeat(1000), null);

        assertThat(response.getUserMessage().content()).hasSize(2000);
        assertThatThrownBy(() -> service.handleMessage(USER, emoji.repeat(1001), null))
                .isInstanceOf(InputValidationException.class)
                .hasMessage("Message must be 1000 characters or less");
    }

    @Test
    void handleMessage_riskMessage_offersResourcesWithoutCallingModel() {
        ChatMessageResponse response = service.handleMessage(USER, "I want to end my life", null);

        assertThat(response.getCrisisDetected()).isTrue();
        assertThat(response.getCrisisCategory()).isEqualTo(RiskCategory.SUICIDE);
        assertThat(response.getConfirmationRequired()).isTrue();
        assertThat(response.getShowResources()).isNull();
        assertThat(response.getAiResponse().content())
                .isEqualTo(new CrisisResponseComposer(catalog).composeOffer(RiskCategory.SUICIDE))
                .startsWith(new CrisisResponseComposer(catalog).composeCrisisReply(RiskCategory.SUICIDE))
                .endsWith(new CrisisResponseComposer(catalog).composeConfirmationPrompt());
        assertThat(store.get(response.getSessionId()).orElseThrow().getCrisisOfferState())
                .isEqualTo(CrisisOfferState.OFFERED_PENDING_CONFIRMATION);
        verifyNoInteractions(llmClient);
    }

    @Test
    void handleMessage_pendingOfferAccepted_revealsCatalogAndResolves() {
        String sessionId = service.handleMessage(USER, "I feel hopeless", null).getSessionId();

        ChatMessageResponse response = service.handleMessage(USER, "yes please", sessionId);

        assertThat(response.getShowResources()).isTrue();
        assertThat(response.getConfirmationRequired()).isFalse();
        assertThat(response.getCrisisResources()).isEqualTo(catalog.all());
        assertThat(response.getAiResponse().content()).isEqualTo(
                new CrisisResponseComposer(catalog).composeResourceRevealReply(ConfirmationIntent.AFFIRMATIVE).text());
        assertThat(store.get(sessionId).orElseThrow().getCrisisOfferState()).isEqualTo(CrisisOfferState.RESOLVED);
        verifyNoInteractions(llmClient);
    }

    @Test
    void handleMessage_pendingOfferDeclined_stillRevealsCatalogWithDifferentFraming() {
        String sessionId = service.handleMessage(USER, "I keep wanting to hurt myself", null).getSessionId();

        ChatMessageResponse response = service.handleMessage(USER, "nah not now", sessionId);

        assertThat(response.getShowResources()).isTrue();
        assertThat(response.getCrisisResources()).hasSize(catalog.all().size());
        assertThat(response.getAiResponse().content()).isEqualTo(
                new CrisisResponseComposer(catalog).composeResourceRevealReply(ConfirmationIntent.NEGATIVE).text());
        assertThat(store.get(sessionId).orElseThrow().getCrisisOfferState()).isEqualTo(CrisisOfferState.RESOLVED);
    }

    @Test
    void handleMessage_pendingOffer_riskyReplyIsTreatedAsConfirmationReply() {
        String sessionId = service.handleMessage(USER, "I want to die", null).getSessionId();

        ChatMessageResponse response = service.handleMessage(USER, "I still want to die", sessionId);

        assertThat(response.getShowResources()).isTrue();
        assertThat(response.getConfirmationRequired()).isFalse();
    }

    @Test
    void handleMessage_afterResolution_newRiskOpensAnotherOffer() {
        String sessionId = service.handleMessage(USER, "I feel hopeless", null).getSessionId();
        service.handleMessage(USER, "ok", sessionId);

        ChatMessageResponse response = service.handleMessage(USER, "I can't go on", sessionId);

        assertThat(response.getConfirmationRequired()).isTrue();
        assertThat(store.get(sessionId).orElseThrow().getCrisisOfferState())
                .isEqualTo(CrisisOfferState.OFFERED_PENDING_CONFIRMATION);
    }

    @Test
    void handleMessage_afterResolution_normalMessageGoesToModelWithCrisisContext() {
        String sessionId = service.handleMessage(USER, "I feel hopeless", null).getSessionId();
        service.handleMessage(USER, "yes", sessionId);
        replyWith("I'm glad you reached out. How are you feeling now?");

        ChatMessageResponse response = service.handleMessage(USER, "thanks, a bit better", sessionId);

        assertThat(response.getAiResponse().content()).startsWith("I'm glad you reached out");
        // persona + 3 exchanges (offer, reveal, this one)
        assertThat(store.get(sessionId).orElseThrow().getDialogue().getHistory()).hasSize(7);
    }

    @Test
    void handleMessage_unsafeModelOutput_isReplacedBeforeReturningAndStoring() {
        replyWith("It sounds like you have clinical anxiety.");

        ChatMessageResponse response = service.handleMessage(USER, "I get nervous at parties", null);

        assertThat(response.getAiResponse().content()).isEqualTo(ResponseValidator.DIAGNOSIS_BOUNDARY);
        assertThat(store.get(response.getSessionId()).orElseThrow().getDialogue().turns().get(1).getContent())
                .isEqualTo(ResponseValidator.DIAGNOSIS_BOUNDARY);
    }

    @Test
    void handleMessage_emptyModelOutput_usesFallbackText() {
        replyWith("   ");

        ChatMessageResponse response = service.handleMessage(USER, "hello", null);

        assertThat(response.getAiResponse().content()).isEqualTo(ConversationService.EMPTY_REPLY_FALLBACK);
    }

    @Test
    void handleMessage_degradedReply_returnedButDialogueUnchanged() {
        replyWith("Hello!");
        String sessionId = service.handleMessage(USER, "hi", null).getSessionId();
        ChatSession before = store.get(sessionId).orElseThrow();

        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder()
                .content("I'm having trouble connecting right now.").degraded(true).build());
        ChatMessageResponse response = service.handleMessage(USER, "are you there?", sessionId);

        assertThat(response.getAiResponse().content()).isEqualTo("I'm having trouble connecting right now.");
        ChatSession after = store.get(sessionId).orElseThrow();
        assertThat(after.getVersion()).isEqualTo(before.getVersion());
        assertThat(after.getDialogue().getHistory()).isEqualTo(before.getDialogue().getHistory());
    }

    @Test
    void handleMessage_degradedFirstReply_sessionStillUsable() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder()
                .content("I'm having trouble connecting right now.").degraded(true).build());

        String sessionId = service.handleMessage(USER, "hi", null).getSessionId();

        assertThat(store.get(sessionId)).hasValueSatisfying(s ->
                assertThat(s.getDialogue().turns()).isEmpty());
    }

    @Test
    void handleMessage_concurrentRiskMessagesOnOneSession_produceExactlyOneOffer() throws Exception {
        replyWith("Hello, I'm here.");
        String sessionId = service.handleMessage(USER, "hi", null).getSessionId();

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ChatMessageResponse>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<ChatMessageResponse> task = () -> {
                    start.await();
                    return service.handleMessage(USER, "I feel hopeless", sessionId);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int offers = 0;
            for (Future<ChatMessageResponse> future : futures) {
                if (Boolean.TRUE.equals(future.get(10, TimeUnit.SECONDS).getConfirmationRequired())) {
                    offers++;
                }
            }

            // Offer and reveal alternate under the lock: 8 messages → 4 offers, never two in a row
            assertThat(offers).isEqualTo(threads / 2);
            assertThat(store.get(sessionId).orElseThrow().getVersion()).isEqualTo(1 + threads);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void handleMessage_twoConcurrentRiskMessages_onlyOneOfferIsOpened() throws Exception {
        replyWith("Hello, I'm here.");
        String sessionId = service.handleMessage(USER, "hi", null).getSessionId();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<ChatMessageResponse> task = () -> {
                start.await();
                return service.handleMessage(USER, "I want to die", sessionId);
            };
            Future<ChatMessageResponse> first = executor.submit(task);
            Future<ChatMessageResponse> second = executor.submit(task);
            start.countDown();

            List<ChatMessageResponse> responses = List.of(
                    first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));

            assertThat(responses).filteredOn(r -> Boolean.TRUE.equals(r.getConfirmationRequired())).hasSize(1);
            assertThat(responses).filteredOn(r -> Boolean.TRUE.equals(r.getShowResources())).hasSize(1);
            assertThat(store.get(sessionId).orElseThrow().getCrisisOfferState()).isEqualTo(CrisisOfferState.RESOLVED);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void endSession_removesOwnedSession() {
        replyWith("Hi!");
        String sessionId = service.handleMessage(USER, "hello", null).getSessionId();

        assertThat(service.endSession(USER, sessionId)).isEqualTo(1);
        assertThat(store.get(sessionId)).isEmpty();
        assertThat(service.endSession(USER, sessionId)).isZero();
    }

    @Test
    void endSession_otherUsersSession_isNotRemoved() {
        replyWith("Hi!");
        String sessionId = service.handleMessage(USER, "hello", null).getSessionId();

        assertThat(service.endSession("intruder", sessionId)).isZero();
        assertThat(store.get(sessionId)).isPresent();
    }

    @Test
    void handleMessage_afterEndSession_isExpired() {
        replyWith("Hi!");
        String sessionId = service.handleMessage(USER, "hello", null).getSessionId();
        service.endSession(USER, sessionId);

        assertThatThrownBy(() -> service.handleMessage(USER, "still there?", sessionId))
                .isInstanceOf(SessionExpiredException.class);
    }

    private void replyWith(String content) {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder().content(content).build());
    }

    @Test
    void handleMessage_otherInstanceCommitsFirst_onlyOneCrisisOfferIsSent() {
        replyWith("Tell me more.");
        InterleavingStore shared = new InterleavingStore();
        ConversationService instanceA = serviceOver(shared);
        ConversationService instanceB = serviceOver(shared);
        String sessionId = instanceA.handleMessage(USER, "hi", null).getSessionId();

        List<ChatMessageResponse> fromB = new ArrayList<>();
        shared.afterNextRead(() -> fromB.add(instanceB.handleMessage(USER, "I want to die", sessionId)));

        assertThatThrownBy(() -> instanceA.handleMessage(USER, "I feel hopeless", sessionId))
                .isInstanceOf(SessionBusyException.class);

        assertThat(fromB).singleElement().satisfies(r -> assertThat(r.getConfirmationRequired()).isTrue());
        ChatSession stored = shared.get(sessionId).orElseThrow();
        assertThat(stored.getVersion()).isEqualTo(2);
        assertThat(stored.getCrisisOfferState()).isEqualTo(CrisisOfferState.OFFERED_PENDING_CONFIRMATION);
        assertThat(stored.getDialogue().turns()).extracting(Message::getContent)
                .containsExactly("hi", "Tell me more.", "I want to die",
                        new CrisisResponseComposer(catalog).composeOffer(RiskCategory.SUICIDE));
    }

    /** Shared store that lets a second instance run a whole turn between another's read and write. */
    private static class InterleavingStore extends InMemoryChatSessionStore {

        private Runnable afterRead;

        void afterNextRead(Runnable action) {
            this.afterRead = action;
        }

        @Override
        public Optional<ChatSession> get(String sessionId) {
            Optional<ChatSession> session = super.get(sessionId);
            Runnable action = afterRead;
            afterRead = null;
            if (action != null) {
                action.run();
            }
            return session;
        }
    }
}
