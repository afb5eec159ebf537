package com.stressease.backend.chat;

import com.stressease.backend.crisis.ConfirmationClassifier;
import com.stressease.backend.crisis.ConfirmationIntent;
import com.stressease.backend.crisis.CrisisResponseComposer;
import com.stressease.backend.crisis.CrisisResponseComposer.ResourceReveal;
import com.stressease.backend.crisis.RiskDetectionResult;
import com.stressease.backend.crisis.RiskDetector;
import com.stressease.backend.exception.InputValidationException;
import com.stressease.backend.exception.SessionBusyException;
import com.stressease.backend.exception.SessionExpiredException;
import com.stressease.backend.model.ChatMessageResponse;
import com.stressease.backend.model.ChatMessageVO;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.profile.UserProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-session crisis-safety state machine in front of the AI dialogue.
 *
 * Flow per inbound message:
 * 1. Validate and trim the message
 * 2. Resolve the session (create when no id is given, 404 when the id is unknown)
 * 3. Under the session's lock:
 *    a. pending offer    → classify the reply, reveal the contact catalog, RESOLVED
 *    b. risk detected    → crisis reply + confirmation prompt, OFFERED_PENDING_CONFIRMATION
 *    c. otherwise        → generate, validate, append to the dialogue
 * 4. Commit the new dialogue and state in one store write
 *
 * A degraded generation is returned to the user as-is and nothing is
 * committed, so the failed turn leaves no trace in the history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationService {

    static final int MAX_MESSAGE_LENGTH = 1000;

    static final String EMPTY_REPLY_FALLBACK =
            "I'm sorry, I couldn't generate a helpful response. How else can I support you today?";

    private final ChatSessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final RiskDetector riskDetector;
    private final ConfirmationClassifier confirmationClassifier;
    private final CrisisResponseComposer crisisResponseComposer;
    private final ResponseValidator responseValidator;
    private final DialogueService dialogueService;
    private final UserProfileService userProfileService;
    private final Clock clock;

    public ChatMessageResponse handleMessage(String userId, String rawMessage, String requestedSessionId) {
        String message = normalizeMessage(rawMessage);

        if (requestedSessionId == null || requestedSessionId.isBlank()) {
            ChatSession created = openSession(userId);
            return sessionLocks.withLock(created.getSessionId(), () -> processTurn(created, message));
        }

        return sessionLocks.withLock(requestedSessionId, () -> {
            // Re-read under the lock so the turn sees every previously committed turn
            ChatSession session = findOwnedSession(userId, requestedSessionId);
            return processTurn(session, message);
        });
    }

    /**
     * Removes the session and its dialogue.
     *
     * @return 1 when a session was removed, 0 when there was nothing to remove
     */
    public int endSession(String userId, String sessionId) {
        return sessionLocks.withLock(sessionId, () -> {
            boolean removed = sessionStore.get(sessionId)
                    .filter(s -> s.isOwnedBy(userId))
                    .map(s -> sessionStore.compareAndDelete(sessionId, s.getVersion()))
                    .orElse(false);

            log.info("End session [sessionId={}, userId={}, removed={}]", sessionId, userId, removed);
            return removed ? 1 : 0;
        });
    }

    ChatSession findOwnedSession(String userId, String sessionId) {
        return sessionStore.get(sessionId)
                .filter(s -> {
                    if (!s.isOwnedBy(userId)) {
                        log.warn("User={} presented session={} owned by another user", userId, sessionId);
                        return false;
                    }
                    return true;
                })
                .orElseThrow(() -> new SessionExpiredException(sessionId));
    }

    private ChatSession openSession(String userId) {
        Instant now = clock.instant();
        ChatSession session = ChatSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .userId(userId)
                .dialogue(dialogueService.open(userProfileService.findProfile(userId)))
                .crisisOfferState(CrisisOfferState.NOT_OFFERED)
                .version(0)
                .createdAt(now)
                .lastActiveAt(now)
                .build();

        log.info("New chat session [sessionId={}, userId={}]", session.getSessionId(), userId);
        return session;
    }

    private ChatMessageResponse processTurn(ChatSession session, String message) {
        Instant receivedAt = clock.instant();

        if (session.getCrisisOfferState().isPending()) {
            return resolveOffer(session, message, receivedAt);
        }

        RiskDetectionResult risk = riskDetector.detect(message);
        if (risk.risk()) {
            return openOffer(session, message, risk, receivedAt);
        }

        return generateReply(session, message, receivedAt);
    }

    private ChatMessageResponse resolveOffer(ChatSession session, String message, Instant receivedAt) {
        ConfirmationIntent intent = confirmationClassifier.classify(message);
        ResourceReveal reveal = crisisResponseComposer.composeResourceRevealReply(intent);

        commit(session, session.getDialogue().append(message, reveal.text()), CrisisOfferState.RESOLVED);
        log.info("Crisis offer resolved [sessionId={}, intent={}]", session.getSessionId(), intent);

        return baseResponse(session, message, reveal.text(), receivedAt)
                .confirmationRequired(false)
                .showResources(true)
                .crisisResources(reveal.contacts())
                .build();
    }

    private ChatMessageResponse openOffer(ChatSession session, String message,
                                          RiskDetectionResult risk, Instant receivedAt) {
        String reply = crisisResponseComposer.composeOffer(risk.category());

        commit(session, session.getDialogue().append(message, reply), CrisisOfferState.OFFERED_PENDING_CONFIRMATION);
        log.warn("Crisis language detected [sessionId={}, userId={}, category={}]",
                session.getSessionId(), session.getUserId(), risk.category().wireName());

        return baseResponse(session, message, reply, receivedAt)
                .crisisDetected(true)
                .crisisCategory(risk.category())
                .confirmationRequired(true)
                .build();
    }

    private ChatMessageResponse generateReply(ChatSession session, String message, Instant receivedAt) {
        LlmResponse response = dialogueService.reply(session.getDialogue(), message);

        if (response.isDegraded()) {
            log.warn("Degraded reply for session={}, dialogue left unchanged", session.getSessionId());
            // First turn of a new session: keep it so the client can retry on the same id
            if (session.getVersion() == 0 && !sessionStore.compareAndPut(session, 0)) {
                throw new SessionBusyException(session.getSessionId());
            }
            return baseResponse(session, message, response.getContent(), receivedAt).build();
        }

        String reply = responseValidator.validate(response.getContent()).orElse(EMPTY_REPLY_FALLBACK);
        commit(session, session.getDialogue().append(message, reply), session.getCrisisOfferState());

        return baseResponse(session, message, reply, receivedAt).build();
    }

    /**
     * Writes the next version of the session. Another instance sharing the store
     * may have committed a turn since this one read the session; the write is
     * then rejected and the caller gets a 409 instead of a second reply.
     */
    private void commit(ChatSession session, Dialogue dialogue, CrisisOfferState nextState) {
        ChatSession next = session.toBuilder()
                .dialogue(dialogue)
                .crisisOfferState(nextState)
                .version(session.getVersion() + 1)
                .lastActiveAt(clock.instant())
                .build();
        if (!sessionStore.compareAndPut(next, session.getVersion())) {
            throw new SessionBusyException(session.getSessionId());
        }
    }

    private ChatMessageResponse.ChatMessageResponseBuilder baseResponse(ChatSession session, String message,
                                                                        String reply, Instant receivedAt) {
        return ChatMessageResponse.builder()
                .sessionId(session.getSessionId())
                .userMessage(ChatMessageVO.user(message, receivedAt))
                .aiResponse(ChatMessageVO.assistant(reply, clock.instant()));
    }

    private String normalizeMessage(String rawMessage) {
        String message = rawMessage == null ? "" : rawMessage.strip();
        if (message.isEmpty()) {
            throw new InputValidationException("message", "Message cannot be empty");
        }
        if (message.codePointCount(0, message.length()) > MAX_MESSAGE_LENGTH) {
            throw new InputValidationException("message",
                    "Message must be " + MAX_MESSAGE_LENGTH + " characters or less");
        }
        return message;
    }
}
