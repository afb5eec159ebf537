package com.stressease.backend.api;

import com.stressease.backend.auth.AuthInterceptor;
import com.stressease.backend.chat.ChatSummary;
import com.stressease.backend.chat.ConversationService;
import com.stressease.backend.chat.SessionSummaryService;
import com.stressease.backend.crisis.CrisisContactCatalog;
import com.stressease.backend.crisis.RegionalCrisisResourceService;
import com.stressease.backend.crisis.RegionalLookupResult;
import com.stressease.backend.model.ChatMessageRequest;
import com.stressease.backend.model.ChatMessageResponse;
import com.stressease.backend.model.SessionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chat endpoints. Sessions are opened implicitly by the first message.
 *
 * POST /api/chat/message
 * POST /api/chat/end-session
 * POST /api/chat/summarize
 * GET  /api/chat/summaries
 * GET  /api/chat/crisis-contacts
 * GET  /api/chat/crisis-resources?country=
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationService conversationService;
    private final SessionSummaryService sessionSummaryService;
    private final CrisisContactCatalog crisisContactCatalog;
    private final RegionalCrisisResourceService regionalCrisisResourceService;

    @PostMapping("/message")
    public ResponseEntity<ChatMessageResponse> message(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody ChatMessageRequest request) {

        log.info("Chat message [userId={}, sessionId={}]", userId, request.getSessionId());
        ChatMessageResponse response = conversationService.handleMessage(
                userId, request.getMessage(), request.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/end-session")
    public ResponseEntity<Map<String, Object>> endSession(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody SessionRequest request) {

        int cleanupCount = conversationService.endSession(userId, request.getSessionId());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", cleanupCount > 0 ? "Chat session ended" : "No active session to end",
                "cleanup_count", cleanupCount));
    }

    @PostMapping("/summarize")
    public ResponseEntity<Map<String, Object>> summarize(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody SessionRequest request) {

        ChatSummary summary = sessionSummaryService.summarize(userId, request.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "summary_id", summary.getId(),
                "title", summary.getTitle(),
                "summary", summary.getSummary()));
    }

    @GetMapping("/summaries")
    public ResponseEntity<Map<String, Object>> summaries(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId) {

        List<ChatSummary> summaries = sessionSummaryService.listSummaries(userId);
        return ResponseEntity.ok(Map.of("success", true, "summaries", summaries));
    }

    @GetMapping("/crisis-contacts")
    public ResponseEntity<Map<String, Object>> crisisContacts() {
        return ResponseEntity.ok(Map.of("success", true, "contacts", crisisContactCatalog.all()));
    }

    @GetMapping("/crisis-resources")
    public ResponseEntity<Map<String, Object>> crisisResources(
            @RequestParam(value = "country", required = false) String country) {

        RegionalLookupResult result = regionalCrisisResourceService.lookup(country);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", result.source() == RegionalLookupResult.Source.CACHE
                ? "Crisis resources retrieved from cache"
                : "Crisis resources generated using AI");
        body.put("country", result.country());
        body.put("resources", result.resources());
        body.put("source", result.source().name().toLowerCase(Locale.ROOT));
        if (result.cached() != null) {
            body.put("cached", result.cached());
        }
        return ResponseEntity.ok(body);
    }
}
