package com.stressease.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stressease.backend.auth.AuthInterceptor;
import com.stressease.backend.exception.DuplicateSubmissionException;
import com.stressease.backend.mood.DailyQuizResponse;
import com.stressease.backend.mood.MoodService;
import com.stressease.backend.resilience.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Daily mood quiz with idempotency support, plus history reads.
 *
 * POST /api/mood/quiz/daily
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeat within 24h replays the first response without a second insert.
 *
 * GET /api/mood/history?limit=30
 * GET /api/mood/weekly
 */
@RestController
@RequestMapping("/api/mood")
@RequiredArgsConstructor
@Slf4j
public class MoodController {

    private final MoodService moodService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/quiz/daily")
    public ResponseEntity<DailyQuizResponse> submitDailyQuiz(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId,
            @RequestBody JsonNode payload,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        log.info("Daily quiz submission [userId={}, idempotencyKey={}]", userId, idempotencyKey);

        if (idempotent) {
            Optional<DailyQuizResponse> replay = cachedResponse(userId, idempotencyKey);
            if (replay.isPresent()) {
                return ResponseEntity.status(HttpStatus.CREATED).body(replay.get());
            }
            if (!idempotencyService.claimKey(userId, idempotencyKey)) {
                throw new DuplicateSubmissionException(idempotencyKey);
            }
        }

        DailyQuizResponse response;
        try {
            response = moodService.submitDailyQuiz(userId, payload);
        } catch (RuntimeException e) {
            // Release so the client can retry with the same key
            if (idempotent) {
                idempotencyService.releaseKey(userId, idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(userId, idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (Exception e) {
                log.warn("Failed to cache idempotency response", e);
            }
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> history(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId,
            @RequestParam(value = "limit", required = false) Integer limit) {

        return ResponseEntity.ok(Map.of("success", true, "entries", moodService.history(userId, limit)));
    }

    @GetMapping("/weekly")
    public ResponseEntity<Map<String, Object>> weekly(
            @RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) String userId) {

        return ResponseEntity.ok(Map.of("success", true, "weekly_totals", moodService.weeklyTotals(userId)));
    }

    private Optional<DailyQuizResponse> cachedResponse(String userId, String idempotencyKey) {
        return idempotencyService.getCachedResponse(userId, idempotencyKey).flatMap(json -> {
            try {
                log.info("Returning cached quiz response for idempotency key={}", idempotencyKey);
                return Optional.of(objectMapper.readValue(json, DailyQuizResponse.class));
            } catch (Exception e) {
                log.warn("Failed to deserialize cached response, proceeding fresh", e);
                return Optional.empty();
            }
        });
    }
}
