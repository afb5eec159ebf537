package com.stressease.backend.resilience;

import com.stressease.backend.llm.GenerationOptions;
import com.stressease.backend.llm.LlmClient;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds retry + circuit breaker.
 *
 * Generation failures are never surfaced to the end user as hard failures:
 * both fallbacks return a degraded reply carrying a fixed apologetic text.
 * Callers check {@link LlmResponse#isDegraded()} so the fallback text is shown
 * but not written into the session's dialogue history.
 *
 * The retry aspect wraps the circuit breaker: each attempt is recorded by
 * the breaker, and an open circuit short-circuits without retrying.
 *
 * Retry config (in application.yml):
 * - 3 attempts, exponential backoff 1s → 2s
 * - Retries on network errors, timeouts, 5xx and 429; skips LlmClientException
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    static final String CONNECTION_FALLBACK =
            "I'm having trouble connecting right now. Could we try again in a moment?";

    static final String CIRCUIT_OPEN_FALLBACK =
            "I'm not able to respond properly at the moment. Please try again in a little while. "
            + "If you need support right now, the crisis contacts in the app are always available.";

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, GenerationOptions options) {
        return delegate.chat(messages, options);
    }

    /**
     * Retry fallback: all retry attempts exhausted.
     */
    public LlmResponse retryFallback(List<Message> messages, GenerationOptions options, Exception ex) {
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        return degraded(CONNECTION_FALLBACK);
    }

    /**
     * Circuit breaker fallback: circuit is open, requests are short-circuited.
     * Only {@link CallNotPermittedException} lands here; other failures propagate
     * to the retry aspect.
     */
    public LlmResponse circuitBreakerFallback(List<Message> messages, GenerationOptions options,
                                              CallNotPermittedException ex) {
        log.error("LLM circuit breaker rejected call: {}", ex.getMessage());
        return degraded(CIRCUIT_OPEN_FALLBACK);
    }

    private LlmResponse degraded(String content) {
        return LlmResponse.builder()
                .content(content)
                .degraded(true)
                .build();
    }
}
