package com.stressease.backend.llm;

import com.stressease.backend.exception.LlmClientException;
import com.stressease.backend.exception.UpstreamGenerationException;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client. Works with Gemini, OpenAI and Groq.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                             |
 * |--------------------------|----------------------------------------------------|
 * | 401 invalid api key      | LlmClientException (not retried, not CB failure)   |
 * | 400 model_decommissioned | LlmClientException with guidance in the log        |
 * | 429 rate limit           | UpstreamGenerationException (retried)              |
 * | 400 other                | LlmClientException (not retried, not CB failure)   |
 * | 5xx server error         | UpstreamGenerationException (retried)              |
 * | network error / timeout  | ResourceAccessException (retried)                  |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, GenerationOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, options);

        log.debug("Sending {} messages to {} [model={}]",
                messages.size(), providerName, props.getModel());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new UpstreamGenerationException(
                            providerName + " server error [" + res.getStatusCode() + "]");
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    /**
     * Maps 4xx bodies to exception types so retry and the circuit breaker
     * treat configuration errors and transient errors differently.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            log.error("================================================================");
            log.error("  MODEL UNAVAILABLE: {} is not served by {}.", props.getModel(), providerName);
            log.error("  Update the model in application.yml or via the {}_MODEL env var.",
                    providerName.toUpperCase());
            log.error("================================================================");
            throw new LlmClientException("Model '" + props.getModel() + "' is not available on " + providerName);
        }

        if (statusCode == 401 || statusCode == 403) {
            throw new LlmClientException(
                    providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new UpstreamGenerationException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new LlmClientException(providerName + " client error [" + statusCode + "]: " + body);
    }

    Map<String, Object> buildRequestBody(List<Message> messages, GenerationOptions options) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        GenerationOptions effective = options != null ? options : GenerationOptions.DEFAULT;

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", effective.maxTokens() != null ? effective.maxTokens() : props.getMaxTokens());
        body.put("temperature", effective.temperature() != null ? effective.temperature() : props.getTemperature());
        body.put("messages", formattedMessages);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new UpstreamGenerationException(providerName + " returned an empty body");
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            // Safety-filtered prompts come back without choices; treat as "nothing usable"
            log.warn("{} returned no choices in response", providerName);
            return LlmResponse.builder().content(null).build();
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice  = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));

        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
