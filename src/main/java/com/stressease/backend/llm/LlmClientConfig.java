package com.stressease.backend.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Set;

/**
 * Builds the raw client for the provider named by {@code llm.provider}.
 * Provider settings live under a top-level key of the same name
 * ({@code gemini.*}, {@code openai.*}, {@code groq.*}).
 * The raw client is wrapped by ResilientLlmClient (retry + circuit breaker).
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    static final Set<String> PROVIDERS = Set.of("gemini", "openai", "groq");

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(Environment environment, RestClient.Builder llmRestClientBuilder) {
        String provider = environment.getProperty("llm.provider", "gemini").strip().toLowerCase(Locale.ROOT);
        LlmProviderProperties props = providerProperties(environment, provider);

        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase(Locale.ROOT));
        log.info("  Model               : {}", props.getModel());
        logKey(provider, props.getApiKey());
        log.info("================================================================");

        return new GenericLlmClient(props, provider, llmRestClientBuilder.clone());
    }

    static LlmProviderProperties providerProperties(Environment environment, String provider) {
        if (!PROVIDERS.contains(provider)) {
            throw new IllegalStateException("Unknown llm.provider '" + provider + "', expected one of " + PROVIDERS);
        }
        LlmProviderProperties props = Binder.get(environment)
                .bind(provider, LlmProviderProperties.class)
                .orElseGet(LlmProviderProperties::new);
        if (props.getBaseUrl() == null || props.getModel() == null) {
            throw new IllegalStateException(provider + ".base-url and " + provider + ".model must be configured");
        }
        return props;
    }

    private static void logKey(String provider, String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var: {}_API_KEY", provider.toUpperCase(Locale.ROOT));
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
