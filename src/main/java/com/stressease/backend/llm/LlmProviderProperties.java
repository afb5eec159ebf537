package com.stressease.backend.llm;

import lombok.Data;

/**
 * Connection and sampling defaults for one OpenAI-compatible provider,
 * bound from the provider's block in application.yml.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 512;
    private double temperature = 0.7;
}
