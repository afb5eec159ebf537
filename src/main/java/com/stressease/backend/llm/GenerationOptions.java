package com.stressease.backend.llm;

/**
 * Per-call overrides. Null fields fall back to the provider defaults.
 */
public record GenerationOptions(Integer maxTokens, Double temperature) {

    public static final GenerationOptions DEFAULT = new GenerationOptions(null, null);

    public static GenerationOptions of(int maxTokens, double temperature) {
        return new GenerationOptions(maxTokens, temperature);
    }
}
