package com.stressease.backend.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Generated text; may be null or blank when the provider produced nothing */
    private String content;

    /**
     * True when the text is a fixed fallback produced because the provider
     * could not be reached. Degraded replies are shown to the user but never
     * recorded in the dialogue history.
     */
    private boolean degraded;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
