package com.stressease.backend.llm;

import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation so far to the generative model.
     *
     * @param messages full conversation (system persona + user + assistant turns)
     * @param options  per-call generation overrides
     * @return the generated reply; its content is untrusted and may be empty
     */
    LlmResponse chat(List<Message> messages, GenerationOptions options);
}
