package com.stressease.backend.model;

import java.time.Instant;

public record ChatMessageVO(String content, Instant timestamp, String role) {

    public static ChatMessageVO user(String content, Instant timestamp) {
        return new ChatMessageVO(content, timestamp, "user");
    }

    public static ChatMessageVO assistant(String content, Instant timestamp) {
        return new ChatMessageVO(content, timestamp, "assistant");
    }
}
