package com.stressease.backend.crisis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk categories in detection precedence order.
 */
public enum RiskCategory {
    SUICIDE("suicide"),
    SELF_HARM("self_harm"),
    GENERAL("general"),
    NONE("none");

    private final String wireName;

    RiskCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
