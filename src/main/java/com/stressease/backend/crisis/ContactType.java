package com.stressease.backend.crisis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactType {
    EMERGENCY("emergency"),
    CRISIS_HOTLINE("crisis_hotline"),
    ONLINE_RESOURCE("online_resource");

    private final String wireName;

    ContactType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
