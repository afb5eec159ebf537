package com.stressease.backend.crisis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One country-specific support resource as produced by the generative model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegionalResource(String name,
                               String type,
                               String number,
                               String website,
                               String description,
                               String availability) {

    /** A usable entry has a name and at least one way to reach it. */
    @JsonIgnore
    public boolean isUsable() {
        return notBlank(name) && (notBlank(number) || notBlank(website));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
