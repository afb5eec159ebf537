package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CoreScores(int mood, int energy, int sleep, int stress) {

    public double average() {
        return (mood + energy + sleep + stress) / 4.0;
    }
}
