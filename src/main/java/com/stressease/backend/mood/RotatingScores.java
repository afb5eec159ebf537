package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Five answers for the question domain rotated in for the day.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RotatingScores(String domainName, List<Integer> scores) {

    public double average() {
        return scores.stream().mapToInt(Integer::intValue).average().orElse(0);
    }
}
