package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A single slot of the 12-question vector, identified as q1..q12.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScorePoint(String questionId, int score) {
}
