package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Weekly block returned with the quiz that completed it. The averages are
 * computed for the response only and are not stored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WeeklyDassSummary(String weeklyId,
                                String weekStart,
                                String weekEnd,
                                int depressionTotal,
                                int anxietyTotal,
                                int stressTotal,
                                double weeklyCoreAvg,
                                double weeklyRotatingAvg) {
}
