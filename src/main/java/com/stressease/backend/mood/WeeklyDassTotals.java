package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * DASS-style subscale totals for one completed block of seven daily entries.
 *
 * Collection: weekly_dass_totals
 * At most one document per (userId, weekStart, weekEnd); the unique index makes
 * the store reject a racing duplicate insert.
 */
@Document(collection = "weekly_dass_totals")
@CompoundIndex(name = "uniq_weekly_user_range",
        def = "{'userId': 1, 'weekStart': 1, 'weekEnd': 1}", unique = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyDassTotals {

    @Id
    private String id;

    private String userId;

    /** Inclusive ISO dates (yyyy-MM-dd) */
    private String weekStart;
    private String weekEnd;

    private int depressionTotal;
    private int anxietyTotal;
    private int stressTotal;

    @CreatedDate
    private Instant computedAt;
}
