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
 * One scored daily quiz submission. Never updated after insert.
 *
 * Collection: daily_mood_logs
 * {@code date} is the client-supplied ISO day (yyyy-MM-dd) and may be absent;
 * {@code submittedAt} is stamped by Mongo auditing.
 */
@Document(collection = "daily_mood_logs")
@CompoundIndex(name = "idx_mood_user_submitted", def = "{'userId': 1, 'submittedAt': -1}")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMoodEntry {

    @Id
    private String id;

    private String userId;

    private String date;

    private CoreScores coreScores;

    private RotatingScores rotatingScores;

    private DassScores dassToday;

    private ScorePoint highPoint;

    private ScorePoint lowPoint;

    private double coreAvg;

    private double rotatingAvg;

    private String additionalNotes;

    @CreatedDate
    private Instant submittedAt;
}
