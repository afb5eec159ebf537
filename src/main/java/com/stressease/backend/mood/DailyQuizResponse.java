package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyQuizResponse {

    @Builder.Default
    private boolean success = true;

    private String message;
    private String logId;
    private ScorePoint highPoint;
    private ScorePoint lowPoint;

    /** Null unless this submission completed a weekly block */
    private WeeklyDassSummary weeklyDass;
}
