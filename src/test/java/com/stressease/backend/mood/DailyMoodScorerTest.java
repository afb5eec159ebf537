package com.stressease.backend.mood;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DailyMoodScorerTest {

    private final DailyMoodScorer scorer = new DailyMoodScorer();

    @Test
    void score_computesAveragesAndExtremes() {
        ValidatedQuiz quiz = quiz(new CoreScores(4, 3, 2, 5), List.of(3, 3, 3, 3, 4), new DassScores(2, 1, 3));

        DailyMoodEntry entry = scorer.score("user-1", quiz);

        assertThat(entry.getUserId()).isEqualTo("user-1");
        assertThat(entry.getCoreAvg()).isEqualTo(3.5);
        assertThat(entry.getRotatingAvg()).isEqualTo(3.2);
        assertThat(entry.getHighPoint()).isEqualTo(new ScorePoint("q4", 5));
        assertThat(entry.getLowPoint()).isEqualTo(new ScorePoint("q11", 1));
    }

    @Test
    void score_tiesResolveToLowestSlot() {
        ValidatedQuiz quiz = quiz(new CoreScores(5, 5, 1, 1), List.of(2, 2, 2, 2, 2), new DassScores(1, 1, 1));

        DailyMoodEntry entry = scorer.score("user-1", quiz);

        assertThat(entry.getHighPoint()).isEqualTo(new ScorePoint("q1", 5));
        assertThat(entry.getLowPoint()).isEqualTo(new ScorePoint("q3", 1));
    }

    @Test
    void score_allEqual_highAndLowAreBothFirstSlot() {
        ValidatedQuiz quiz = quiz(new CoreScores(3, 3, 3, 3), List.of(3, 3, 3, 3, 3), new DassScores(3, 3, 3));

        DailyMoodEntry entry = scorer.score("user-1", quiz);

        assertThat(entry.getHighPoint().questionId()).isEqualTo("q1");
        assertThat(entry.getLowPoint().questionId()).isEqualTo("q1");
    }

    @Test
    void score_dassStressIsTheTwelfthSlot() {
        ValidatedQuiz quiz = quiz(new CoreScores(2, 2, 2, 2), List.of(2, 2, 2, 2, 2), new DassScores(2, 2, 5));

        assertThat(scorer.score("u", quiz).getHighPoint()).isEqualTo(new ScorePoint("q12", 5));
    }

    @Test
    void score_rotatingSlotsAreQ5ToQ9() {
        ValidatedQuiz quiz = quiz(new CoreScores(3, 3, 3, 3), List.of(3, 3, 3, 3, 1), new DassScores(3, 3, 3));

        assertThat(scorer.score("u", quiz).getLowPoint()).isEqualTo(new ScorePoint("q9", 1));
    }

    @Test
    void score_carriesDateAndNotes() {
        ValidatedQuiz quiz = new ValidatedQuiz(new CoreScores(3, 3, 3, 3),
                new RotatingScores("work", List.of(3, 3, 3, 3, 3)), new DassScores(3, 3, 3),
                LocalDate.of(2024, 5, 1), "notes");

        DailyMoodEntry entry = scorer.score("u", quiz);

        assertThat(entry.getDate()).isEqualTo("2024-05-01");
        assertThat(entry.getAdditionalNotes()).isEqualTo("notes");
        assertThat(entry.getRotatingScores().domainName()).isEqualTo("work");
    }

    private static ValidatedQuiz quiz(CoreScores core, List<Integer> rotating, DassScores dass) {
        return new ValidatedQuiz(core, new RotatingScores("social", rotating), dass, null, null);
    }
}
