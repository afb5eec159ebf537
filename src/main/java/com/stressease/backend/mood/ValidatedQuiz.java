package com.stressease.backend.mood;

import java.time.LocalDate;

/**
 * A daily quiz payload that passed {@link DailyQuizValidator}.
 *
 * @param date            client-supplied day of the entry, may be null
 * @param additionalNotes free text, may be null
 */
public record ValidatedQuiz(CoreScores coreScores,
                            RotatingScores rotatingScores,
                            DassScores dassToday,
                            LocalDate date,
                            String additionalNotes) {
}
