package com.stressease.backend.mood;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the per-day statistics stored with each quiz.
 *
 * Slot order: mood, energy, sleep, stress (q1-q4), the five rotating answers
 * (q5-q9), then depression, anxiety, stress (q10-q12). High and low points
 * resolve ties to the lowest slot.
 */
@Component
public class DailyMoodScorer {

    public DailyMoodEntry score(String userId, ValidatedQuiz quiz) {
        List<Integer> slots = slots(quiz);

        int high = 0;
        int low = 0;
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i) > slots.get(high)) {
                high = i;
            }
            if (slots.get(i) < slots.get(low)) {
                low = i;
            }
        }

        LocalDate date = quiz.date();
        return DailyMoodEntry.builder()
                .userId(userId)
                .date(date != null ? date.toString() : null)
                .coreScores(quiz.coreScores())
                .rotatingScores(quiz.rotatingScores())
                .dassToday(quiz.dassToday())
                .highPoint(new ScorePoint(questionId(high), slots.get(high)))
                .lowPoint(new ScorePoint(questionId(low), slots.get(low)))
                .coreAvg(quiz.coreScores().average())
                .rotatingAvg(quiz.rotatingScores().average())
                .additionalNotes(quiz.additionalNotes())
                .build();
    }

    static List<Integer> slots(ValidatedQuiz quiz) {
        CoreScores core = quiz.coreScores();
        DassScores dass = quiz.dassToday();

        List<Integer> slots = new ArrayList<>(12);
        slots.add(core.mood());
        slots.add(core.energy());
        slots.add(core.sleep());
        slots.add(core.stress());
        slots.addAll(quiz.rotatingScores().scores());
        slots.add(dass.depression());
        slots.add(dass.anxiety());
        slots.add(dass.stress());
        return slots;
    }

    private static String questionId(int slot) {
        return "q" + (slot + 1);
    }
}
