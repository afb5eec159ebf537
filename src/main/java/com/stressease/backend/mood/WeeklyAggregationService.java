package com.stressease.backend.mood;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Weekly DASS aggregation, run after each successful daily insert.
 *
 * Fires when the user's entry count is a positive multiple of 7 and folds the
 * 7 most recent entries into one {@link WeeklyDassTotals}. Each subscale is
 * rescaled 1→0, 2→1, 3→1, 4→2, 5→3, summed and doubled.
 *
 * Best effort: a failed read, a missing value or an existing block skips the
 * aggregation and never fails the daily submission.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeeklyAggregationService {

    static final int BLOCK_SIZE = 7;

    // Index = quiz score (1-5); index 0 unused
    private static final int[] DASS_SCALE = {0, 0, 1, 1, 2, 3};

    private final DailyMoodEntryRepository dailyRepository;
    private final WeeklyDassTotalsRepository weeklyRepository;
    private final Clock clock;

    public Optional<WeeklyDassSummary> onEntrySaved(String userId) {
        try {
            return aggregate(userId);
        } catch (DuplicateKeyException e) {
            log.info("Weekly DASS block already stored by a concurrent submission [userId={}]", userId);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Weekly DASS aggregation skipped for user={} after storage failure: {}",
                    userId, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Weekly DASS aggregation skipped for user={}, stored entry out of range: {}",
                    userId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<WeeklyDassSummary> aggregate(String userId) {
        long count = dailyRepository.countByUserId(userId);
        if (count < BLOCK_SIZE || count % BLOCK_SIZE != 0) {
            log.debug("No weekly block for user={} at count={}", userId, count);
            return Optional.empty();
        }

        List<DailyMoodEntry> block = dailyRepository.findByUserIdOrderBySubmittedAtDesc(
                userId, PageRequest.of(0, BLOCK_SIZE));
        if (block.size() < BLOCK_SIZE) {
            log.info("Weekly block for user={} has only {} entries, skipping", userId, block.size());
            return Optional.empty();
        }
        if (block.stream().anyMatch(e -> e.getDassToday() == null)) {
            log.warn("Weekly block for user={} contains entries without DASS scores, skipping", userId);
            return Optional.empty();
        }

        int depression = total(block, DassScores::depression);
        int anxiety = total(block, DassScores::anxiety);
        int stress = total(block, DassScores::stress);

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<LocalDate> days = block.stream().map(e -> entryDay(e, today)).toList();
        String weekStart = days.stream().min(LocalDate::compareTo).orElse(today).toString();
        String weekEnd = days.stream().max(LocalDate::compareTo).orElse(today).toString();

        if (weeklyRepository.existsByUserIdAndWeekStartAndWeekEnd(userId, weekStart, weekEnd)) {
            log.info("Weekly DASS block {}..{} already exists for user={}", weekStart, weekEnd, userId);
            return Optional.empty();
        }

        WeeklyDassTotals saved = weeklyRepository.save(WeeklyDassTotals.builder()
                .userId(userId)
                .weekStart(weekStart)
                .weekEnd(weekEnd)
                .depressionTotal(depression)
                .anxietyTotal(anxiety)
                .stressTotal(stress)
                .build());

        log.info("Weekly DASS block stored [userId={}, week={}..{}, D={}, A={}, S={}]",
                userId, weekStart, weekEnd, depression, anxiety, stress);

        return Optional.of(new WeeklyDassSummary(
                saved.getId(), weekStart, weekEnd, depression, anxiety, stress,
                round2(block.stream().mapToDouble(DailyMoodEntry::getCoreAvg).average().orElse(0)),
                round2(block.stream().mapToDouble(DailyMoodEntry::getRotatingAvg).average().orElse(0))));
    }

    static int rescale(int quizScore) {
        if (quizScore < 1 || quizScore > 5) {
            throw new IllegalArgumentException("Quiz score out of range: " + quizScore);
        }
        return DASS_SCALE[quizScore];
    }

    private static int total(List<DailyMoodEntry> block, ToIntFunction<DassScores> subscale) {
        return block.stream()
                .mapToInt(e -> rescale(subscale.applyAsInt(e.getDassToday())))
                .sum() * 2;
    }

    /** Entry date, else the UTC day it was submitted, else today. */
    static LocalDate entryDay(DailyMoodEntry entry, LocalDate today) {
        if (entry.getDate() != null) {
            try {
                return LocalDate.parse(entry.getDate());
            } catch (DateTimeParseException e) {
                log.warn("Unparseable date '{}' on entry={}, falling back", entry.getDate(), entry.getId());
            }
        }
        if (entry.getSubmittedAt() != null) {
            return LocalDate.ofInstant(entry.getSubmittedAt(), ZoneOffset.UTC);
        }
        return today;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
