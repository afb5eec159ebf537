package com.stressease.backend.mood;

import com.fasterxml.jackson.databind.JsonNode;
import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.InputValidationException;
import com.stressease.backend.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Daily quiz pipeline: validate → score → persist → weekly trigger.
 *
 * Only the daily insert is required to succeed; the weekly step is best effort.
 */
@Service
@Slf4j
public class MoodService {

    static final String SAVED_MESSAGE = "Daily mood quiz saved successfully";

    private final DailyQuizValidator validator;
    private final DailyMoodScorer scorer;
    private final DailyMoodEntryRepository dailyRepository;
    private final WeeklyDassTotalsRepository weeklyRepository;
    private final WeeklyAggregationService weeklyAggregationService;
    private final StressEaseProperties.Quiz quizProperties;

    public MoodService(DailyQuizValidator validator,
                       DailyMoodScorer scorer,
                       DailyMoodEntryRepository dailyRepository,
                       WeeklyDassTotalsRepository weeklyRepository,
                       WeeklyAggregationService weeklyAggregationService,
                       StressEaseProperties properties) {
        this.validator = validator;
        this.scorer = scorer;
        this.dailyRepository = dailyRepository;
        this.weeklyRepository = weeklyRepository;
        this.weeklyAggregationService = weeklyAggregationService;
        this.quizProperties = properties.getQuiz();
    }

    public DailyQuizResponse submitDailyQuiz(String userId, JsonNode payload) {
        ValidatedQuiz quiz = validator.validate(payload);
        DailyMoodEntry entry = scorer.score(userId, quiz);

        DailyMoodEntry saved;
        try {
            saved = dailyRepository.save(entry);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save daily mood log", e);
        }
        log.info("Daily mood entry saved [userId={}, logId={}, high={}, low={}]",
                userId, saved.getId(), saved.getHighPoint().questionId(), saved.getLowPoint().questionId());

        WeeklyDassSummary weekly = weeklyAggregationService.onEntrySaved(userId).orElse(null);

        return DailyQuizResponse.builder()
                .message(SAVED_MESSAGE)
                .logId(saved.getId())
                .highPoint(saved.getHighPoint())
                .lowPoint(saved.getLowPoint())
                .weeklyDass(weekly)
                .build();
    }

    public List<DailyMoodEntry> history(String userId, Integer limit) {
        int effective = limit == null ? quizProperties.getHistoryDefaultLimit() : limit;
        if (effective < 1 || effective > quizProperties.getHistoryMaxLimit()) {
            throw new InputValidationException("limit",
                    "limit must be between 1 and " + quizProperties.getHistoryMaxLimit());
        }
        try {
            return dailyRepository.findByUserIdOrderBySubmittedAtDesc(userId, PageRequest.of(0, effective));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load mood history", e);
        }
    }

    public List<WeeklyDassTotals> weeklyTotals(String userId) {
        try {
            return weeklyRepository.findByUserIdOrderByWeekStartDesc(userId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load weekly totals", e);
        }
    }
}
