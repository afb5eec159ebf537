package com.stressease.backend.mood;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DailyMoodEntryRepository extends MongoRepository<DailyMoodEntry, String> {

    long countByUserId(String userId);

    List<DailyMoodEntry> findByUserIdOrderBySubmittedAtDesc(String userId, Pageable pageable);
}
