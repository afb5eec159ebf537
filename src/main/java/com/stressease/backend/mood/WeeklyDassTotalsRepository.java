package com.stressease.backend.mood;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WeeklyDassTotalsRepository extends MongoRepository<WeeklyDassTotals, String> {

    boolean existsByUserIdAndWeekStartAndWeekEnd(String userId, String weekStart, String weekEnd);

    List<WeeklyDassTotals> findByUserIdOrderByWeekStartDesc(String userId);
}
