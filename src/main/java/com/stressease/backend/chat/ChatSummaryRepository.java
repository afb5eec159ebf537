package com.stressease.backend.chat;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatSummaryRepository extends MongoRepository<ChatSummary, String> {

    List<ChatSummary> findByUserIdOrderByCreatedAtDesc(String userId);
}
