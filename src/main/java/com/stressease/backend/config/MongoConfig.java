package com.stressease.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate is populated on insert
 * (daily submittedAt, weekly computedAt, summary createdAt).
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.stressease.backend.chat",
    "com.stressease.backend.crisis",
    "com.stressease.backend.mood",
    "com.stressease.backend.profile"
})
public class MongoConfig {
}
