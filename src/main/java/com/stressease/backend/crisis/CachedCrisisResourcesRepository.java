package com.stressease.backend.crisis;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedCrisisResourcesRepository extends MongoRepository<CachedCrisisResources, String> {
}
