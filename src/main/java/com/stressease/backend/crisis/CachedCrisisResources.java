package com.stressease.backend.crisis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Generated crisis resources for one country, cached so the model is asked
 * at most once per country.
 *
 * Collection: crisis_resources_cache (document id = normalized country key)
 */
@Document(collection = "crisis_resources_cache")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedCrisisResources {

    @Id
    private String countryKey;

    private String country;

    private List<RegionalResource> resources;

    private Instant cachedAt;
}
