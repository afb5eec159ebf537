package com.stressease.backend.crisis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.ResourceNotFoundException;
import com.stressease.backend.llm.GenerationOptions;
import com.stressease.backend.llm.LlmClient;
import com.stressease.backend.model.LlmResponse;
import com.stressease.backend.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Country-specific crisis resources, cache-aside over MongoDB.
 *
 * Cache miss: the model is asked for a JSON array, the array is shape-checked
 * and then cached. Model output is untrusted, so prose, fenced text or entries
 * without a contact route all count as "nothing found".
 */
@Service
@Slf4j
public class RegionalCrisisResourceService {

    static final GenerationOptions LOOKUP_OPTIONS = GenerationOptions.of(1200, 0.2);

    private final CachedCrisisResourcesRepository cacheRepository;
    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String defaultCountry;

    public RegionalCrisisResourceService(CachedCrisisResourcesRepository cacheRepository,
                                         LlmClient llmClient,
                                         ObjectMapper objectMapper,
                                         Clock clock,
                                         StressEaseProperties properties) {
        this.cacheRepository = cacheRepository;
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultCountry = properties.getCrisis().getDefaultCountry();
    }

    public RegionalLookupResult lookup(String requestedCountry) {
        String country = requestedCountry == null || requestedCountry.isBlank()
                ? defaultCountry
                : requestedCountry.strip();
        String key = country.toLowerCase(Locale.ROOT);

        Optional<CachedCrisisResources> cached = readCache(key);
        if (cached.isPresent()) {
            log.debug("Crisis resources cache hit [country={}]", key);
            return new RegionalLookupResult(country, cached.get().getResources(),
                    RegionalLookupResult.Source.CACHE, null);
        }

        List<RegionalResource> generated = generate(country);
        if (generated.isEmpty()) {
            throw new ResourceNotFoundException("Could not find crisis resources for " + country);
        }

        boolean stored = writeCache(key, country, generated);
        return new RegionalLookupResult(country, generated, RegionalLookupResult.Source.GENERATED, stored);
    }

    private Optional<CachedCrisisResources> readCache(String key) {
        try {
            return cacheRepository.findById(key)
                    .filter(c -> c.getResources() != null && !c.getResources().isEmpty());
        } catch (DataAccessException e) {
            log.warn("Crisis resources cache read failed [country={}], generating instead: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean writeCache(String key, String country, List<RegionalResource> resources) {
        try {
            cacheRepository.save(CachedCrisisResources.builder()
                    .countryKey(key)
                    .country(country)
                    .resources(resources)
                    .cachedAt(clock.instant())
                    .build());
            return true;
        } catch (DataAccessException e) {
            log.warn("Crisis resources cache write failed [country={}]: {}", key, e.getMessage());
            return false;
        }
    }

    List<RegionalResource> generate(String country) {
        String prompt = """
                List the most important mental health crisis support resources available in %s.
                Include the national emergency number, suicide prevention or crisis hotlines,
                and reputable online support services.

                Respond ONLY with a JSON array. Each element must be an object with the fields:
                "name", "type" (one of "emergency", "crisis_hotline", "online_resource"),
                "number" (or null), "website" (or null), "description", "availability".
                Only include resources you are confident exist.
                """.formatted(country);

        LlmResponse response = llmClient.chat(List.of(
                Message.system("You are a careful assistant that outputs only valid JSON arrays."),
                Message.user(prompt)), LOOKUP_OPTIONS);

        if (response.isDegraded()) {
            log.warn("Crisis resource generation degraded [country={}]", country);
            return List.of();
        }
        return parseResources(response.getContent(), country);
    }

    List<RegionalResource> parseResources(String raw, String country) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        if (!cleaned.startsWith("[")) {
            log.warn("Crisis resource response for {} is not a JSON array. First 100 chars: '{}'",
                    country, cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        List<RegionalResource> parsed;
        try {
            parsed = objectMapper.readValue(cleaned, new TypeReference<List<RegionalResource>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse crisis resources for {}: {}", country, e.getMessage());
            return List.of();
        }

        if (parsed.isEmpty() || parsed.stream().anyMatch(r -> r == null || !r.isUsable())) {
            log.warn("Crisis resources for {} failed the shape check ({} entries)", country, parsed.size());
            return List.of();
        }
        return parsed;
    }
}
