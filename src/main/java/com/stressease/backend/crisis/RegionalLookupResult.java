package com.stressease.backend.crisis;

import java.util.List;

/**
 * @param cached for generated results, whether the cache write succeeded; null for cache hits
 */
public record RegionalLookupResult(String country,
                                   List<RegionalResource> resources,
                                   Source source,
                                   Boolean cached) {

    public enum Source {
        CACHE, GENERATED
    }
}
