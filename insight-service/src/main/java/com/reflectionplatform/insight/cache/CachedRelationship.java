package com.reflectionplatform.insight.cache;

import com.reflectionplatform.correlation.model.MetricRelationship;

import java.time.Instant;
import java.util.Optional;

/**
 * Cache entry for one relationship lookup. A {@code null} relationship records that the
 * pair was under-powered, so repeated detail views do not rescan it.
 */
public record CachedRelationship(
    MetricRelationship relationship,
    Instant cachedAt
) {
    public Optional<MetricRelationship> lookup() {
        return Optional.ofNullable(relationship);
    }
}
