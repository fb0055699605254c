package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named daily metric known to the {@code MetricCatalog}.
 *
 * <p>The catalog and the engine look metrics up by {@code key}; the engine always works
 * with the instance registered under that key. Record equality still compares every
 * field. The value provider is bound by the catalog at registration time and is not
 * part of this record.
 */
public record DataMetric(
    @JsonProperty("key") String key,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("category") MetricCategory category,
    @JsonProperty("unit") String unit                  // nullable: mood scores, ratios
) {
    public DataMetric {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("metric key must not be blank");
        }
        Objects.requireNonNull(category, "category");
        if (displayName == null || displayName.isBlank()) {
            displayName = key;
        }
    }

    public static DataMetric of(String key, String displayName, MetricCategory category, String unit) {
        return new DataMetric(key, displayName, category, unit);
    }

    public static DataMetric of(String key, String displayName, MetricCategory category) {
        return new DataMetric(key, displayName, category, null);
    }
}
