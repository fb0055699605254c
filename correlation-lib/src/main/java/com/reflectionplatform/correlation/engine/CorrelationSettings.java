package com.reflectionplatform.correlation.engine;

import java.time.Duration;
import java.util.List;
import java.util.TreeSet;

/**
 * Process-wide tuning of the correlation engine. Built once at startup and passed to
 * every component that needs it.
 *
 * <ul>
 *   <li>{@code minimumSampleSize}    — fewer aligned days than this yields no result</li>
 *   <li>{@code largeSampleThreshold} — sample size from which confidence uses the normal approximation</li>
 *   <li>{@code lagOffsets}           — day offsets tried by the lag search, normalised to ascending order</li>
 *   <li>{@code defaultWindowDays}    — look-back used by {@code analyzeRelationship} without a range</li>
 *   <li>{@code maxConcurrency}       — pair evaluations in flight in the reactive facade</li>
 *   <li>{@code cacheTtl}             — lifetime of cached relationships in the reactive facade</li>
 * </ul>
 */
public record CorrelationSettings(
    int minimumSampleSize,
    int largeSampleThreshold,
    List<Integer> lagOffsets,
    int defaultWindowDays,
    int maxConcurrency,
    Duration cacheTtl
) {
    public static final int DEFAULT_MINIMUM_SAMPLE_SIZE = 7;
    public static final int DEFAULT_LARGE_SAMPLE_THRESHOLD = 60;
    public static final List<Integer> DEFAULT_LAG_OFFSETS = List.of(0, 1, 2, 3);
    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);

    public CorrelationSettings {
        if (minimumSampleSize < 3) {
            throw new IllegalArgumentException("minimumSampleSize must be >= 3, got " + minimumSampleSize);
        }
        if (largeSampleThreshold < minimumSampleSize) {
            throw new IllegalArgumentException("largeSampleThreshold (" + largeSampleThreshold
                + ") must be >= minimumSampleSize (" + minimumSampleSize + ")");
        }
        if (lagOffsets == null || lagOffsets.isEmpty()) {
            throw new IllegalArgumentException("lagOffsets must not be empty");
        }
        for (Integer lag : lagOffsets) {
            if (lag == null || lag < 0) {
                throw new IllegalArgumentException("lag offsets must be non-negative, got " + lagOffsets);
            }
        }
        lagOffsets = List.copyOf(new TreeSet<>(lagOffsets));
        if (defaultWindowDays < 1) {
            throw new IllegalArgumentException("defaultWindowDays must be >= 1, got " + defaultWindowDays);
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be zero or positive");
        }
    }

    public static CorrelationSettings defaults() {
        return new CorrelationSettings(DEFAULT_MINIMUM_SAMPLE_SIZE, DEFAULT_LARGE_SAMPLE_THRESHOLD,
            DEFAULT_LAG_OFFSETS, DEFAULT_WINDOW_DAYS, DEFAULT_MAX_CONCURRENCY, DEFAULT_CACHE_TTL);
    }

    public CorrelationSettings withMinimumSampleSize(int value) {
        return new CorrelationSettings(value, Math.max(value, largeSampleThreshold), lagOffsets,
            defaultWindowDays, maxConcurrency, cacheTtl);
    }

    public CorrelationSettings withLagOffsets(List<Integer> value) {
        return new CorrelationSettings(minimumSampleSize, largeSampleThreshold, value,
            defaultWindowDays, maxConcurrency, cacheTtl);
    }
}
