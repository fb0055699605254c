package com.reflectionplatform.correlation.engine;

import com.reflectionplatform.correlation.model.DataMetric;

/**
 * Unordered metric pair in canonical form: {@code first.key() < second.key()}.
 */
public record MetricPair(DataMetric first, DataMetric second) {

    public MetricPair {
        if (first.key().compareTo(second.key()) >= 0) {
            throw new IllegalArgumentException("pair must be canonical and distinct: "
                + first.key() + ", " + second.key());
        }
    }

    public static MetricPair of(DataMetric a, DataMetric b) {
        return a.key().compareTo(b.key()) < 0 ? new MetricPair(a, b) : new MetricPair(b, a);
    }

    public String key() {
        return first.key() + "|" + second.key();
    }
}
