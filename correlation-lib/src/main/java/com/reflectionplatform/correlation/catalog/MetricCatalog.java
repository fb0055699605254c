package com.reflectionplatform.correlation.catalog;

import com.reflectionplatform.correlation.exception.DuplicateMetricException;
import com.reflectionplatform.correlation.model.DataMetric;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of known metrics and the provider bound to each.
 *
 * <p>One instance per process, constructed explicitly and handed to the engine.
 * Registration is thread-safe; metrics are immutable once registered.
 */
public class MetricCatalog {

    private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * @throws DuplicateMetricException if a metric with the same key is already registered
     */
    public void register(DataMetric metric, ValueProvider provider) {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(provider, "provider");
        Registration existing = registrations.putIfAbsent(metric.key(), new Registration(metric, provider));
        if (existing != null) {
            throw new DuplicateMetricException(metric.key());
        }
    }

    /** All registered metrics. Iteration order is unspecified. */
    public Set<DataMetric> listAvailable() {
        return registrations.values().stream()
            .map(Registration::metric)
            .collect(Collectors.toUnmodifiableSet());
    }

    /** All registered metrics ordered by key. */
    public List<DataMetric> listSorted() {
        return registrations.values().stream()
            .map(Registration::metric)
            .sorted(Comparator.comparing(DataMetric::key))
            .toList();
    }

    public Optional<DataMetric> find(String key) {
        Registration registration = registrations.get(key);
        return registration == null ? Optional.empty() : Optional.of(registration.metric());
    }

    public boolean contains(DataMetric metric) {
        return registrations.containsKey(metric.key());
    }

    /**
     * Observation of {@code metric} on {@code date}; empty when the day has no data.
     *
     * @throws IllegalArgumentException if the metric was never registered
     */
    public OptionalDouble valueFor(DataMetric metric, LocalDate date) {
        Registration registration = registrations.get(metric.key());
        if (registration == null) {
            throw new IllegalArgumentException("Unknown metric: " + metric.key());
        }
        OptionalDouble value = registration.provider().valueFor(date);
        if (value == null || (value.isPresent() && Double.isNaN(value.getAsDouble()))) {
            return OptionalDouble.empty();
        }
        return value;
    }

    private record Registration(DataMetric metric, ValueProvider provider) {}
}
