package com.reflectionplatform.correlation.catalog;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Immutable day-to-value snapshot. Copying the source values up front keeps the
 * provider stable while a scan reads it, whatever happens to the original store.
 */
public final class SnapshotValueProvider implements ValueProvider {

    private final Map<LocalDate, Double> values;

    private SnapshotValueProvider(Map<LocalDate, Double> values) {
        this.values = values;
    }

    /** Null values in {@code source} are treated as missing days. */
    public static SnapshotValueProvider of(Map<LocalDate, Double> source) {
        TreeMap<LocalDate, Double> copy = new TreeMap<>();
        source.forEach((date, value) -> {
            if (date != null && value != null && !value.isNaN()) {
                copy.put(date, value);
            }
        });
        return new SnapshotValueProvider(copy);
    }

    /**
     * Consecutive daily values starting at {@code firstDay}. A {@code null} element
     * leaves that day empty.
     */
    public static SnapshotValueProvider daily(LocalDate firstDay, Double... dailyValues) {
        TreeMap<LocalDate, Double> map = new TreeMap<>();
        for (int i = 0; i < dailyValues.length; i++) {
            if (dailyValues[i] != null) {
                map.put(firstDay.plusDays(i), dailyValues[i]);
            }
        }
        return of(map);
    }

    @Override
    public OptionalDouble valueFor(LocalDate date) {
        Double value = values.get(date);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public int size() {
        return values.size();
    }
}
