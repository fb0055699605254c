package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Inclusive range of calendar days. A range whose {@code start} is after its
 * {@code end} is empty.
 */
public record DateRange(
    @JsonProperty("start") LocalDate start,
    @JsonProperty("end") LocalDate end
) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /** {@code [today - days, today]}, i.e. {@code days + 1} calendar days. */
    public static DateRange lastDays(LocalDate today, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        }
        return new DateRange(today.minusDays(days), today);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return start.isAfter(end);
    }

    /** Number of calendar days in the range, 0 when empty. */
    public long length() {
        return isEmpty() ? 0 : ChronoUnit.DAYS.between(start, end) + 1;
    }

    /** Days in ascending order. */
    public Stream<LocalDate> days() {
        return isEmpty() ? Stream.empty() : start.datesUntil(end.plusDays(1));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
