package com.reflectionplatform.insight.journal;

import com.reflectionplatform.correlation.catalog.ValueProvider;
import com.reflectionplatform.correlation.exception.ProviderUnavailableException;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.MetricCategory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Daily mood derived from journal entries: the mean mood of all entries created on
 * that calendar day in the user's zone. Entries without a mood are ignored; a day with
 * no rated entry has no value.
 */
public class JournalMoodValueProvider implements ValueProvider {

    public static final DataMetric METRIC = DataMetric.of("journal.mood", "Journal mood", MetricCategory.MOOD);

    private final JournalEntrySource source;
    private final ZoneId zone;

    public JournalMoodValueProvider(JournalEntrySource source, ZoneId zone) {
        this.source = source;
        this.zone = zone;
    }

    @Override
    public OptionalDouble valueFor(LocalDate date) {
        Instant start = date.atStartOfDay(zone).toInstant();
        Instant end = date.plusDays(1).atStartOfDay(zone).toInstant();

        List<JournalEntry> entries;
        try {
            entries = source.findByCreatedAtBetween(start, end);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException(METRIC.key(), "Journal store unavailable: " + e.getMessage(), e);
        }

        return entries.stream()
            .filter(entry -> entry.getMood() != null && entry.getCreatedAt() != null)
            .filter(entry -> !entry.getCreatedAt().isBefore(start) && entry.getCreatedAt().isBefore(end))
            .mapToInt(entry -> entry.getMood())
            .average();
    }
}
