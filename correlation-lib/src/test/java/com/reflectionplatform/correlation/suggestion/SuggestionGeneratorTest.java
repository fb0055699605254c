package com.reflectionplatform.correlation.suggestion;

import com.reflectionplatform.correlation.catalog.MetricCatalog;
import com.reflectionplatform.correlation.catalog.SnapshotValueProvider;
import com.reflectionplatform.correlation.engine.CorrelationEngine;
import com.reflectionplatform.correlation.engine.CorrelationSettings;
import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.CorrelationSuggestion;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DateRange;
import com.reflectionplatform.correlation.model.MetricCategory;
import com.reflectionplatform.correlation.model.Significance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SuggestionGeneratorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final DateRange RANGE = DateRange.lastDays(TODAY, 30);

    private static final DataMetric SLEEP = DataMetric.of("sleepHours", "Sleep hours", MetricCategory.SLEEP, "h");
    private static final DataMetric FOCUS = DataMetric.of("focusMinutes", "Focus minutes", MetricCategory.PRODUCTIVITY, "min");
    private static final DataMetric SCREEN = DataMetric.of("screenTime", "Screen time", MetricCategory.PHONE_USAGE, "min");
    private static final DataMetric MOOD = DataMetric.of("moodScore", "Mood", MetricCategory.MOOD);

    private final SuggestionGenerator generator = new SuggestionGenerator();

    private static CorrelationResult result(DataMetric x, DataMetric y, double r, double confidence, int lag) {
        return new CorrelationResult(UUID.nameUUIDFromBytes((x.key() + y.key() + r + lag).getBytes()),
            x, y, r, confidence, 20, lag, RANGE, "test", Significance.classify(r));
    }

    @Test
    @DisplayName("a week of sleep and focus → exactly one suggestion with priority 5")
    void sleepAndFocusWeek() {
        MetricCatalog catalog = new MetricCatalog();
        catalog.register(SLEEP, SnapshotValueProvider.daily(TODAY.minusDays(6), 7.0, 6.0, 8.0, 5.0, 7.0, 9.0, 6.0));
        catalog.register(FOCUS, SnapshotValueProvider.daily(TODAY.minusDays(6), 120.0, 90.0, 150.0, 60.0, 130.0, 180.0, 100.0));
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC);
        List<CorrelationResult> results = new CorrelationEngine(catalog, CorrelationSettings.defaults(), clock)
            .findCorrelations(null, 6);

        List<CorrelationSuggestion> suggestions = generator.generateSuggestions(results);

        assertEquals(1, suggestions.size());
        CorrelationSuggestion suggestion = suggestions.get(0);
        assertEquals(5, suggestion.priority());
        assertSame(results.get(0), suggestion.correlation());
        assertTrue(suggestion.insight().contains("Sleep hours"), suggestion.insight());
        assertTrue(suggestion.insight().contains("Focus minutes"), suggestion.insight());
        assertTrue(suggestion.suggestedChange().startsWith("To raise your Focus minutes"), suggestion.suggestedChange());
        assertTrue(suggestion.suggestedChange().contains("more Sleep hours"), suggestion.suggestedChange());
        assertTrue(suggestion.expectedImpact().contains("7 days"), suggestion.expectedImpact());
    }

    // ── filtering and ordering ──────────────────────────────────────────────

    @Nested
    @DisplayName("filtering and ordering")
    class OrderingTests {

        @Test
        @DisplayName("WEAK and NONE results never produce a suggestion")
        void weakAndNoneSkipped() {
            List<CorrelationResult> results = List.of(
                result(SLEEP, FOCUS, 0.35, 0.9, 0),
                result(SLEEP, MOOD, 0.1, 0.9, 0),
                result(SCREEN, MOOD, -0.39, 0.99, 1));

            assertTrue(generator.generateSuggestions(results).isEmpty());
        }

        @Test
        @DisplayName("priority is non-decreasing in confidence × |r|")
        void priorityMonotone() {
            List<CorrelationResult> results = List.of(
                result(SLEEP, FOCUS, 0.95, 0.99, 0),
                result(SCREEN, FOCUS, -0.8, 0.7, 0),
                result(SLEEP, MOOD, 0.6, 0.8, 1),
                result(SCREEN, MOOD, 0.45, 0.3, 0));

            List<CorrelationSuggestion> suggestions = generator.generateSuggestions(results);

            assertEquals(4, suggestions.size());
            for (int i = 1; i < suggestions.size(); i++) {
                CorrelationSuggestion previous = suggestions.get(i - 1);
                CorrelationSuggestion current = suggestions.get(i);
                assertTrue(previous.priority() >= current.priority());
                if (previous.correlation().strength() > current.correlation().strength()) {
                    assertTrue(previous.priority() >= current.priority());
                }
            }
            assertEquals(List.of(5, 3, 3, 2), suggestions.stream().map(CorrelationSuggestion::priority).toList());
        }

        @Test
        @DisplayName("equal priorities keep input order")
        void stableOnTies() {
            CorrelationResult first = result(SLEEP, FOCUS, 0.5, 0.5, 0);
            CorrelationResult second = result(SCREEN, MOOD, -0.5, 0.5, 0);
            CorrelationResult strongest = result(SLEEP, MOOD, 0.9, 0.99, 0);

            List<CorrelationSuggestion> suggestions = generator.generateSuggestions(List.of(first, second, strongest));

            assertSame(strongest, suggestions.get(0).correlation());
            assertSame(first, suggestions.get(1).correlation());
            assertSame(second, suggestions.get(2).correlation());
        }
    }

    // ── priority ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("priority()")
    class PriorityTests {

        @Test
        void endpoints() {
            assertEquals(1, SuggestionGenerator.priority(result(SLEEP, FOCUS, 0.4, 0.0, 0)));
            assertEquals(5, SuggestionGenerator.priority(result(SLEEP, FOCUS, 1.0, 1.0, 0)));
            assertEquals(5, SuggestionGenerator.priority(result(SLEEP, FOCUS, -1.0, 1.0, 0)));
        }

        @Test
        @DisplayName("round(1 + 4 × strength), half up")
        void rounding() {
            assertEquals(3, SuggestionGenerator.priority(result(SLEEP, FOCUS, 0.5, 1.0, 0)));   // 3.0
            assertEquals(3, SuggestionGenerator.priority(result(SLEEP, FOCUS, 0.75, 0.5, 0)));  // 2.5
            assertEquals(2, SuggestionGenerator.priority(result(SLEEP, FOCUS, 0.5, 0.6, 0)));   // 2.2
        }
    }

    // ── text ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("templates")
    class TemplateTests {

        @Test
        @DisplayName("negative relationship → 'lower' insight and a cut-back suggestion")
        void negativeDirection() {
            CorrelationSuggestion suggestion = generator.generateSuggestions(
                List.of(result(SCREEN, MOOD, -0.8, 0.95, 1))).get(0);

            assertEquals("Days with higher Screen time tend to come with lower Mood the next day.", suggestion.insight());
            assertEquals("To raise your Mood, try cutting back on Screen time.", suggestion.suggestedChange());
        }

        @Test
        @DisplayName("multi-day lag is named in the insight")
        void lagInInsight() {
            CorrelationSuggestion suggestion = generator.generateSuggestions(
                List.of(result(SLEEP, FOCUS, 0.8, 0.95, 2))).get(0);

            assertTrue(suggestion.insight().endsWith("2 days later."), suggestion.insight());
        }

        @Test
        @DisplayName("a non-actionable leading metric gets an observe-first caveat")
        void nonActionableLever() {
            CorrelationSuggestion suggestion = generator.generateSuggestions(
                List.of(result(MOOD, SLEEP, 0.8, 0.95, 1))).get(0);

            assertTrue(suggestion.suggestedChange().startsWith("To raise your Sleep hours"), suggestion.suggestedChange());
            assertTrue(suggestion.suggestedChange().contains("track it"), suggestion.suggestedChange());
        }

        @Test
        @DisplayName("same-day result with an outcome on the X side → actionable Y is the lever")
        void sameDayPrefersActionableLever() {
            CorrelationResult result = result(FOCUS, SCREEN, -0.7, 0.95, 0);

            assertEquals(SCREEN, SuggestionGenerator.lever(result));
            assertEquals(FOCUS, SuggestionGenerator.lever(result(FOCUS, SCREEN, -0.7, 0.95, 1)));
        }

        @Test
        void impactReportsExplainedVariation() {
            CorrelationSuggestion suggestion = generator.generateSuggestions(
                List.of(result(SLEEP, FOCUS, 0.9, 0.95, 0))).get(0);

            assertEquals("Across 20 days, this strong relationship accounts for about 81% of the "
                + "day-to-day variation in Focus minutes (r = 0.90).", suggestion.expectedImpact());
        }
    }
}
