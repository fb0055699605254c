package com.reflectionplatform.insight.cache;

import com.reflectionplatform.correlation.engine.CorrelationSettings;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DataPoint;
import com.reflectionplatform.correlation.model.DateRange;
import com.reflectionplatform.correlation.model.MetricCategory;
import com.reflectionplatform.correlation.model.MetricRelationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipCacheTest {

    private static final DataMetric SLEEP = DataMetric.of("sleepHours", "Sleep hours", MetricCategory.SLEEP);
    private static final DataMetric FOCUS = DataMetric.of("focusMinutes", "Focus minutes", MetricCategory.PRODUCTIVITY);
    private static final DateRange RANGE = new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 10));

    private MutableClock clock;
    private RelationshipCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        cache = new RelationshipCache(Duration.ofMinutes(10), clock);
    }

    private static MetricRelationship relationship() {
        return new MetricRelationship(FOCUS, SLEEP, RANGE, 0,
            List.of(new DataPoint(LocalDate.of(2026, 3, 1), 120.0, 7.0)));
    }

    @Test
    @DisplayName("miss → null")
    void miss() {
        assertNull(cache.get(RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, CorrelationSettings.defaults())));
    }

    @Test
    @DisplayName("key ignores argument order")
    void unorderedKey() {
        CorrelationSettings settings = CorrelationSettings.defaults();
        RelationshipCache.Key key = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, settings);
        cache.put(key, Optional.of(relationship()));

        CachedRelationship hit = cache.get(RelationshipCache.keyFor(FOCUS, SLEEP, RANGE, settings));
        assertNotNull(hit);
        assertEquals(Optional.of(relationship()), hit.lookup());
    }

    @Test
    @DisplayName("different lag set → different key")
    void settingsPartOfKey() {
        RelationshipCache.Key defaults = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, CorrelationSettings.defaults());
        RelationshipCache.Key sameDayOnly = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE,
            CorrelationSettings.defaults().withLagOffsets(List.of(0)));
        assertNotEquals(defaults, sameDayOnly);
    }

    @Test
    @DisplayName("empty lookups are cached as such")
    void cachesEmpty() {
        RelationshipCache.Key key = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, CorrelationSettings.defaults());
        cache.put(key, Optional.empty());

        CachedRelationship hit = cache.get(key);
        assertNotNull(hit);
        assertTrue(hit.lookup().isEmpty());
    }

    @Test
    @DisplayName("entry older than TTL → evicted on read")
    void expires() {
        RelationshipCache.Key key = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, CorrelationSettings.defaults());
        cache.put(key, Optional.of(relationship()));

        clock.advance(Duration.ofMinutes(10));
        assertNotNull(cache.get(key));

        clock.advance(Duration.ofSeconds(1));
        assertNull(cache.get(key));
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("a year of daily lookups keeps only live entries")
    void dailyKeysDoNotAccumulate() {
        CorrelationSettings settings = CorrelationSettings.defaults();
        LocalDate today = LocalDate.of(2026, 3, 10);
        RelationshipCache.Key latest = null;
        for (int day = 0; day < 365; day++) {
            latest = RelationshipCache.keyFor(SLEEP, FOCUS, DateRange.lastDays(today.plusDays(day), 30), settings);
            cache.put(latest, Optional.of(relationship()));
            clock.advance(Duration.ofDays(1));
        }

        assertEquals(1, cache.size());
        clock.advance(Duration.ofDays(-1));
        assertNotNull(cache.get(latest));
    }

    @Test
    @DisplayName("put() sweeps expired entries but keeps live ones")
    void putSweepsExpired() {
        CorrelationSettings settings = CorrelationSettings.defaults();
        RelationshipCache.Key old = RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, settings);
        cache.put(old, Optional.empty());

        clock.advance(Duration.ofMinutes(6));
        RelationshipCache.Key recent = RelationshipCache.keyFor(SLEEP, FOCUS,
            new DateRange(RANGE.start(), RANGE.start()), settings);
        cache.put(recent, Optional.empty());

        clock.advance(Duration.ofMinutes(6));
        RelationshipCache.Key fresh = RelationshipCache.keyFor(SLEEP, FOCUS,
            new DateRange(RANGE.end(), RANGE.end()), settings);
        cache.put(fresh, Optional.empty());

        assertEquals(2, cache.size());
        assertNull(cache.get(old));
        assertNotNull(cache.get(recent));
        assertNotNull(cache.get(fresh));
    }

    @Test
    @DisplayName("evictAll() clears every entry")
    void evictAll() {
        CorrelationSettings settings = CorrelationSettings.defaults();
        cache.put(RelationshipCache.keyFor(SLEEP, FOCUS, RANGE, settings), Optional.empty());
        cache.put(RelationshipCache.keyFor(SLEEP, FOCUS, new DateRange(RANGE.start(), RANGE.start()), settings),
            Optional.empty());
        assertEquals(2, cache.size());

        cache.evictAll();
        assertEquals(0, cache.size());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
