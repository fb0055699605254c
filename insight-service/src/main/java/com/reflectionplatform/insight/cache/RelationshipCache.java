package com.reflectionplatform.insight.cache;

import com.reflectionplatform.correlation.engine.CorrelationSettings;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DateRange;
import com.reflectionplatform.correlation.model.MetricRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of {@code analyzeRelationship} lookups.
 *
 * <p>Entries are keyed on everything that determines the answer: the unordered metric
 * pair, the date range, the lag set and the minimum sample size. Provider data can
 * still change underneath, so entries expire after the configured TTL. Expired entries
 * are dropped when read and swept on every {@link #put}; {@link #evictAll()} drops
 * everything, e.g. after a data import.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}.
 */
public class RelationshipCache {

    private static final Logger log = LoggerFactory.getLogger(RelationshipCache.class);

    private final ConcurrentHashMap<Key, CachedRelationship> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public RelationshipCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached lookup, or {@code null} on a miss. Expired entries are evicted
     * and reported as a miss.
     */
    public CachedRelationship get(Key key) {
        CachedRelationship entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    /**
     * Stores a lookup and sweeps every expired entry. Keys carry a date range that moves
     * with the calendar, so old keys are never read again and must go on write.
     */
    public void put(Key key, Optional<MetricRelationship> relationship) {
        int swept = evictExpired();
        if (swept > 0) {
            log.debug("CACHE_SWEEP expired={}", swept);
        }
        store.put(key, new CachedRelationship(relationship.orElse(null), Instant.now(clock)));
        log.debug("CACHE_PUT pair={}|{} range={} present={}",
                  key.firstKey(), key.secondKey(), key.range(), relationship.isPresent());
    }

    public int evictExpired() {
        int before = store.size();
        store.values().removeIf(this::isExpired);
        return Math.max(0, before - store.size());
    }

    public boolean isExpired(CachedRelationship entry) {
        return Instant.now(clock).isAfter(entry.cachedAt().plus(ttl));
    }

    public void evictAll() {
        int size = store.size();
        store.clear();
        log.info("CACHE_EVICT_ALL entries={}", size);
    }

    public int size() {
        return store.size();
    }

    public static Key keyFor(DataMetric a, DataMetric b, DateRange range, CorrelationSettings settings) {
        boolean ordered = a.key().compareTo(b.key()) <= 0;
        return new Key(ordered ? a.key() : b.key(), ordered ? b.key() : a.key(), range,
            settings.lagOffsets(), settings.minimumSampleSize());
    }

    public record Key(
        String firstKey,
        String secondKey,
        DateRange range,
        List<Integer> lagOffsets,
        int minimumSampleSize
    ) {}
}
