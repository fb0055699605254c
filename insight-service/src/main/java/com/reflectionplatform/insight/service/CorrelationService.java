package com.reflectionplatform.insight.service;

import com.reflectionplatform.correlation.engine.CorrelationEngine;
import com.reflectionplatform.correlation.engine.CorrelationSettings;
import com.reflectionplatform.correlation.engine.MetricPair;
import com.reflectionplatform.correlation.engine.PairOutcome;
import com.reflectionplatform.correlation.model.CorrelationReport;
import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.CorrelationSuggestion;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DateRange;
import com.reflectionplatform.correlation.model.MetricRelationship;
import com.reflectionplatform.correlation.model.PairFailure;
import com.reflectionplatform.correlation.suggestion.SuggestionGenerator;
import com.reflectionplatform.insight.cache.CachedRelationship;
import com.reflectionplatform.insight.cache.RelationshipCache;
import com.reflectionplatform.insight.logger.ScanFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Reactive entry point to the correlation engine for dashboards and report generation.
 *
 * <p>Pairs are evaluated in parallel on {@link Schedulers#boundedElastic()} with at most
 * {@code maxConcurrency} in flight, then assembled in the engine's deterministic order,
 * so completion order never shows in the output. Disposing a returned {@link Mono}
 * stops further pairs from starting; a caller that changed its date range can simply
 * drop the stale subscription.
 *
 * <p>A failing pair becomes a {@link PairFailure} in the report and never fails the scan.
 */
@Service
public class CorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationService.class);

    private final CorrelationEngine engine;
    private final SuggestionGenerator suggestionGenerator;
    private final RelationshipCache relationshipCache;
    private final ScanFlowLogger flowLogger;
    private final CorrelationSettings settings;

    public CorrelationService(CorrelationEngine engine, SuggestionGenerator suggestionGenerator,
                              RelationshipCache relationshipCache, ScanFlowLogger flowLogger) {
        this.engine = engine;
        this.suggestionGenerator = suggestionGenerator;
        this.relationshipCache = relationshipCache;
        this.flowLogger = flowLogger;
        this.settings = engine.settings();
    }

    public List<DataMetric> listAvailableMetrics() {
        return engine.listAvailableMetrics();
    }

    /**
     * Scans all pairs of {@code metrics} (every registered metric when null or empty)
     * over the last {@code minimumDays} days.
     */
    public Mono<CorrelationReport> findCorrelations(Collection<DataMetric> metrics, int minimumDays) {
        String scanId = UUID.randomUUID().toString();
        return Mono.fromCallable(() -> new ScanPlan(engine.windowEndingToday(minimumDays), engine.enumeratePairs(metrics)))
            .doOnNext(plan -> flowLogger.pairsEnumerated(scanId, plan.pairs().size(), plan.range()))
            .flatMap(plan -> Flux.fromIterable(plan.pairs())
                .flatMap(pair -> evaluate(scanId, pair, plan.range()), settings.maxConcurrency())
                .collectList()
                .map(engine::assemble))
            .doOnSubscribe(subscription -> flowLogger.stage(ScanFlowLogger.SCAN_REQUESTED, scanId))
            .doOnSuccess(report -> {
                if (report != null) flowLogger.scanCompleted(scanId, report);
            })
            .doOnCancel(() -> flowLogger.stage(ScanFlowLogger.SCAN_CANCELLED, scanId));
    }

    /** Ranked results followed straight through the suggestion generator. */
    public Mono<List<CorrelationSuggestion>> suggestCorrelations(Collection<DataMetric> metrics, int minimumDays) {
        return findCorrelations(metrics, minimumDays)
            .map(report -> generateSuggestions(report.results()));
    }

    /**
     * Aligned samples for one pair over the default window. Empty when the pair is
     * under-powered; errors with {@code ProviderUnavailableException} when a provider fails.
     */
    public Mono<MetricRelationship> analyzeRelationship(DataMetric metricX, DataMetric metricY) {
        return Mono.fromCallable(() -> engine.windowEndingToday(settings.defaultWindowDays()))
            .flatMap(range -> analyzeRelationship(metricX, metricY, range));
    }

    /** Same as above over an explicit range. The cache is consulted on each subscription. */
    public Mono<MetricRelationship> analyzeRelationship(DataMetric metricX, DataMetric metricY, DateRange range) {
        return Mono.defer(() -> {
            RelationshipCache.Key key = RelationshipCache.keyFor(metricX, metricY, range, settings);
            CachedRelationship cached = relationshipCache.get(key);
            if (cached != null) {
                log.debug("Relationship cache hit pair={}|{} range={}", key.firstKey(), key.secondKey(), range);
                return cached.lookup().map(Mono::just).orElseGet(Mono::empty);
            }
            return Mono.fromCallable(() -> engine.analyzeRelationship(metricX, metricY, range))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(relationship -> relationshipCache.put(key, relationship))
                .flatMap(relationship -> relationship.map(Mono::just).orElseGet(Mono::empty));
        });
    }

    public List<CorrelationSuggestion> generateSuggestions(List<CorrelationResult> results) {
        List<CorrelationSuggestion> suggestions = suggestionGenerator.generateSuggestions(results);
        flowLogger.suggestionsGenerated(results.size(), suggestions.size());
        return suggestions;
    }

    /** Drops cached relationships, e.g. after new data has been imported. */
    public void invalidateCache() {
        relationshipCache.evictAll();
    }

    // ── pair evaluation ─────────────────────────────────────────────────────

    private Mono<PairOutcome> evaluate(String scanId, MetricPair pair, DateRange range) {
        return Mono.fromCallable(() -> engine.evaluatePair(pair, range))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(RuntimeException.class, e -> {
                log.error("Pair={} failed unexpectedly", pair.key(), e);
                return Mono.just(PairOutcome.failed(pair,
                    new PairFailure(pair.first().key(), pair.second().key(), String.valueOf(e.getMessage()))));
            })
            .doOnNext(outcome -> {
                if (outcome.failed()) flowLogger.pairFailed(scanId, outcome.failure());
            });
    }

    private record ScanPlan(DateRange range, List<MetricPair> pairs) {}
}
