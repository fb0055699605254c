package com.reflectionplatform.correlation.engine;

import com.reflectionplatform.correlation.align.SeriesAligner;
import com.reflectionplatform.correlation.catalog.MetricCatalog;
import com.reflectionplatform.correlation.compute.CorrelationComputer;
import com.reflectionplatform.correlation.compute.LaggedScore;
import com.reflectionplatform.correlation.compute.PairScore;
import com.reflectionplatform.correlation.exception.ProviderUnavailableException;
import com.reflectionplatform.correlation.model.CorrelationReport;
import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DateRange;
import com.reflectionplatform.correlation.model.MetricRelationship;
import com.reflectionplatform.correlation.model.PairFailure;
import com.reflectionplatform.correlation.model.Significance;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Scans metric pairs for correlations and ranks what it finds.
 *
 * <p>Pure computation over the catalog's providers: the same provider values over the
 * same date range always give the same report, down to the result ids. Nothing is
 * cached between calls and nothing is written anywhere.
 *
 * <h3>Scan</h3>
 * <ol>
 *   <li>Every unordered pair of distinct metrics is evaluated once.</li>
 *   <li>Each pair goes through the lag search over {@code [today - minimumDays, today]}.</li>
 *   <li>Pairs whose provider fails are reported as {@link PairFailure}s; the scan goes on.</li>
 *   <li>Results with significance {@code NONE} are dropped.</li>
 *   <li>Output is ordered by {@code confidence * |r|} descending, then larger sample size,
 *       then pair key.</li>
 * </ol>
 *
 * <p>The synchronous scan checks the interrupt flag between pairs and throws
 * {@link CancellationException} when the calling thread has been interrupted.
 * {@link #enumeratePairs}, {@link #evaluatePair} and {@link #assemble} are exposed so a
 * caller can run pairs on its own workers and still get the same ordering.
 */
public class CorrelationEngine {

    public static final Comparator<CorrelationResult> RANKING =
        Comparator.comparingDouble(CorrelationResult::strength).reversed()
            .thenComparing(Comparator.comparingInt(CorrelationResult::sampleSize).reversed())
            .thenComparing(CorrelationResult::pairKey);

    private final MetricCatalog catalog;
    private final CorrelationSettings settings;
    private final CorrelationComputer computer;
    private final Clock clock;

    public CorrelationEngine(MetricCatalog catalog, CorrelationSettings settings, Clock clock) {
        this.catalog = catalog;
        this.settings = settings;
        this.clock = clock;
        this.computer = new CorrelationComputer(new SeriesAligner(catalog),
            settings.minimumSampleSize(), settings.largeSampleThreshold(), settings.lagOffsets());
    }

    public List<DataMetric> listAvailableMetrics() {
        return catalog.listSorted();
    }

    // ── findCorrelations ────────────────────────────────────────────────────

    /**
     * Ranked results for all pairs drawn from {@code metrics} (every registered metric
     * when {@code null} or empty) over the last {@code minimumDays} days. Failed pairs are
     * left out; use {@link #scan(Collection, int)} to see them.
     */
    public List<CorrelationResult> findCorrelations(Collection<DataMetric> metrics, int minimumDays) {
        return scan(metrics, minimumDays).results();
    }

    public CorrelationReport scan(Collection<DataMetric> metrics, int minimumDays) {
        return scan(metrics, windowEndingToday(minimumDays));
    }

    public CorrelationReport scan(Collection<DataMetric> metrics, DateRange range) {
        List<MetricPair> pairs = enumeratePairs(metrics);
        List<PairOutcome> outcomes = new ArrayList<>(pairs.size());
        for (MetricPair pair : pairs) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Correlation scan cancelled after "
                    + outcomes.size() + " of " + pairs.size() + " pairs");
            }
            outcomes.add(evaluatePair(pair, range));
        }
        return assemble(outcomes);
    }

    /**
     * Canonical pairs in key order. Each input is resolved to the metric registered under
     * its key, so duplicate keys collapse and input order, repetition or a stale display
     * name never change the result.
     *
     * @throws IllegalArgumentException if a metric is not registered in the catalog
     */
    public List<MetricPair> enumeratePairs(Collection<DataMetric> metrics) {
        Collection<DataMetric> source = metrics == null || metrics.isEmpty()
            ? catalog.listAvailable() : metrics;

        // pairs carry the registered instance, never the caller's copy
        TreeMap<String, DataMetric> byKey = new TreeMap<>();
        for (DataMetric metric : source) {
            DataMetric registered = catalog.find(metric.key())
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metric.key()));
            byKey.putIfAbsent(registered.key(), registered);
        }

        List<DataMetric> sorted = new ArrayList<>(byKey.values());
        List<MetricPair> pairs = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                pairs.add(new MetricPair(sorted.get(i), sorted.get(j)));
            }
        }
        return pairs;
    }

    /**
     * Lag search and scoring for one pair. A provider that throws, whether with
     * {@link ProviderUnavailableException} or any other runtime exception, turns the pair
     * into a failed outcome instead of propagating.
     */
    public PairOutcome evaluatePair(MetricPair pair, DateRange range) {
        Optional<LaggedScore> best;
        try {
            best = computer.bestLag(pair.first(), pair.second(), range);
        } catch (RuntimeException e) {
            return PairOutcome.failed(pair,
                new PairFailure(pair.first().key(), pair.second().key(), reasonOf(e)));
        }
        if (best.isEmpty()) return PairOutcome.empty(pair);

        CorrelationResult result = toResult(best.get(), range);
        return result.significance() == Significance.NONE
            ? PairOutcome.empty(pair)
            : PairOutcome.of(pair, result);
    }

    /** Orders retained results and failures deterministically, whatever the completion order. */
    public CorrelationReport assemble(Collection<PairOutcome> outcomes) {
        List<CorrelationResult> results = new ArrayList<>();
        List<PairFailure> failures = new ArrayList<>();
        for (PairOutcome outcome : outcomes) {
            outcome.resultIfPresent().ifPresent(results::add);
            if (outcome.failed()) failures.add(outcome.failure());
        }
        results.sort(RANKING);
        failures.sort(Comparator.comparing(PairFailure::metricXKey).thenComparing(PairFailure::metricYKey));
        return new CorrelationReport(results, failures);
    }

    // ── analyzeRelationship ─────────────────────────────────────────────────

    /** Aligned samples at the winning lag over the default window. */
    public Optional<MetricRelationship> analyzeRelationship(DataMetric metricX, DataMetric metricY) {
        return analyzeRelationship(metricX, metricY, windowEndingToday(settings.defaultWindowDays()));
    }

    /**
     * Aligned samples at the winning lag, oriented so that {@code metricX} of the returned
     * relationship is the leading metric. Empty when no lag has enough usable samples.
     *
     * @throws ProviderUnavailableException if either provider fails
     */
    public Optional<MetricRelationship> analyzeRelationship(DataMetric metricX, DataMetric metricY,
                                                            DateRange range) {
        if (metricX.key().equals(metricY.key())) {
            throw new IllegalArgumentException("Cannot relate a metric to itself: " + metricX.key());
        }
        return computer.bestLag(metricX, metricY, range)
            .map(best -> new MetricRelationship(best.leading(), best.following(), range,
                best.lagDays(), best.points()));
    }

    public DateRange windowEndingToday(int days) {
        return DateRange.lastDays(LocalDate.now(clock), days);
    }

    public CorrelationSettings settings() {
        return settings;
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private CorrelationResult toResult(LaggedScore best, DateRange range) {
        PairScore score = best.score();
        DataMetric x = best.leading();
        DataMetric y = best.following();
        Significance significance = Significance.classify(score.coefficient());
        return new CorrelationResult(
            resultId(x, y, best.lagDays(), range),
            x, y,
            score.coefficient(),
            score.confidence(),
            score.sampleSize(),
            best.lagDays(),
            range,
            describe(x, y, score, best.lagDays(), significance),
            significance);
    }

    private static String reasonOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static UUID resultId(DataMetric x, DataMetric y, int lag, DateRange range) {
        String name = "correlation|" + x.key() + "|" + y.key() + "|" + lag + "|" + range;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    static String describe(DataMetric x, DataMetric y, PairScore score, int lag, Significance significance) {
        String direction = score.coefficient() > 0 ? "positive" : "negative";
        String timing = lag == 0 ? "on the same day"
            : String.format(Locale.ROOT, "with %s %d day%s later", y.displayName(), lag, lag == 1 ? "" : "s");
        return String.format(Locale.ROOT, "%s and %s show a %s %s correlation %s (r = %.2f, n = %d)",
            x.displayName(), y.displayName(), significance.name().toLowerCase(Locale.ROOT), direction,
            timing, score.coefficient(), score.sampleSize());
    }
}
