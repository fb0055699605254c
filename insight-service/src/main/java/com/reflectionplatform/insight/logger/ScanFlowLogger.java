package com.reflectionplatform.insight.logger;

import com.reflectionplatform.correlation.model.CorrelationReport;
import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.PairFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Observability for the lifecycle of one correlation scan. Logs only; never changes
 * what the scan computes.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #SCAN_REQUESTED}        — a caller subscribed to a scan</li>
 *   <li>{@link #PAIRS_ENUMERATED}      — the metric pairs to evaluate are known</li>
 *   <li>{@link #PAIR_FAILED}           — a provider failed for one pair (zero or more times)</li>
 *   <li>{@link #SCAN_COMPLETED}        — all pairs evaluated and results ranked</li>
 *   <li>{@link #SCAN_CANCELLED}        — the caller disposed the scan before it completed</li>
 *   <li>{@link #SUGGESTIONS_GENERATED} — results turned into suggestions</li>
 * </ol>
 *
 * <p>The {@code scanId} is written to the MDC only for the duration of each log call,
 * so worker threads never carry a stale id.
 */
@Component
public class ScanFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ScanFlowLogger.class);

    public static final String SCAN_ID_KEY = "scanId";

    public static final String SCAN_REQUESTED        = "SCAN_REQUESTED";
    public static final String PAIRS_ENUMERATED      = "PAIRS_ENUMERATED";
    public static final String PAIR_FAILED           = "PAIR_FAILED";
    public static final String SCAN_COMPLETED        = "SCAN_COMPLETED";
    public static final String SCAN_CANCELLED        = "SCAN_CANCELLED";
    public static final String SUGGESTIONS_GENERATED = "SUGGESTIONS_GENERATED";

    public void stage(String stageName, String scanId) {
        withMdc(scanId, () ->
            log.info("[ScanFlow] stage={} scanId={}", stageName, scanId)
        );
    }

    public void pairsEnumerated(String scanId, int pairCount, Object range) {
        withMdc(scanId, () ->
            log.info("[ScanFlow] stage={} pairs={} range={} scanId={}",
                     PAIRS_ENUMERATED, pairCount, range, scanId)
        );
    }

    public void pairFailed(String scanId, PairFailure failure) {
        withMdc(scanId, () ->
            log.warn("[ScanFlow] stage={} pair={}|{} reason={} scanId={}",
                     PAIR_FAILED, failure.metricXKey(), failure.metricYKey(), failure.reason(), scanId)
        );
    }

    /**
     * Logs result and failure counts plus the top-ranked pair, if any.
     */
    public void scanCompleted(String scanId, CorrelationReport report) {
        CorrelationResult top = report.results().isEmpty() ? null : report.results().get(0);
        withMdc(scanId, () ->
            log.info("[ScanFlow] stage={} results={} failures={} top={} scanId={}",
                     SCAN_COMPLETED, report.results().size(), report.failures().size(),
                     top != null ? top.pairKey() + " r=" + String.format("%.3f", top.correlationCoefficient()) : "N/A",
                     scanId)
        );
    }

    public void suggestionsGenerated(int resultCount, int suggestionCount) {
        log.info("[ScanFlow] stage={} results={} suggestions={}",
                 SUGGESTIONS_GENERATED, resultCount, suggestionCount);
    }

    private static void withMdc(String scanId, Runnable logAction) {
        MDC.put(SCAN_ID_KEY, scanId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SCAN_ID_KEY);
        }
    }
}
