package com.reflectionplatform.correlation.engine;

import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.PairFailure;

import java.util.Optional;

/**
 * What happened to one pair during a scan: a retained result, nothing (too little
 * data, no variance or no relationship), or a provider failure.
 */
public record PairOutcome(MetricPair pair, CorrelationResult result, PairFailure failure) {

    public static PairOutcome of(MetricPair pair, CorrelationResult result) {
        return new PairOutcome(pair, result, null);
    }

    public static PairOutcome empty(MetricPair pair) {
        return new PairOutcome(pair, null, null);
    }

    public static PairOutcome failed(MetricPair pair, PairFailure failure) {
        return new PairOutcome(pair, null, failure);
    }

    public Optional<CorrelationResult> resultIfPresent() {
        return Optional.ofNullable(result);
    }

    public boolean failed() {
        return failure != null;
    }
}
