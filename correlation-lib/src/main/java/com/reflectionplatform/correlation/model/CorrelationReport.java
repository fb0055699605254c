package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one correlation scan: ranked results plus the pairs that failed.
 */
public record CorrelationReport(
    @JsonProperty("results") List<CorrelationResult> results,
    @JsonProperty("failures") List<PairFailure> failures
) {
    public CorrelationReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
