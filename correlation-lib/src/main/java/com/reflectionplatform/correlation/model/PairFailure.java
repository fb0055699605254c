package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A metric pair that could not be evaluated because a value provider failed.
 * Reported next to the results instead of aborting the scan.
 */
public record PairFailure(
    @JsonProperty("metricXKey") String metricXKey,
    @JsonProperty("metricYKey") String metricYKey,
    @JsonProperty("reason") String reason
) {}
