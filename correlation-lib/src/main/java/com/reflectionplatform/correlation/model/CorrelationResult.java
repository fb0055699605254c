package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Scored relationship between two metrics.
 *
 * <p>{@code metricX} is the leading metric: its value on day {@code d} is paired with
 * the value of {@code metricY} on day {@code d + lagDays}. {@code significance} is
 * always {@link Significance#classify(double)} of the coefficient.
 */
public record CorrelationResult(
    @JsonProperty("id") UUID id,
    @JsonProperty("metricX") DataMetric metricX,
    @JsonProperty("metricY") DataMetric metricY,
    @JsonProperty("correlationCoefficient") double correlationCoefficient,
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("sampleSize") int sampleSize,
    @JsonProperty("lagDays") int lagDays,
    @JsonProperty("dateRange") DateRange dateRange,
    @JsonProperty("description") String description,
    @JsonProperty("significance") Significance significance
) {
    /** Ranking weight: {@code confidenceScore * |correlationCoefficient|}. */
    public double strength() {
        return confidenceScore * Math.abs(correlationCoefficient);
    }

    /** Unordered pair key, {@code "a|b"} with the lexically smaller key first. */
    public String pairKey() {
        String x = metricX.key();
        String y = metricY.key();
        return x.compareTo(y) <= 0 ? x + "|" + y : y + "|" + x;
    }

    public boolean positive() {
        return correlationCoefficient > 0;
    }
}
