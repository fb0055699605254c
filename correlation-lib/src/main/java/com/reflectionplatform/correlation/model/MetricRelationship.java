package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The aligned samples behind one metric pair, at the lag chosen by the lag search.
 * Recomputed on demand; the engine never keeps it between calls.
 */
public record MetricRelationship(
    @JsonProperty("metricX") DataMetric metricX,
    @JsonProperty("metricY") DataMetric metricY,
    @JsonProperty("dateRange") DateRange dateRange,
    @JsonProperty("lagDays") int lagDays,
    @JsonProperty("points") List<DataPoint> points
) {
    public MetricRelationship {
        points = List.copyOf(points);
    }

    public int sampleSize() {
        return points.size();
    }
}
