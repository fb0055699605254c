package com.reflectionplatform.correlation.compute;

import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DataPoint;

import java.util.List;

/**
 * Winner of a lag search: the orientation ({@code leading} observed first), the lag,
 * the aligned samples at that lag and their score.
 */
public record LaggedScore(
    DataMetric leading,
    DataMetric following,
    int lagDays,
    List<DataPoint> points,
    PairScore score
) {}
