package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One aligned sample: the X value observed on {@code date} and the Y value observed
 * {@code lag} days later. The date is always the X-side date.
 */
public record DataPoint(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("valueX") double valueX,
    @JsonProperty("valueY") double valueY
) {}
