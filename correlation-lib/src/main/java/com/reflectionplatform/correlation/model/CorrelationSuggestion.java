package com.reflectionplatform.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Actionable suggestion derived from exactly one {@link CorrelationResult}.
 * {@code priority} runs from 1 (lowest) to 5 (highest).
 */
public record CorrelationSuggestion(
    @JsonProperty("id") UUID id,
    @JsonProperty("correlation") CorrelationResult correlation,
    @JsonProperty("insight") String insight,
    @JsonProperty("suggestedChange") String suggestedChange,
    @JsonProperty("expectedImpact") String expectedImpact,
    @JsonProperty("priority") int priority
) {}
