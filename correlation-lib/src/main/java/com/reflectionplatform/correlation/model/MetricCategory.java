package com.reflectionplatform.correlation.model;

/**
 * Source domain of a {@link DataMetric}.
 *
 * <p>{@code actionable} marks categories that describe behaviour the user changes
 * directly (how long they sleep, how much they move, how much they use the phone).
 * The remaining categories are outcomes the user observes.
 */
public enum MetricCategory {

    HEALTH("health", false),
    SLEEP("sleep", true),
    ACTIVITY("activity", true),
    PHONE_USAGE("phone usage", true),
    MOOD("mood", false),
    PRODUCTIVITY("productivity", false);

    private final String label;
    private final boolean actionable;

    MetricCategory(String label, boolean actionable) {
        this.label = label;
        this.actionable = actionable;
    }

    public String label() {
        return label;
    }

    public boolean actionable() {
        return actionable;
    }
}
