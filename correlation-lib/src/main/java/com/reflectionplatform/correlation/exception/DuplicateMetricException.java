package com.reflectionplatform.correlation.exception;

/**
 * Raised when a metric key is registered twice. Only the offending registration fails;
 * the catalog keeps the first registration.
 */
public class DuplicateMetricException extends CorrelationException {

    public DuplicateMetricException(String metricKey) {
        super(metricKey, "Metric already registered");
    }
}
