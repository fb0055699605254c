package com.reflectionplatform.correlation.exception;

/**
 * A value provider could not reach its backing store. Affects only the pairs that
 * involve the failing metric.
 */
public class ProviderUnavailableException extends CorrelationException {

    public ProviderUnavailableException(String metricKey, String message) {
        super(metricKey, message);
    }

    public ProviderUnavailableException(String metricKey, String message, Throwable cause) {
        super(metricKey, message, cause);
    }
}
