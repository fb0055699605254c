package com.reflectionplatform.correlation.exception;

public class CorrelationException extends RuntimeException {
    private final String metricKey;

    public CorrelationException(String metricKey, String message) {
        super("[" + metricKey + "] " + message);
        this.metricKey = metricKey;
    }

    public CorrelationException(String metricKey, String message, Throwable cause) {
        super("[" + metricKey + "] " + message, cause);
        this.metricKey = metricKey;
    }

    public String getMetricKey() {
        return metricKey;
    }
}
