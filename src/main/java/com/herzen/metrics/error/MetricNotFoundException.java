package com.herzen.metrics.error;

public class MetricNotFoundException extends MetricEngineException {
    public MetricNotFoundException(String metricId) {
        super(ErrorKind.UNKNOWN_METRIC, "Metric definition not found: " + metricId);
    }
}
