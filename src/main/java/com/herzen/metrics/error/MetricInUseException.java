package com.herzen.metrics.error;

import java.util.List;

public class MetricInUseException extends MetricEngineException {
    public MetricInUseException(String metricId, List<String> dependents) {
        super(ErrorKind.INVALID_DEFINITION, "Metric " + metricId + " is used as submetric by " + dependents);
    }
}
