package com.herzen.metrics.error;

import java.util.List;

public class CyclicMetricReferenceException extends MetricEngineException {
    private final List<String> path;

    public CyclicMetricReferenceException(List<String> path) {
        super(ErrorKind.CYCLIC_METRIC_REFERENCE, "Submetric references form a cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }
}
