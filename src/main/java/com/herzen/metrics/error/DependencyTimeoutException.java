package com.herzen.metrics.error;

public class DependencyTimeoutException extends MetricEngineException {
    public DependencyTimeoutException(String metricId, String learnerId, long timeoutMs) {
        super(ErrorKind.DEPENDENCY_TIMEOUT,
                "Metric " + metricId + " for learner " + learnerId + " did not finish within " + timeoutMs + " ms");
    }
}
