package com.herzen.metrics.error;

import com.herzen.metrics.validation.ValidationModels.ValidationIssue;

import java.util.List;

public class InvalidMetricDefinitionException extends MetricEngineException {
    private final List<ValidationIssue> issues;

    public InvalidMetricDefinitionException(String message) {
        this(message, List.of());
    }

    public InvalidMetricDefinitionException(String message, List<ValidationIssue> issues) {
        super(ErrorKind.INVALID_DEFINITION, message);
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> issues() {
        return issues;
    }
}
