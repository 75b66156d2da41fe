package com.herzen.metrics.error;

public enum ErrorKind {
    UNKNOWN_ITEM,
    UNKNOWN_RULE,
    CYCLIC_METRIC_REFERENCE,
    DEPENDENCY_TIMEOUT,
    STORE_UNAVAILABLE,
    INVALID_DEFINITION,
    UNKNOWN_METRIC
}
