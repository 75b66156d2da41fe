package com.herzen.metrics.error;

public abstract class MetricEngineException extends RuntimeException {
    private final ErrorKind kind;

    protected MetricEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MetricEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
