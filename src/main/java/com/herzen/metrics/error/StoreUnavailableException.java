package com.herzen.metrics.error;

public class StoreUnavailableException extends MetricEngineException {
    public StoreUnavailableException(String operation, int attempts, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, "Store operation '" + operation + "' failed after " + attempts + " attempt(s)", cause);
    }
}
