package com.herzen.metrics.repository;

import com.herzen.metrics.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

// Only transient data access failures are retried.
@Component
public class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int maxAttempts;
    private final long backoffMs;

    public StoreRetry(@Value("${metrics.store.max-attempts:3}") int maxAttempts,
                      @Value("${metrics.store.backoff-ms:50}") long backoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    public <T> T call(String operation, Supplier<T> action) {
        DataAccessException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
                last = e;
                if (attempt < maxAttempts) {
                    log.warn("Store operation '{}' failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                    pause(operation, attempt, e);
                }
            }
        }
        throw new StoreUnavailableException(operation, maxAttempts, last);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private void pause(String operation, int attempt, DataAccessException cause) {
        if (backoffMs == 0) return;
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation, attempt, cause);
        }
    }
}
