package com.herzen.metrics.engine;

import com.herzen.metrics.domain.ScoreModels.RecomputeKey;
import com.herzen.metrics.error.DependencyTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Per-key recompute state machine: IDLE → PENDING → RUNNING → IDLE.
 * <p>
 * Events for a PENDING key are absorbed by the pending run. Events for a RUNNING key set a
 * rerun flag, so any number of them yields exactly one follow-up run. At most one run per key
 * is in flight at any time, whether it was scheduled or requested explicitly.
 */
public class RecomputeScheduler {
    private static final Logger log = LoggerFactory.getLogger(RecomputeScheduler.class);

    public enum Phase { IDLE, PENDING, RUNNING }

    private final Map<RecomputeKey, KeyState> states = new ConcurrentHashMap<>();
    private final Executor executor;
    private final TaskScheduler taskScheduler;
    private final Consumer<RecomputeKey> task;
    private final Duration coalesceDelay;

    public RecomputeScheduler(Executor executor,
                              TaskScheduler taskScheduler,
                              Consumer<RecomputeKey> task,
                              Duration coalesceDelay) {
        this.executor = executor;
        this.taskScheduler = taskScheduler;
        this.task = task;
        this.coalesceDelay = coalesceDelay == null || coalesceDelay.isNegative() ? Duration.ZERO : coalesceDelay;
    }

    /**
     * Records a qualifying event for the key.
     */
    public void submit(RecomputeKey key) {
        while (true) {
            KeyState state = state(key);
            boolean dispatch = false;
            synchronized (state) {
                if (state.retired) continue;
                switch (state.phase) {
                    case IDLE -> {
                        state.phase = Phase.PENDING;
                        dispatch = true;
                    }
                    case PENDING -> log.debug("Coalesced event into pending recompute of {}", key);
                    case RUNNING -> {
                        state.rerun = true;
                        log.debug("Recompute of {} is running; queued one follow-up run", key);
                    }
                }
            }
            if (dispatch) dispatch(key);
            return;
        }
    }

    /**
     * Runs {@code work} for the key on the calling thread, bypassing the pending state. If a run
     * for the key is in flight, waits for it first, up to {@code timeout}.
     */
    public <T> T runExclusive(RecomputeKey key, Supplier<T> work, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        KeyState claimed;
        CompletableFuture<Void> done;
        while (true) {
            KeyState state = state(key);
            CompletableFuture<Void> inFlight;
            synchronized (state) {
                if (state.retired) continue;
                if (state.phase != Phase.RUNNING) {
                    state.phase = Phase.RUNNING;
                    done = new CompletableFuture<>();
                    state.completion = done;
                    claimed = state;
                    break;
                }
                inFlight = state.completion;
            }
            await(key, inFlight, deadline - System.nanoTime(), timeout);
        }
        try {
            return work.get();
        } finally {
            finish(key, claimed, done);
        }
    }

    /**
     * Waits until no run for the key is in flight, up to {@code timeout}.
     */
    public void awaitIdle(RecomputeKey key, Duration timeout) {
        KeyState state = states.get(key);
        if (state == null) return;
        CompletableFuture<Void> inFlight;
        synchronized (state) {
            if (state.phase != Phase.RUNNING) return;
            inFlight = state.completion;
        }
        await(key, inFlight, timeout.toNanos(), timeout);
    }

    public Phase phase(RecomputeKey key) {
        KeyState state = states.get(key);
        if (state == null) return Phase.IDLE;
        synchronized (state) {
            return state.phase;
        }
    }

    /**
     * Number of keys with a pending or running recompute. Idle keys hold no state.
     */
    public int trackedKeys() {
        return states.size();
    }

    private void dispatch(RecomputeKey key) {
        Runnable handOff = () -> executor.execute(() -> runScheduled(key));
        if (coalesceDelay.isZero()) {
            handOff.run();
        } else {
            taskScheduler.schedule(handOff, Instant.now().plus(coalesceDelay));
        }
    }

    private void runScheduled(RecomputeKey key) {
        KeyState state;
        CompletableFuture<Void> done;
        while (true) {
            state = state(key);
            synchronized (state) {
                if (state.retired) continue;
                if (state.phase == Phase.RUNNING) {
                    state.rerun = true;
                    return;
                }
                state.phase = Phase.RUNNING;
                done = new CompletableFuture<>();
                state.completion = done;
                break;
            }
        }
        try {
            task.accept(key);
        } catch (RuntimeException e) {
            log.error("Unhandled failure while recomputing {}", key, e);
        } finally {
            finish(key, state, done);
        }
    }

    private void finish(RecomputeKey key, KeyState state, CompletableFuture<Void> done) {
        boolean again;
        synchronized (state) {
            again = state.rerun;
            state.rerun = false;
            state.phase = again ? Phase.PENDING : Phase.IDLE;
            state.completion = null;
            if (!again) {
                state.retired = true;
                states.remove(key, state);
            }
        }
        done.complete(null);
        if (again) dispatch(key);
    }

    private void await(RecomputeKey key, CompletableFuture<Void> inFlight, long remainingNanos, Duration timeout) {
        if (inFlight == null) return;
        try {
            if (remainingNanos <= 0) throw new TimeoutException();
            inFlight.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new DependencyTimeoutException(key.metricId(), key.learnerId(), timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DependencyTimeoutException(key.metricId(), key.learnerId(), timeout.toMillis());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Recompute completion failed for " + key, e.getCause());
        }
    }

    private KeyState state(RecomputeKey key) {
        return states.computeIfAbsent(key, k -> new KeyState());
    }

    private static final class KeyState {
        private Phase phase = Phase.IDLE;
        private boolean rerun;
        private CompletableFuture<Void> completion;
        // Set once the state leaves the map; holders must fetch a fresh one.
        private boolean retired;
    }
}
