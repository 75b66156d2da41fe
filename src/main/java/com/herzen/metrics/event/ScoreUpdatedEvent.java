package com.herzen.metrics.event;

/**
 * A (metric, learner) score was stored.
 *
 * @param requestedBy id of the metric whose run recomputed this one inline as a dependency, or {@code null}
 */
public record ScoreUpdatedEvent(String metricId, String learnerId, long computedAt, String requestedBy) {}
