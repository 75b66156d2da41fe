package com.herzen.metrics.engine;

import com.herzen.metrics.domain.ScoreModels.RecomputeKey;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class StalenessTracker {
    private final Set<RecomputeKey> dirty = ConcurrentHashMap.newKeySet();

    public void markDirty(RecomputeKey key) {
        dirty.add(key);
    }

    public void clear(RecomputeKey key) {
        dirty.remove(key);
    }

    public boolean isDirty(RecomputeKey key) {
        return dirty.contains(key);
    }

    public void forgetMetric(String metricId) {
        dirty.removeIf(k -> k.metricId().equals(metricId));
    }
}
