package com.herzen.metrics.coverage;

import com.herzen.metrics.domain.MetricModels.Coverage;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.error.UnknownItemException;
import com.herzen.metrics.service.ContentCatalogService;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a coverage declaration into the concrete set of item ids at a level.
 * Results are cached per (level, coverage, catalog version).
 */
@Component
public class CoverageResolver {
    private final ContentCatalogService catalog;
    private final Map<CacheKey, Set<String>> cache = new ConcurrentHashMap<>();

    public CoverageResolver(ContentCatalogService catalog) {
        this.catalog = catalog;
    }

    public Set<String> resolve(Level level, Coverage coverage) {
        long version = catalog.version();
        CacheKey key = new CacheKey(level, coverage, version);
        Set<String> cached = cache.get(key);
        if (cached != null) return cached;

        Set<String> resolved = Collections.unmodifiableSet(compute(level, coverage));
        cache.keySet().removeIf(k -> k.catalogVersion() < version);
        cache.put(key, resolved);
        return resolved;
    }

    private Set<String> compute(Level level, Coverage coverage) {
        Set<String> available = catalog.itemIdsAtLevel(level);
        if (coverage instanceof Coverage.Include include) {
            Set<String> unknown = new TreeSet<>(include.ids());
            unknown.removeAll(available);
            if (!unknown.isEmpty()) throw new UnknownItemException(unknown, level.value());
            return new TreeSet<>(include.ids());
        }
        if (coverage instanceof Coverage.Exclude exclude) {
            Set<String> out = new TreeSet<>(available);
            out.removeAll(exclude.ids());
            return out;
        }
        return new TreeSet<>(available);
    }

    private record CacheKey(Level level, Coverage coverage, long catalogVersion) {}
}
