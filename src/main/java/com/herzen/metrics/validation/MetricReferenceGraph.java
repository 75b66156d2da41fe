package com.herzen.metrics.validation;

import com.herzen.metrics.domain.MetricModels.MetricDefinition;

import java.util.*;

/**
 * Directed graph of submetric references, metric id → submetric id.
 */
public class MetricReferenceGraph {
    private final Map<String, List<String>> adj = new HashMap<>();

    public MetricReferenceGraph(Collection<MetricDefinition> definitions) {
        for (MetricDefinition d : definitions) {
            adj.computeIfAbsent(d.id(), k -> new ArrayList<>());
            if (d.hasSubmetric()) adj.get(d.id()).add(d.submetricId());
        }
    }

    /**
     * Returns the first cycle found, as a path that starts and ends with the same metric id.
     */
    public Optional<List<String>> findCycle() {
        Set<String> visiting = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : new TreeSet<>(adj.keySet())) {
            Optional<List<String>> cycle = visit(node, visiting, visited);
            if (cycle.isPresent()) return cycle;
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String node, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return Optional.empty();
        if (visiting.contains(node)) {
            List<String> path = new ArrayList<>();
            boolean inCycle = false;
            for (String v : visiting) {
                if (v.equals(node)) inCycle = true;
                if (inCycle) path.add(v);
            }
            path.add(node);
            return Optional.of(path);
        }

        visiting.add(node);
        for (String next : adj.getOrDefault(node, List.of())) {
            Optional<List<String>> cycle = visit(next, visiting, visited);
            if (cycle.isPresent()) return cycle;
        }
        visiting.remove(node);
        visited.add(node);
        return Optional.empty();
    }
}
