package com.herzen.metrics.service;

import com.herzen.metrics.domain.MetricModels.MetricDefinition;
import com.herzen.metrics.engine.MetricRecomputeService;
import com.herzen.metrics.error.InvalidMetricDefinitionException;
import com.herzen.metrics.error.MetricInUseException;
import com.herzen.metrics.error.MetricNotFoundException;
import com.herzen.metrics.repository.MetricDefinitionJdbcRepository;
import com.herzen.metrics.repository.ScoreJdbcRepository;
import com.herzen.metrics.repository.StoreRetry;
import com.herzen.metrics.validation.MetricDefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Administration of metric definitions. Every write is validated against all stored definitions
 * first, so the stored set never contains a cycle or a dangling submetric.
 */
@Service
public class MetricDefinitionService {
    private static final Logger log = LoggerFactory.getLogger(MetricDefinitionService.class);

    private final MetricDefinitionJdbcRepository definitions;
    private final ScoreJdbcRepository scores;
    private final MetricDefinitionValidator validator;
    private final MetricRecomputeService recomputeService;
    private final StoreRetry storeRetry;

    public MetricDefinitionService(MetricDefinitionJdbcRepository definitions,
                                   ScoreJdbcRepository scores,
                                   MetricDefinitionValidator validator,
                                   MetricRecomputeService recomputeService,
                                   StoreRetry storeRetry) {
        this.definitions = definitions;
        this.scores = scores;
        this.validator = validator;
        this.recomputeService = recomputeService;
        this.storeRetry = storeRetry;
    }

    public synchronized MetricDefinition create(MetricDefinition draft) {
        String id = draft.id() == null || draft.id().isBlank() ? UUID.randomUUID().toString() : draft.id().trim();
        if (storeRetry.call("definitions.find", () -> definitions.find(id)).isPresent()) {
            throw new InvalidMetricDefinitionException("Metric id already exists: " + id);
        }
        MetricDefinition candidate = draft.withId(id);
        requireUniqueName(candidate);
        validator.requireValid(candidate, all());

        storeRetry.run("definitions.insert", () -> definitions.insert(candidate));
        log.info("Created metric {} '{}' at level {}", id, candidate.name(), candidate.level().value());
        return get(id);
    }

    public synchronized MetricDefinition update(String metricId, MetricDefinition draft) {
        get(metricId);
        MetricDefinition candidate = draft.withId(metricId);
        requireUniqueName(candidate);
        validator.requireValid(candidate, all());

        storeRetry.call("definitions.update", () -> definitions.update(candidate));
        recomputeService.invalidate(candidate);
        log.info("Updated metric {} '{}'", metricId, candidate.name());
        return get(metricId);
    }

    /**
     * Deletes the definition and its stored scores. Refused while another metric uses it as submetric.
     */
    public synchronized void delete(String metricId) {
        get(metricId);
        List<String> dependents = storeRetry.call("definitions.findBySubmetric", () -> definitions.findBySubmetric(metricId))
                .stream().map(MetricDefinition::id).toList();
        if (!dependents.isEmpty()) throw new MetricInUseException(metricId, dependents);

        int cleared = storeRetry.call("scores.deleteByMetric", () -> scores.deleteByMetric(metricId));
        storeRetry.call("definitions.delete", () -> definitions.delete(metricId));
        recomputeService.forgetMetric(metricId);
        log.info("Deleted metric {} and {} stored score(s)", metricId, cleared);
    }

    public MetricDefinition get(String metricId) {
        return storeRetry.call("definitions.find", () -> definitions.find(metricId))
                .orElseThrow(() -> new MetricNotFoundException(metricId));
    }

    public List<MetricDefinition> list() {
        return all();
    }

    private List<MetricDefinition> all() {
        return storeRetry.call("definitions.findAll", definitions::findAll);
    }

    private void requireUniqueName(MetricDefinition candidate) {
        if (candidate.name() == null) return;
        storeRetry.call("definitions.findByName", () -> definitions.findByName(candidate.name()))
                .filter(existing -> !existing.id().equals(candidate.id()))
                .ifPresent(existing -> {
                    throw new InvalidMetricDefinitionException("Metric name already in use: " + candidate.name());
                });
    }
}
