package com.herzen.metrics.service;

import com.herzen.metrics.domain.MetricModels.MetricDefinition;
import com.herzen.metrics.domain.ScoreModels.MetricError;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.engine.MetricRecomputeService;
import com.herzen.metrics.repository.MetricErrorJdbcRepository;
import com.herzen.metrics.repository.ScoreJdbcRepository;
import com.herzen.metrics.repository.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ScoreQueryService {
    private static final Logger log = LoggerFactory.getLogger(ScoreQueryService.class);

    private final MetricDefinitionService definitionService;
    private final ScoreJdbcRepository scores;
    private final MetricErrorJdbcRepository errors;
    private final MetricRecomputeService recomputeService;
    private final StoreRetry storeRetry;

    public ScoreQueryService(MetricDefinitionService definitionService,
                             ScoreJdbcRepository scores,
                             MetricErrorJdbcRepository errors,
                             MetricRecomputeService recomputeService,
                             StoreRetry storeRetry) {
        this.definitionService = definitionService;
        this.scores = scores;
        this.errors = errors;
        this.recomputeService = recomputeService;
        this.storeRetry = storeRetry;
    }

    public List<MetricScore> scoresOf(String metricId) {
        definitionService.get(metricId);
        return storeRetry.call("scores.findByMetric", () -> scores.findByMetric(metricId));
    }

    /**
     * Stored scores of one learner. With {@code visibleOnly}, scores of metrics hidden from students are left out.
     */
    public List<MetricScore> scoresOfLearner(String learnerId, boolean visibleOnly) {
        List<MetricScore> all = storeRetry.call("scores.findByLearner", () -> scores.findByLearner(learnerId));
        if (!visibleOnly) return all;
        Map<String, MetricDefinition> byId = definitionService.list().stream()
                .collect(Collectors.toMap(MetricDefinition::id, Function.identity()));
        return all.stream()
                .filter(s -> byId.containsKey(s.metricId()) && byId.get(s.metricId()).visibleToStudent())
                .toList();
    }

    public List<MetricError> errorsOf(String metricId) {
        definitionService.get(metricId);
        return storeRetry.call("errors.findByMetric", () -> errors.findByMetric(metricId));
    }

    /**
     * Drops every stored score of the metric; the scores read as stale until recomputed.
     */
    public int clearScores(String metricId) {
        definitionService.get(metricId);
        int cleared = storeRetry.call("scores.deleteByMetric", () -> scores.deleteByMetric(metricId));
        recomputeService.forgetMetric(metricId);
        log.info("Cleared {} stored score(s) of metric {}", cleared, metricId);
        return cleared;
    }
}
