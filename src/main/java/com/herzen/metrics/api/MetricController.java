package com.herzen.metrics.api;

import com.herzen.metrics.domain.MetricModels.*;
import com.herzen.metrics.domain.ScoreModels.ComputeReport;
import com.herzen.metrics.domain.ScoreModels.MetricError;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.engine.MetricRecomputeService;
import com.herzen.metrics.error.InvalidMetricDefinitionException;
import com.herzen.metrics.rule.RuleEvaluator;
import com.herzen.metrics.service.MetricDefinitionService;
import com.herzen.metrics.service.ScoreQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricController {
    private final MetricDefinitionService definitionService;
    private final MetricRecomputeService recomputeService;
    private final ScoreQueryService scoreQueryService;
    private final RuleEvaluator ruleEvaluator;

    public MetricController(MetricDefinitionService definitionService,
                            MetricRecomputeService recomputeService,
                            ScoreQueryService scoreQueryService,
                            RuleEvaluator ruleEvaluator) {
        this.definitionService = definitionService;
        this.recomputeService = recomputeService;
        this.scoreQueryService = scoreQueryService;
        this.ruleEvaluator = ruleEvaluator;
    }

    @PostMapping
    public ResponseEntity<MetricView> create(@RequestBody MetricRequest request) {
        return ResponseEntity.ok(MetricView.of(definitionService.create(request.toDefinition(request.id()))));
    }

    @PutMapping("/{metricId}")
    public ResponseEntity<MetricView> update(@PathVariable String metricId, @RequestBody MetricRequest request) {
        return ResponseEntity.ok(MetricView.of(definitionService.update(metricId, request.toDefinition(metricId))));
    }

    @GetMapping
    public ResponseEntity<List<MetricView>> list() {
        return ResponseEntity.ok(definitionService.list().stream().map(MetricView::of).toList());
    }

    @GetMapping("/{metricId}")
    public ResponseEntity<MetricView> get(@PathVariable String metricId) {
        return ResponseEntity.ok(MetricView.of(definitionService.get(metricId)));
    }

    @DeleteMapping("/{metricId}")
    public ResponseEntity<Void> delete(@PathVariable String metricId) {
        definitionService.delete(metricId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{metricId}/compute")
    public ResponseEntity<ComputeReport> compute(@PathVariable String metricId,
                                                 @RequestBody(required = false) ComputeRequest request) {
        List<String> learners = request == null || request.learnerIds() == null ? List.of() : request.learnerIds();
        return ResponseEntity.ok(recomputeService.computeNow(metricId, learners));
    }

    @GetMapping("/{metricId}/scores")
    public ResponseEntity<List<MetricScore>> scores(@PathVariable String metricId) {
        return ResponseEntity.ok(scoreQueryService.scoresOf(metricId));
    }

    @DeleteMapping("/{metricId}/scores")
    public ResponseEntity<Map<String, Integer>> clearScores(@PathVariable String metricId) {
        return ResponseEntity.ok(Map.of("cleared", scoreQueryService.clearScores(metricId)));
    }

    @GetMapping("/{metricId}/errors")
    public ResponseEntity<List<MetricError>> errors(@PathVariable String metricId) {
        return ResponseEntity.ok(scoreQueryService.errorsOf(metricId));
    }

    @GetMapping("/rules")
    public ResponseEntity<List<RuleView>> rules() {
        return ResponseEntity.ok(ruleEvaluator.catalog().stream()
                .map(r -> new RuleView(r.name(), r.parameterNames(), r.description()))
                .toList());
    }

    public record MetricRequest(String id,
                                String name,
                                String level,
                                List<String> coverage,
                                List<Object> rule,
                                String submetric,
                                Map<String, Double> tagWeights,
                                Long timeFilterStart,
                                Long timeFilterEnd,
                                String multiples,
                                Boolean autoCompute,
                                Boolean visibleToStudent) {

        MetricDefinition toDefinition(String metricId) {
            try {
                TimeFilter window = new TimeFilter(
                        timeFilterStart == null ? TimeFilter.UNBOUNDED.start() : timeFilterStart,
                        timeFilterEnd == null ? TimeFilter.UNBOUNDED.end() : timeFilterEnd);
                return new MetricDefinition(metricId, name, level == null ? null : Level.fromValue(level),
                        Coverage.fromArray(coverage), Rule.fromArray(rule), submetric, tagWeights, window,
                        MultiplesPolicy.fromValue(multiples),
                        Boolean.TRUE.equals(autoCompute), Boolean.TRUE.equals(visibleToStudent), null);
            } catch (IllegalArgumentException e) {
                throw new InvalidMetricDefinitionException(e.getMessage());
            }
        }
    }

    public record MetricView(String id,
                             String name,
                             String level,
                             List<String> coverage,
                             List<Object> rule,
                             String submetric,
                             Map<String, Double> tagWeights,
                             long timeFilterStart,
                             long timeFilterEnd,
                             String multiples,
                             boolean autoCompute,
                             boolean visibleToStudent,
                             Long lastUpdated) {

        static MetricView of(MetricDefinition d) {
            return new MetricView(d.id(), d.name(), d.level().value(), d.coverage().toArray(), d.rule().toArray(),
                    d.submetricId(), d.tagWeights(), d.timeFilter().start(), d.timeFilter().end(), d.multiples().value(),
                    d.autoCompute(), d.visibleToStudent(), d.lastUpdated());
        }
    }

    public record ComputeRequest(List<String> learnerIds) {}

    public record RuleView(String name, List<String> parameters, String description) {}
}
