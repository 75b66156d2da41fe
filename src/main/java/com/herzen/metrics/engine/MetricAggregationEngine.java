package com.herzen.metrics.engine;

import com.herzen.metrics.aggregation.SubmissionResolver;
import com.herzen.metrics.aggregation.TagWeightedAggregator;
import com.herzen.metrics.aggregation.TimeWindowFilter;
import com.herzen.metrics.coverage.CoverageResolver;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.domain.MetricModels.MetricDefinition;
import com.herzen.metrics.domain.ScoreModels.ItemScore;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import com.herzen.metrics.domain.ScoreModels.Submission;
import com.herzen.metrics.repository.StoreRetry;
import com.herzen.metrics.repository.SubmissionJdbcRepository;
import com.herzen.metrics.rule.RuleEvaluator;
import com.herzen.metrics.service.ContentCatalogService;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Supplier;

/**
 * The scoring pipeline for one (metric, learner): coverage, time window, multiples, rule per
 * item, then the tag-weighted aggregate. Pure with respect to the store apart from reading
 * submissions; persisting the result is up to the caller.
 */
@Component
public class MetricAggregationEngine {
    private final CoverageResolver coverageResolver;
    private final ContentCatalogService catalog;
    private final SubmissionJdbcRepository submissions;
    private final TimeWindowFilter timeWindowFilter;
    private final SubmissionResolver submissionResolver;
    private final RuleEvaluator ruleEvaluator;
    private final TagWeightedAggregator aggregator;
    private final StoreRetry storeRetry;

    public MetricAggregationEngine(CoverageResolver coverageResolver,
                                   ContentCatalogService catalog,
                                   SubmissionJdbcRepository submissions,
                                   TimeWindowFilter timeWindowFilter,
                                   SubmissionResolver submissionResolver,
                                   RuleEvaluator ruleEvaluator,
                                   TagWeightedAggregator aggregator,
                                   StoreRetry storeRetry) {
        this.coverageResolver = coverageResolver;
        this.catalog = catalog;
        this.submissions = submissions;
        this.timeWindowFilter = timeWindowFilter;
        this.submissionResolver = submissionResolver;
        this.ruleEvaluator = ruleEvaluator;
        this.aggregator = aggregator;
        this.storeRetry = storeRetry;
    }

    /**
     * @param metric         the definition to score
     * @param submetric      the metric's submetric definition, or {@code null} for raw submissions
     * @param learnerId      learner to score
     * @param submetricScore supplies the learner's current submetric score; only called when
     *                       {@code submetric} is set
     */
    public MetricScore compute(MetricDefinition metric,
                               MetricDefinition submetric,
                               String learnerId,
                               Supplier<Optional<MetricScore>> submetricScore) {
        Level inputLevel = submetric == null ? metric.level() : submetric.level();
        Set<String> covered = coverageResolver.resolve(inputLevel, metric.coverage());

        List<ItemScore> inputs = submetric == null
                ? fromSubmissions(metric, learnerId, covered)
                : fromSubmetric(metric, covered, submetricScore.get().orElse(null));

        OptionalDouble aggregate = aggregator.aggregate(inputs, metric.tagWeights());
        List<ItemScore> breakdown = submetric == null ? inputs : rollUp(metric, inputs);
        return new MetricScore(metric.id(), learnerId,
                aggregate.isPresent() ? aggregate.getAsDouble() : null,
                System.currentTimeMillis(), breakdown);
    }

    private List<ItemScore> fromSubmissions(MetricDefinition metric, String learnerId, Set<String> covered) {
        Map<String, Set<String>> scopes = new LinkedHashMap<>();
        Set<String> every = new HashSet<>();
        for (String itemId : covered) {
            Set<String> scope = catalog.descendantsAndSelf(itemId);
            scopes.put(itemId, scope);
            every.addAll(scope);
        }
        List<Submission> recorded = every.isEmpty()
                ? List.of()
                : storeRetry.call("submissions.load", () -> submissions.loadForLearner(learnerId, every));

        List<ItemScore> out = new ArrayList<>();
        scopes.forEach((itemId, scope) -> {
            List<Submission> own = recorded.stream().filter(s -> scope.contains(s.itemId())).toList();
            List<Submission> windowed = timeWindowFilter.filter(own, metric.timeFilter());
            List<Submission> resolved = submissionResolver.resolvePerItem(windowed, metric.multiples());
            OptionalDouble value = ruleEvaluator.evaluate(metric.rule(), resolved.stream().map(ScoreInput::of).toList());
            String tag = catalog.tagOf(itemId);
            out.add(new ItemScore(itemId, tag != null ? tag : dominantTag(resolved), boxed(value), latest(resolved)));
        });
        return out;
    }

    private List<ItemScore> fromSubmetric(MetricDefinition metric, Set<String> covered, MetricScore source) {
        List<ItemScore> out = new ArrayList<>();
        for (String itemId : covered) {
            ItemScore upstream = source == null ? null : source.item(itemId);
            List<ScoreInput> inputs = upstream == null || upstream.isAbsent()
                    ? List.of()
                    : List.of(new ScoreInput(itemId, upstream.score(), submittedAt(upstream, source), upstream.tag()));
            OptionalDouble value = ruleEvaluator.evaluate(metric.rule(), inputs);
            String tag = catalog.tagOf(itemId);
            if (tag == null && upstream != null) tag = upstream.tag();
            out.add(new ItemScore(itemId, tag, boxed(value), inputs.isEmpty() ? null : inputs.get(0).timestamp()));
        }
        return out;
    }

    // Breakdown of a submetric-based score is keyed by items at the metric's own level.
    private List<ItemScore> rollUp(MetricDefinition metric, List<ItemScore> inputs) {
        Map<String, List<ItemScore>> byParent = new TreeMap<>();
        for (ItemScore input : inputs) {
            catalog.ancestorAtLevel(input.itemId(), metric.level())
                    .ifPresent(parent -> byParent.computeIfAbsent(parent, k -> new ArrayList<>()).add(input));
        }
        List<ItemScore> out = new ArrayList<>();
        byParent.forEach((parent, group) ->
                out.add(new ItemScore(parent, catalog.tagOf(parent),
                        boxed(aggregator.aggregate(group, metric.tagWeights())), latestOf(group))));
        return out;
    }

    // Time-based rules over a submetric see when the learner last submitted, not when the submetric ran.
    private static long submittedAt(ItemScore upstream, MetricScore source) {
        return upstream.latestAt() != null ? upstream.latestAt() : source.computedAt();
    }

    private static Long latest(List<Submission> resolved) {
        return resolved.stream().map(Submission::timestamp).max(Long::compare).orElse(null);
    }

    private static Long latestOf(List<ItemScore> group) {
        return group.stream().map(ItemScore::latestAt).filter(Objects::nonNull).max(Long::compare).orElse(null);
    }

    private static String dominantTag(List<Submission> resolved) {
        Map<String, Integer> counts = new TreeMap<>();
        resolved.stream().map(Submission::tag).filter(Objects::nonNull).forEach(t -> counts.merge(t, 1, Integer::sum));
        return counts.entrySet().stream()
                .max(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
