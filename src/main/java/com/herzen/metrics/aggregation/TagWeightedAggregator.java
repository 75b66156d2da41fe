package com.herzen.metrics.aggregation;

import com.herzen.metrics.aggregation.AggregationPolicy.AbsentInputs;
import com.herzen.metrics.domain.ScoreModels.ItemScore;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Combines item scores into one score. With tag weights this is the weighted mean over the
 * weights actually applied; without them, the plain mean over present inputs.
 */
@Component
public class TagWeightedAggregator {
    public static final String DEFAULT_TAG = "_default_tag";

    private final AggregationPolicy policy;

    public TagWeightedAggregator(AggregationPolicy policy) {
        this.policy = policy;
    }

    public OptionalDouble aggregate(Collection<ItemScore> inputs, Map<String, Double> tagWeights) {
        if (inputs.isEmpty() || inputs.stream().allMatch(ItemScore::isAbsent)) return OptionalDouble.empty();
        boolean weighted = tagWeights != null && !tagWeights.isEmpty();

        double total = 0.0;
        double weightTotal = 0.0;
        for (ItemScore input : inputs) {
            double weight = weighted ? weightOf(input.tag(), tagWeights) : 1.0;
            if (input.isAbsent()) {
                if (policy.absentInputs() == AbsentInputs.ZERO) weightTotal += weight;
                continue;
            }
            total += input.score() * weight;
            weightTotal += weight;
        }
        if (weightTotal <= 0.0) return OptionalDouble.empty();
        return OptionalDouble.of(total / weightTotal);
    }

    private double weightOf(String tag, Map<String, Double> tagWeights) {
        String key = tag == null || tag.isBlank() ? DEFAULT_TAG : tag;
        Double weight = tagWeights.get(key);
        return weight == null ? policy.missingTagWeight() : weight;
    }
}
