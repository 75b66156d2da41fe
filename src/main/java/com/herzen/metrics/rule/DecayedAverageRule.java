package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Mean of scores decayed by lateness. A score recorded L minutes after the deadline counts as
 * {@code score * 2^(-min(max(L, 0), cap) / halving)}.
 */
@Component
public class DecayedAverageRule implements ScoringRule {
    private static final double MILLIS_PER_MINUTE = 60_000.0;

    @Override
    public String name() {
        return "decayedAverage";
    }

    @Override
    public String description() {
        return "Mean of scores halved every `halving` minutes past the deadline, up to `cap` minutes";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("deadline", "halving", "cap");
    }

    @Override
    public void checkParameters(List<String> params) {
        RuleParameters.maxArity(params, 3, name());
        RuleParameters.requiredNumber(params, 0, "deadline");
        double halving = RuleParameters.requiredNumber(params, 1, "halving");
        if (halving <= 0) throw new IllegalArgumentException("halving must be positive");
        double cap = RuleParameters.number(params, 2, "cap", Double.POSITIVE_INFINITY);
        if (cap < 0) throw new IllegalArgumentException("cap must be non-negative");
    }

    @Override
    public OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params) {
        if (inputs.isEmpty()) return OptionalDouble.empty();
        double deadline = RuleParameters.requiredNumber(params, 0, "deadline");
        double halving = RuleParameters.requiredNumber(params, 1, "halving");
        double cap = RuleParameters.number(params, 2, "cap", Double.POSITIVE_INFINITY);
        if (halving <= 0) return OptionalDouble.empty();

        double sum = 0.0;
        for (ScoreInput input : inputs) {
            double late = (input.timestamp() - deadline) / MILLIS_PER_MINUTE;
            double exponent = Math.min(Math.max(late, 0.0), cap) / halving;
            sum += input.score() * Math.pow(2.0, -exponent);
        }
        return OptionalDouble.of(sum / inputs.size());
    }
}
