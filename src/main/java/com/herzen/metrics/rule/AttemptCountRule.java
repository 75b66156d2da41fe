package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Rewards the number of attempts up to a target. Meant for the pass-through multiples policy.
 */
@Component
public class AttemptCountRule implements ScoringRule {
    @Override
    public String name() {
        return "attemptCount";
    }

    @Override
    public String description() {
        return "min(100, 100 * attempts / target)";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("target");
    }

    @Override
    public void checkParameters(List<String> params) {
        RuleParameters.maxArity(params, 1, name());
        double target = RuleParameters.requiredNumber(params, 0, "target");
        if (target < 0) throw new IllegalArgumentException("target must be non-negative");
    }

    @Override
    public OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params) {
        double target = RuleParameters.requiredNumber(params, 0, "target");
        if (inputs.isEmpty() || target <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(Math.min(100.0, 100.0 * inputs.size() / target));
    }
}
