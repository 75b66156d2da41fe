package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

@Component
public class DropLowestRule implements ScoringRule {
    @Override
    public String name() {
        return "dropLowest";
    }

    @Override
    public String description() {
        return "Mean after dropping the lowest score; a single score is used as is";
    }

    @Override
    public List<String> parameterNames() {
        return List.of();
    }

    @Override
    public void checkParameters(List<String> params) {
        RuleParameters.maxArity(params, 0, name());
    }

    @Override
    public OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params) {
        if (inputs.isEmpty()) return OptionalDouble.empty();
        if (inputs.size() == 1) return OptionalDouble.of(inputs.get(0).score());
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        for (ScoreInput input : inputs) {
            sum += input.score();
            min = Math.min(min, input.score());
        }
        return OptionalDouble.of((sum - min) / (inputs.size() - 1));
    }
}
