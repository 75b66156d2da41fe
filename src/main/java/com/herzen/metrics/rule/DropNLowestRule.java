package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

@Component
public class DropNLowestRule implements ScoringRule {
    @Override
    public String name() {
        return "dropNLowest";
    }

    @Override
    public String description() {
        return "Mean after dropping the N lowest scores; with N or fewer scores, their maximum";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("N");
    }

    @Override
    public void checkParameters(List<String> params) {
        RuleParameters.maxArity(params, 1, name());
        double n = RuleParameters.requiredNumber(params, 0, "N");
        if (n < 0 || n != Math.floor(n) || Double.isInfinite(n)) {
            throw new IllegalArgumentException("N must be a non-negative integer");
        }
    }

    @Override
    public OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params) {
        if (inputs.isEmpty()) return OptionalDouble.empty();
        int n = (int) RuleParameters.requiredNumber(params, 0, "N");
        double[] sorted = inputs.stream().mapToDouble(ScoreInput::score).sorted().toArray();
        if (sorted.length <= n) return OptionalDouble.of(sorted[sorted.length - 1]);
        double sum = 0.0;
        for (int i = n; i < sorted.length; i++) sum += sorted[i];
        return OptionalDouble.of(sum / (sorted.length - n));
    }
}
