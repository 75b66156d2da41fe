package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

@Component
public class AverageRule implements ScoringRule {
    @Override
    public String name() {
        return "average";
    }

    @Override
    public String description() {
        return "Mean of the input scores";
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
        return inputs.stream().mapToDouble(ScoreInput::score).average();
    }
}
