package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

@Component
public class BinaryProportionRule implements ScoringRule {
    private static final double DEFAULT_THRESHOLD = 50.0;

    @Override
    public String name() {
        return "binaryProportion";
    }

    @Override
    public String description() {
        return "Percentage of scores at or above the threshold (default 50)";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("threshold");
    }

    @Override
    public void checkParameters(List<String> params) {
        RuleParameters.maxArity(params, 1, name());
        RuleParameters.number(params, 0, "threshold", DEFAULT_THRESHOLD);
    }

    @Override
    public OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params) {
        double threshold = RuleParameters.number(params, 0, "threshold", DEFAULT_THRESHOLD);
        return inputs.stream().mapToDouble(i -> i.score() >= threshold ? 100.0 : 0.0).average();
    }
}
