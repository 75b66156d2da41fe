package com.herzen.metrics.rule;

import com.herzen.metrics.domain.ScoreModels.ScoreInput;

import java.util.List;
import java.util.OptionalDouble;

/**
 * A named way of turning the resolved inputs of one (learner, item) into a score.
 * An empty result means Absent; implementations never return NaN.
 */
public interface ScoringRule {

    String name();

    String description();

    List<String> parameterNames();

    /**
     * Rejects parameter lists this rule cannot evaluate with.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    void checkParameters(List<String> params);

    OptionalDouble evaluate(List<ScoreInput> inputs, List<String> params);
}
