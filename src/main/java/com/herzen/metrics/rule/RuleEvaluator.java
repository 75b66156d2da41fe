package com.herzen.metrics.rule;

import com.herzen.metrics.domain.MetricModels.Rule;
import com.herzen.metrics.domain.ScoreModels.ScoreInput;
import com.herzen.metrics.error.UnknownRuleException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Registry of scoring rules. Rule names it does not know fail with {@link UnknownRuleException}.
 */
@Component
public class RuleEvaluator {
    private final Map<String, ScoringRule> rules = new TreeMap<>();

    public RuleEvaluator(List<ScoringRule> registered) {
        for (ScoringRule rule : registered) {
            ScoringRule previous = rules.put(rule.name(), rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scoring rule name: " + rule.name());
            }
        }
    }

    public OptionalDouble evaluate(Rule rule, List<ScoreInput> inputs) {
        OptionalDouble result = lookup(rule.name()).evaluate(inputs, rule.params());
        if (result.isPresent() && !Double.isFinite(result.getAsDouble())) return OptionalDouble.empty();
        return result;
    }

    /**
     * @throws UnknownRuleException     if the rule is not registered
     * @throws IllegalArgumentException if the parameters do not fit the rule
     */
    public void check(Rule rule) {
        lookup(rule.name()).checkParameters(rule.params());
    }

    public boolean isRegistered(String name) {
        return name != null && rules.containsKey(name);
    }

    public Collection<ScoringRule> catalog() {
        return rules.values();
    }

    private ScoringRule lookup(String name) {
        ScoringRule rule = name == null ? null : rules.get(name);
        if (rule == null) throw new UnknownRuleException(name);
        return rule;
    }
}
