package com.herzen.metrics.validation;

import com.herzen.metrics.coverage.CoverageResolver;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.domain.MetricModels.MetricDefinition;
import com.herzen.metrics.error.*;
import com.herzen.metrics.rule.RuleEvaluator;
import com.herzen.metrics.validation.ValidationModels.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Checks a metric definition against the other definitions, the rule registry and the content catalog.
 * Submetric cycles are checked first so that a cycle is always reported as such.
 */
@Component
public class MetricDefinitionValidator {
    private final RuleEvaluator ruleEvaluator;
    private final CoverageResolver coverageResolver;

    public MetricDefinitionValidator(RuleEvaluator ruleEvaluator, CoverageResolver coverageResolver) {
        this.ruleEvaluator = ruleEvaluator;
        this.coverageResolver = coverageResolver;
    }

    /**
     * @param candidate the definition as it would be stored
     * @param others    every other stored definition; an entry with the candidate's id is ignored
     */
    public List<ValidationIssue> validate(MetricDefinition candidate, Collection<MetricDefinition> others) {
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, MetricDefinition> byId = new HashMap<>();
        others.forEach(d -> byId.put(d.id(), d));
        byId.put(candidate.id(), candidate);

        new MetricReferenceGraph(byId.values()).findCycle()
                .ifPresent(path -> issues.add(new ValidationIssue(ErrorKind.CYCLIC_METRIC_REFERENCE,
                        "Submetric references form a cycle", path)));

        if (candidate.name() == null || candidate.name().isBlank()) {
            issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION, "Metric name is required", List.of()));
        }
        if (candidate.level() == null) {
            issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION, "Metric level is required", List.of()));
            return issues;
        }

        Level inputLevel = candidate.level();
        if (candidate.hasSubmetric()) {
            MetricDefinition submetric = byId.get(candidate.submetricId());
            if (submetric == null) {
                issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION,
                        "Submetric does not exist: " + candidate.submetricId(), List.of(candidate.submetricId())));
            } else if (!submetric.level().isBelow(candidate.level())) {
                issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION,
                        "Submetric level " + submetric.level().value() + " is not below " + candidate.level().value(),
                        List.of(candidate.submetricId())));
            } else {
                inputLevel = submetric.level();
            }
        }

        if (!ruleEvaluator.isRegistered(candidate.rule().name())) {
            issues.add(new ValidationIssue(ErrorKind.UNKNOWN_RULE,
                    "Scoring rule is not registered: " + candidate.rule().name(), List.of(String.valueOf(candidate.rule().name()))));
        } else {
            try {
                ruleEvaluator.check(candidate.rule());
            } catch (IllegalArgumentException e) {
                issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION,
                        "Rule " + candidate.rule().name() + ": " + e.getMessage(), List.of(candidate.rule().name())));
            }
        }

        if (candidate.timeFilter().start() > candidate.timeFilter().end()) {
            issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION, "Time filter start is after its end", List.of()));
        }

        if (candidate.tagWeights() != null) {
            candidate.tagWeights().forEach((tag, weight) -> {
                if (weight == null || weight < 0 || !Double.isFinite(weight)) {
                    issues.add(new ValidationIssue(ErrorKind.INVALID_DEFINITION,
                            "Tag weight must be a non-negative number: " + tag, List.of(tag)));
                }
            });
        }

        try {
            coverageResolver.resolve(inputLevel, candidate.coverage());
        } catch (UnknownItemException e) {
            issues.add(new ValidationIssue(ErrorKind.UNKNOWN_ITEM, e.getMessage(), List.copyOf(e.itemIds())));
        }
        return issues;
    }

    /**
     * Throws the exception matching the first issue, carrying every issue found.
     */
    public void requireValid(MetricDefinition candidate, Collection<MetricDefinition> others) {
        List<ValidationIssue> issues = validate(candidate, others);
        if (issues.isEmpty()) return;
        throw toException(issues);
    }

    public static MetricEngineException toException(List<ValidationIssue> issues) {
        ValidationIssue first = issues.get(0);
        return switch (first.kind()) {
            case CYCLIC_METRIC_REFERENCE -> new CyclicMetricReferenceException(first.refs());
            case UNKNOWN_RULE -> new UnknownRuleException(first.refs().isEmpty() ? null : first.refs().get(0));
            case UNKNOWN_ITEM -> new UnknownItemException(first.message(), new TreeSet<>(first.refs()));
            default -> new InvalidMetricDefinitionException(first.message(), issues);
        };
    }
}
