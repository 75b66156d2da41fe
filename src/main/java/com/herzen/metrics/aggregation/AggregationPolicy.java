package com.herzen.metrics.aggregation;

import java.util.Locale;

/**
 * Policy choices the aggregator exposes as configuration.
 *
 * @param missingTagWeight weight of an input whose tag has no entry in the metric's tag weights
 * @param absentInputs     whether Absent inputs are left out of the mean or counted as zero
 */
public record AggregationPolicy(double missingTagWeight, AbsentInputs absentInputs) {

    public static final AggregationPolicy DEFAULT = new AggregationPolicy(0.0, AbsentInputs.EXCLUDE);

    public AggregationPolicy {
        if (missingTagWeight < 0 || Double.isNaN(missingTagWeight)) {
            throw new IllegalArgumentException("missingTagWeight must be non-negative");
        }
        absentInputs = absentInputs == null ? AbsentInputs.EXCLUDE : absentInputs;
    }

    public enum AbsentInputs {
        EXCLUDE, ZERO;

        public static AbsentInputs fromValue(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
