package com.herzen.metrics.rule;

import java.util.List;

final class RuleParameters {

    private RuleParameters() {}

    static double number(List<String> params, int index, String name, double fallback) {
        if (index >= params.size() || params.get(index) == null || params.get(index).isBlank()) return fallback;
        String raw = params.get(index).trim();
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value)) throw new IllegalArgumentException(name + " must be a number");
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + raw + "'");
        }
    }

    static double requiredNumber(List<String> params, int index, String name) {
        double value = number(params, index, name, Double.NaN);
        if (Double.isNaN(value)) throw new IllegalArgumentException(name + " is required");
        return value;
    }

    static void maxArity(List<String> params, int max, String rule) {
        if (params.size() > max) {
            throw new IllegalArgumentException(rule + " takes at most " + max + " parameter(s), got " + params.size());
        }
    }
}
