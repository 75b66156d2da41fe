package com.herzen.metrics.error;

public class UnknownRuleException extends MetricEngineException {
    public UnknownRuleException(String ruleName) {
        super(ErrorKind.UNKNOWN_RULE, "Scoring rule is not registered: " + ruleName);
    }
}
