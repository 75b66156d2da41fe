package com.herzen.metrics.validation;

import com.herzen.metrics.error.ErrorKind;

import java.util.List;

public class ValidationModels {
    public record ValidationIssue(ErrorKind kind, String message, List<String> refs) {
        public ValidationIssue {
            refs = refs == null ? List.of() : List.copyOf(refs);
        }
    }
}
