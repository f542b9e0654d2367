package com.simplexlint.domain.lint.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single lint finding, error or warning.
 *
 * @param code       stable code, e.g. "E001"
 * @param message    human-readable description
 * @param location   "spec", "parse" or "FUNCTION name" with an optional block suffix
 * @param severity   ERROR or WARNING
 * @param suggestion how to fix it (nullable)
 * @param fixable    whether an automatic fix could resolve it
 */
@JsonPropertyOrder({"code", "message", "location", "severity", "suggestion", "fixable"})
public record LintError(
        String code,
        String message,
        String location,
        Severity severity,
        String suggestion,
        boolean fixable
) {
    public boolean hasSuggestion() {
        return suggestion != null;
    }
}
