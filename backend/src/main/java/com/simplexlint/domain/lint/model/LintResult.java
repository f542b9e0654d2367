package com.simplexlint.domain.lint.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Findings for one input. Owned by a single lint invocation: checkers append to it
 * sequentially, then it is only read.
 *
 * Starts valid; the first error flips {@code valid} to false for good.
 */
@Getter
@JsonPropertyOrder({"file", "valid", "errors", "warnings", "stats"})
public class LintResult {

    private final String file;
    private boolean valid = true;
    private final List<LintError> errors = new ArrayList<>();
    private final List<LintError> warnings = new ArrayList<>();
    private LintStats stats = LintStats.EMPTY;

    public LintResult(String file) {
        this.file = file;
    }

    public void addError(LintCode code, String message, String location) {
        errors.add(new LintError(code.code(), message, location, Severity.ERROR, null, false));
        valid = false;
    }

    public void addError(LintCode code, String message, String location, String suggestion, boolean fixable) {
        errors.add(new LintError(code.code(), message, location, Severity.ERROR, suggestion, fixable));
        valid = false;
    }

    public void addWarning(LintCode code, String message, String location) {
        warnings.add(new LintError(code.code(), message, location, Severity.WARNING, null, false));
    }

    public void addWarning(LintCode code, String message, String location, String suggestion, boolean fixable) {
        warnings.add(new LintError(code.code(), message, location, Severity.WARNING, suggestion, fixable));
    }

    public List<LintError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<LintError> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void setStats(LintStats stats) {
        this.stats = stats;
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code))
                || warnings.stream().anyMatch(w -> w.code().equals(code));
    }
}
