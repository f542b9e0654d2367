package com.simplexlint.domain.lint.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Summary statistics for one linted spec.
 *
 * @param functions       number of FUNCTION blocks
 * @param branches        heuristic branch count summed over all functions
 * @param examples        example count summed over all functions
 * @param coveragePercent examples / branches * 100, capped at 100; zero when there are no branches
 */
@JsonPropertyOrder({"functions", "branches", "examples", "coverage_percent"})
public record LintStats(
        int functions,
        int branches,
        int examples,
        @JsonProperty("coverage_percent") double coveragePercent
) {
    public static final LintStats EMPTY = new LintStats(0, 0, 0, 0.0);

    public static LintStats of(int functions, int branches, int examples) {
        double coverage = 0.0;
        if (branches > 0) {
            coverage = Math.min(100.0, (double) examples / branches * 100);
        }
        return new LintStats(functions, branches, examples, coverage);
    }
}
