package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.spec.model.ParsedSpec;

/**
 * One family of deterministic checks over a parsed spec.
 *
 * Implementations:
 *   StructuralChecker: required landmarks, DATA references
 *   ComplexityChecker: rule/input/function limits, example coverage
 *   EvolutionChecker: BASELINE/EVAL pairing and field notation
 *   DeterminismChecker: DETERMINISM level
 *
 * Checkers hold only immutable configuration and never throw for malformed content;
 * every problem becomes a finding on the result.
 */
public interface SpecChecker {

    /**
     * Append findings for {@code spec} to {@code result}.
     */
    void check(ParsedSpec spec, LintResult result);
}
