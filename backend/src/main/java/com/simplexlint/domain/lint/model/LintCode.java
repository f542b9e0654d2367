package com.simplexlint.domain.lint.model;

/**
 * Stable catalogue of lint codes. Consumers key off {@link #code()}, so codes are never renumbered.
 */
public enum LintCode {

    // Structural
    NO_FUNCTION("E001"),
    MISSING_RULES("E002"),
    MISSING_DONE_WHEN("E003"),
    MISSING_EXAMPLES("E004"),
    MISSING_ERRORS("E005"),
    UNDEFINED_RETURN_TYPE("E006"),

    // Complexity
    TOO_MANY_RULES("E010"),
    TOO_MANY_INPUTS("E011"),
    INSUFFICIENT_EXAMPLES("E012"),

    // BASELINE
    BASELINE_MISSING_REFERENCE("E050"),
    BASELINE_MISSING_PRESERVE("E051"),
    BASELINE_MISSING_EVOLVE("E052"),
    BASELINE_EMPTY_PRESERVE("E053"),
    BASELINE_EMPTY_EVOLVE("E054"),

    // EVAL
    EVAL_REQUIRED("E060"),
    EVAL_MISSING_PRESERVE("E061"),
    EVAL_MISSING_EVOLVE("E062"),
    EVAL_INVALID_PRESERVE("E063"),
    EVAL_INVALID_EVOLVE("E064"),
    EVAL_INVALID_GRADING("E065"),

    // DETERMINISM
    DETERMINISM_INVALID_LEVEL("E070"),

    // Warnings
    PARSE_WARNING("W001"),
    RULE_TOO_LONG("W010"),
    TOO_MANY_FUNCTIONS("W011");

    private final String code;

    LintCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
