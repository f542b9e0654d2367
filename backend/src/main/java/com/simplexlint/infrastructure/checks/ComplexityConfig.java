package com.simplexlint.infrastructure.checks;

/**
 * Thresholds for {@link ComplexityChecker}.
 *
 * @param maxRules      RULES items allowed per function
 * @param maxInputs     inputs allowed per function signature
 * @param maxRuleLength characters allowed in one RULES item
 * @param maxFunctions  FUNCTION blocks per spec before a split is suggested
 */
public record ComplexityConfig(
        int maxRules,
        int maxInputs,
        int maxRuleLength,
        int maxFunctions
) {
    public static final int DEFAULT_MAX_RULES = 15;
    public static final int DEFAULT_MAX_INPUTS = 6;
    public static final int DEFAULT_MAX_RULE_LENGTH = 200;
    public static final int DEFAULT_MAX_FUNCTIONS = 10;

    public static ComplexityConfig defaults() {
        return new ComplexityConfig(DEFAULT_MAX_RULES, DEFAULT_MAX_INPUTS,
                DEFAULT_MAX_RULE_LENGTH, DEFAULT_MAX_FUNCTIONS);
    }

    /**
     * Overrides apply only when positive; null or non-positive keeps the current value.
     */
    public ComplexityConfig withOverrides(Integer rules, Integer inputs) {
        return new ComplexityConfig(
                rules != null && rules > 0 ? rules : maxRules,
                inputs != null && inputs > 0 ? inputs : maxInputs,
                maxRuleLength,
                maxFunctions
        );
    }
}
