package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintCode;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.ParsedSpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Complexity limits:
 *   W011 too many FUNCTION blocks in one spec
 *   E010 too many RULES items
 *   E011 too many inputs
 *   W010 a single RULES item is too long
 *   E012 fewer EXAMPLES than heuristic branches
 */
@Getter
@Component
@RequiredArgsConstructor
public class ComplexityChecker implements SpecChecker {

    static final String SPLIT_RULE_SUGGESTION = "Consider breaking this rule into multiple simpler rules";

    private final ComplexityConfig config;

    @Override
    public void check(ParsedSpec spec, LintResult result) {
        checkFunctionCount(spec, result);

        for (FunctionBlock fn : spec.functions()) {
            checkRuleCount(fn, result);
            checkInputCount(fn, result);
            checkRuleLength(fn, result);
            checkExampleCoverage(fn, result);
        }
    }

    private void checkFunctionCount(ParsedSpec spec, LintResult result) {
        int count = spec.functions().size();
        if (count > config.maxFunctions()) {
            result.addWarning(LintCode.TOO_MANY_FUNCTIONS,
                    String.format("Spec has %d FUNCTION blocks (consider splitting into multiple specs, max recommended: %d)",
                            count, config.maxFunctions()),
                    "spec");
        }
    }

    private void checkRuleCount(FunctionBlock fn, LintResult result) {
        String rules = fn.rules();
        if (rules.isEmpty()) {
            return;
        }

        int count = RulesHeuristics.countRuleItems(rules);
        if (count > config.maxRules()) {
            result.addError(LintCode.TOO_MANY_RULES,
                    String.format("RULES block has %d items (max %d)", count, config.maxRules()),
                    fn.location());
        }
    }

    private void checkInputCount(FunctionBlock fn, LintResult result) {
        int count = fn.inputs().size();
        if (count > config.maxInputs()) {
            result.addError(LintCode.TOO_MANY_INPUTS,
                    String.format("FUNCTION has %d inputs (max %d)", count, config.maxInputs()),
                    fn.location());
        }
    }

    private void checkRuleLength(FunctionBlock fn, LintResult result) {
        List<String> items = RulesHeuristics.extractRuleItems(fn.rules());

        for (int i = 0; i < items.size(); i++) {
            String item = items.get(i);
            int length = item.codePointCount(0, item.length());
            if (length > config.maxRuleLength()) {
                result.addWarning(LintCode.RULE_TOO_LONG,
                        String.format("RULES item %d exceeds %d characters (%d chars)",
                                i + 1, config.maxRuleLength(), length),
                        fn.location(),
                        SPLIT_RULE_SUGGESTION,
                        false);
            }
        }
    }

    // Missing RULES or EXAMPLES is already a structural error
    private void checkExampleCoverage(FunctionBlock fn, LintResult result) {
        String rules = fn.rules();
        String examples = fn.examples();
        if (rules.isEmpty() || examples.isEmpty()) {
            return;
        }

        int branches = RulesHeuristics.countBranches(rules);
        int exampleCount = RulesHeuristics.countExamples(examples);
        if (exampleCount < branches) {
            result.addError(LintCode.INSUFFICIENT_EXAMPLES,
                    String.format("EXAMPLES has %d items but RULES has %d branches (examples should cover all branches)",
                            exampleCount, branches),
                    fn.location());
        }
    }
}
