package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintCode;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.ParsedSpec;
import com.simplexlint.infrastructure.checks.FieldScanner.Field;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * BASELINE / EVAL consistency for evolving functions.
 *
 * pass^k: all k trials must pass (preserve). pass@k: at least one of k trials must pass (evolve).
 */
@Component
public class EvolutionChecker implements SpecChecker {

    static final String EVAL_SUGGESTION =
            "Add EVAL: block with preserve and evolve thresholds (e.g., preserve: pass^3, evolve: pass@5)";

    private static final String REFERENCE = "reference";
    private static final String PRESERVE = "preserve";
    private static final String EVOLVE = "evolve";
    private static final String GRADING = "grading";

    private static final Set<String> BASELINE_FIELDS = Set.of(REFERENCE, PRESERVE, EVOLVE);
    private static final Set<String> EVAL_FIELDS = Set.of(PRESERVE, EVOLVE, GRADING);
    private static final Set<String> GRADING_TYPES = Set.of("code", "model", "outcome");

    private static final Pattern PRESERVE_THRESHOLD = Pattern.compile("^pass\\^\\d+$");
    private static final Pattern EVOLVE_THRESHOLD = Pattern.compile("^pass@\\d+$");

    @Override
    public void check(ParsedSpec spec, LintResult result) {
        for (FunctionBlock fn : spec.functions()) {
            if (fn.hasBaseline() && !fn.hasEval()) {
                result.addError(LintCode.EVAL_REQUIRED, "EVAL required when BASELINE present",
                        fn.location(), EVAL_SUGGESTION, true);
            }
            if (fn.hasBaseline()) {
                checkBaseline(fn, result);
            }
            if (fn.hasEval()) {
                checkEval(fn, result);
            }
        }
    }

    private void checkBaseline(FunctionBlock fn, LintResult result) {
        Map<String, Field> fields = FieldScanner.scan(fn.baseline(), BASELINE_FIELDS);
        String location = fn.location() + " BASELINE";

        if (!fields.containsKey(REFERENCE)) {
            result.addError(LintCode.BASELINE_MISSING_REFERENCE, "BASELINE requires reference field", location);
        }

        Field preserve = fields.get(PRESERVE);
        if (preserve == null) {
            result.addError(LintCode.BASELINE_MISSING_PRESERVE, "BASELINE requires preserve field", location);
        } else if (preserve.items().isEmpty()) {
            result.addError(LintCode.BASELINE_EMPTY_PRESERVE, "BASELINE preserve must contain at least one item", location);
        }

        Field evolve = fields.get(EVOLVE);
        if (evolve == null) {
            result.addError(LintCode.BASELINE_MISSING_EVOLVE, "BASELINE requires evolve field", location);
        } else if (evolve.items().isEmpty()) {
            result.addError(LintCode.BASELINE_EMPTY_EVOLVE, "BASELINE evolve must contain at least one item", location);
        }
    }

    private void checkEval(FunctionBlock fn, LintResult result) {
        Map<String, Field> fields = FieldScanner.scan(fn.eval(), EVAL_FIELDS);
        String location = fn.location() + " EVAL";

        String preserve = FieldScanner.valueOf(fields, PRESERVE);
        String evolve = FieldScanner.valueOf(fields, EVOLVE);
        String grading = FieldScanner.valueOf(fields, GRADING);

        if (fn.hasBaseline()) {
            if (preserve.isEmpty()) {
                result.addError(LintCode.EVAL_MISSING_PRESERVE,
                        "EVAL requires preserve threshold when BASELINE present", location);
            }
            if (evolve.isEmpty()) {
                result.addError(LintCode.EVAL_MISSING_EVOLVE,
                        "EVAL requires evolve threshold when BASELINE present", location);
            }
        }

        if (!preserve.isEmpty() && !PRESERVE_THRESHOLD.matcher(preserve).matches()) {
            result.addError(LintCode.EVAL_INVALID_PRESERVE,
                    "preserve threshold must use pass^k notation, got: " + preserve, location);
        }
        if (!evolve.isEmpty() && !EVOLVE_THRESHOLD.matcher(evolve).matches()) {
            result.addError(LintCode.EVAL_INVALID_EVOLVE,
                    "evolve threshold must use pass@k notation, got: " + evolve, location);
        }
        if (!grading.isEmpty() && !GRADING_TYPES.contains(grading)) {
            result.addError(LintCode.EVAL_INVALID_GRADING,
                    "grading must be code, model, or outcome, got: " + grading, location);
        }
    }
}
