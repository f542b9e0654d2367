package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintCode;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.Landmark;
import com.simplexlint.domain.spec.model.LandmarkNames;
import com.simplexlint.domain.spec.model.ParsedSpec;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural completeness:
 *   E001 no FUNCTION at all (nothing else is checked)
 *   E002-E005 FUNCTION missing RULES / DONE_WHEN / EXAMPLES / ERRORS
 *   E006 (warning) return type matches neither a DATA type nor a builtin;
 *        skipped when the spec declares no DATA blocks
 */
@Component
public class StructuralChecker implements SpecChecker {

    static final String ERRORS_SUGGESTION =
            "Add ERRORS: block with at least: - any unhandled condition → fail with descriptive message";

    @Override
    public void check(ParsedSpec spec, LintResult result) {
        if (!spec.hasFunctions()) {
            result.addError(LintCode.NO_FUNCTION, "No FUNCTION block found", "spec");
            return;
        }

        for (FunctionBlock fn : spec.functions()) {
            checkRequiredLandmarks(fn, result);
        }

        if (!spec.dataBlocks().isEmpty()) {
            checkReturnTypes(spec, result);
        }
    }

    private void checkRequiredLandmarks(FunctionBlock fn, LintResult result) {
        String location = fn.location();

        if (!fn.hasLandmark(LandmarkNames.RULES)) {
            result.addError(LintCode.MISSING_RULES, "FUNCTION missing RULES landmark", location);
        }
        if (!fn.hasLandmark(LandmarkNames.DONE_WHEN)) {
            result.addError(LintCode.MISSING_DONE_WHEN, "FUNCTION missing DONE_WHEN landmark", location);
        }
        if (!fn.hasLandmark(LandmarkNames.EXAMPLES)) {
            result.addError(LintCode.MISSING_EXAMPLES, "FUNCTION missing EXAMPLES landmark", location);
        }
        if (!fn.hasLandmark(LandmarkNames.ERRORS)) {
            result.addError(LintCode.MISSING_ERRORS, "FUNCTION missing ERRORS landmark", location,
                    ERRORS_SUGGESTION, true);
        }
    }

    private void checkReturnTypes(ParsedSpec spec, LintResult result) {
        Set<String> definedTypes = new HashSet<>();
        for (Landmark data : spec.dataBlocks()) {
            String typeName = TypeNames.dataTypeName(data.content());
            if (!typeName.isEmpty()) {
                definedTypes.add(TypeNames.normalize(typeName));
            }
        }

        for (FunctionBlock fn : spec.functions()) {
            String returnType = fn.returnType();
            if (returnType.isEmpty()) {
                continue;
            }

            String normalized = TypeNames.normalize(returnType);
            if (TypeNames.isBuiltin(normalized) || definedTypes.contains(normalized)) {
                continue;
            }

            result.addWarning(LintCode.UNDEFINED_RETURN_TYPE,
                    String.format("Return type '%s' may reference undefined DATA type", returnType),
                    fn.location());
        }
    }
}
