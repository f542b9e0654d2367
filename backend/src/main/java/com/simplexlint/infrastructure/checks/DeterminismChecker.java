package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintCode;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.ParsedSpec;
import com.simplexlint.infrastructure.checks.FieldScanner.Field;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * DETERMINISM level: E070 when {@code level} is missing or not strict/structural/semantic.
 *
 * seed, vary and stable are recognised but carry no rule of their own.
 */
@Slf4j
@Component
public class DeterminismChecker implements SpecChecker {

    private static final String LEVEL = "level";

    private static final Set<String> FIELDS = Set.of(LEVEL, "seed", "vary", "stable");
    private static final Set<String> LEVELS = Set.of("strict", "structural", "semantic");

    @Override
    public void check(ParsedSpec spec, LintResult result) {
        for (FunctionBlock fn : spec.functions()) {
            if (fn.hasDeterminism()) {
                checkLevel(fn, result);
            }
        }
    }

    private void checkLevel(FunctionBlock fn, LintResult result) {
        Map<String, Field> fields = FieldScanner.scan(fn.determinism(), FIELDS);
        String location = fn.location() + " DETERMINISM";
        String level = FieldScanner.valueOf(fields, LEVEL);

        if (level.isEmpty()) {
            result.addError(LintCode.DETERMINISM_INVALID_LEVEL,
                    "DETERMINISM requires level field (strict, structural, or semantic)", location);
        } else if (!LEVELS.contains(level)) {
            result.addError(LintCode.DETERMINISM_INVALID_LEVEL,
                    "DETERMINISM level must be strict, structural, or semantic, got: " + level, location);
        }

        log.debug("{} DETERMINISM fields: {}", location, fields.keySet());
    }
}
