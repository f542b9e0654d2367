package com.simplexlint.domain.spec.model;

import java.util.Set;

/**
 * Closed vocabulary of landmark names.
 *
 * BASELINE and EVAL belong to both sets: they are recognised at top level
 * and attach to the enclosing FUNCTION like any other nested landmark.
 */
public final class LandmarkNames {

    public static final String DATA = "DATA";
    public static final String CONSTRAINT = "CONSTRAINT";
    public static final String FUNCTION = "FUNCTION";
    public static final String BASELINE = "BASELINE";
    public static final String EVAL = "EVAL";

    public static final String RULES = "RULES";
    public static final String DONE_WHEN = "DONE_WHEN";
    public static final String EXAMPLES = "EXAMPLES";
    public static final String ERRORS = "ERRORS";
    public static final String READS = "READS";
    public static final String WRITES = "WRITES";
    public static final String TRIGGERS = "TRIGGERS";
    public static final String NOT_ALLOWED = "NOT_ALLOWED";
    public static final String HANDOFF = "HANDOFF";
    public static final String UNCERTAIN = "UNCERTAIN";
    public static final String DETERMINISM = "DETERMINISM";

    public static final Set<String> STRUCTURAL = Set.of(
            DATA, CONSTRAINT, FUNCTION, BASELINE, EVAL
    );

    public static final Set<String> FUNCTION_SCOPED = Set.of(
            RULES, DONE_WHEN, EXAMPLES, ERRORS, READS, WRITES, TRIGGERS,
            NOT_ALLOWED, HANDOFF, UNCERTAIN, DETERMINISM,
            BASELINE, EVAL
    );

    public static final Set<String> REQUIRED_IN_FUNCTION = Set.of(
            RULES, DONE_WHEN, EXAMPLES, ERRORS
    );

    private LandmarkNames() {
    }

    public static boolean isFunctionScoped(String name) {
        return FUNCTION_SCOPED.contains(name);
    }
}
