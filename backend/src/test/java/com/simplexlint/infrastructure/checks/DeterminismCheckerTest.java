package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintError;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.infrastructure.parser.SoftParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DeterminismCheckerTest {

    private static final String HEAD = """
            FUNCTION: roll(seed) → number
            RULES:
              - pick a number
            DONE_WHEN:
              - done
            EXAMPLES:
              (1) → 4
            ERRORS:
              - fail
            """;

    private SoftParser parser;
    private DeterminismChecker checker;

    @BeforeEach
    void setUp() {
        parser = SoftParser.create();
        checker = new DeterminismChecker();
    }

    private LintResult check(String text) {
        LintResult result = new LintResult("test.md");
        checker.check(parser.parse(text), result);
        return result;
    }

    @ParameterizedTest
    @ValueSource(strings = {"strict", "structural", "semantic"})
    void valid_levels_pass(String level) {
        LintResult result = check(HEAD + "DETERMINISM:\n  level: " + level + "\n");

        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void missing_level_emits_single_E070() {
        LintResult result = check(HEAD + "DETERMINISM:\n  seed: 42\n  vary:\n    - wording\n");

        assertThat(result.getErrors()).singleElement().satisfies(e -> {
            assertThat(e.code()).isEqualTo("E070");
            assertThat(e.message()).isEqualTo("DETERMINISM requires level field (strict, structural, or semantic)");
            assertThat(e.location()).isEqualTo("FUNCTION roll DETERMINISM");
        });
    }

    @Test
    void invalid_level_emits_single_E070_with_value() {
        LintResult result = check(HEAD + "DETERMINISM:\n  level: fuzzy\n");

        assertThat(result.getErrors()).extracting(LintError::code).containsExactly("E070");
        assertThat(result.getErrors().get(0).message()).endsWith("got: fuzzy");
    }

    @Test
    void seed_vary_and_stable_are_not_validated() {
        String determinism = """
                DETERMINISM:
                  level: structural
                  seed: not-a-number
                  vary:
                  stable:
                    - output shape
                """;

        assertThat(check(HEAD + determinism).getErrors()).isEmpty();
    }

    @Test
    void functions_without_determinism_are_skipped() {
        assertThat(check(HEAD).isValid()).isTrue();
    }
}
