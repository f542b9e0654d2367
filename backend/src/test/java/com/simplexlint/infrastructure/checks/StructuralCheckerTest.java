package com.simplexlint.infrastructure.checks;

import com.simplexlint.domain.lint.model.LintError;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.infrastructure.parser.SoftParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralCheckerTest {

    private SoftParser parser;
    private StructuralChecker checker;

    @BeforeEach
    void setUp() {
        parser = SoftParser.create();
        checker = new StructuralChecker();
    }

    private LintResult check(String text) {
        LintResult result = new LintResult("test.md");
        checker.check(parser.parse(text), result);
        return result;
    }

    @Nested
    @DisplayName("E001: no FUNCTION")
    class NoFunction {

        @Test
        void data_only_spec_yields_only_E001() {
            LintResult result = check("DATA: Foo\n  field: string");

            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrors()).extracting(LintError::code).containsExactly("E001");
            assertThat(result.getErrors().get(0).location()).isEqualTo("spec");
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void empty_spec_yields_E001() {
            assertThat(check("").getErrors()).extracting(LintError::code).containsExactly("E001");
        }
    }

    @Nested
    @DisplayName("E002-E005: required landmarks")
    class RequiredLandmarks {

        @Test
        void bare_function_misses_all_four() {
            LintResult result = check("FUNCTION: f(x) → result");

            assertThat(result.getErrors()).extracting(LintError::code)
                    .containsExactly("E002", "E003", "E004", "E005");
            assertThat(result.getErrors()).allMatch(e -> e.location().equals("FUNCTION f"));
        }

        @Test
        void missing_errors_carries_fixable_suggestion() {
            LintResult result = check("""
                    FUNCTION: f(x) → result
                    RULES:
                      - r
                    DONE_WHEN:
                      - d
                    EXAMPLES:
                      (1) → 1
                    """);

            assertThat(result.getErrors()).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo("E005");
                assertThat(e.fixable()).isTrue();
                assertThat(e.suggestion()).contains("ERRORS:");
            });
        }

        @Test
        void checks_every_function_in_order() {
            LintResult result = check("""
                    FUNCTION: first() → x
                    RULES:
                      - r
                    DONE_WHEN:
                      - d
                    EXAMPLES:
                      () → x
                    ERRORS:
                      - fail
                    FUNCTION: second() → x
                    RULES:
                      - r
                    """);

            assertThat(result.getErrors()).extracting(LintError::code).containsExactly("E003", "E004", "E005");
            assertThat(result.getErrors()).allMatch(e -> e.location().equals("FUNCTION second"));
        }

        @Test
        void unnamed_function_location() {
            LintResult result = check("FUNCTION:\nRULES:\n  - r");

            assertThat(result.getErrors()).extracting(LintError::location).contains("FUNCTION (unnamed)");
        }
    }

    @Nested
    @DisplayName("E006: return type references")
    class ReturnTypes {

        private static final String BODY = """
                RULES:
                  - r
                DONE_WHEN:
                  - d
                EXAMPLES:
                  () → x
                ERRORS:
                  - fail
                """;

        @Test
        void undefined_type_warns_when_data_blocks_exist() {
            LintResult result = check("DATA: Policy\n  id: string\nFUNCTION: load() → Report\n" + BODY);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).singleElement().satisfies(w -> {
                assertThat(w.code()).isEqualTo("E006");
                assertThat(w.message()).contains("'Report'");
                assertThat(w.location()).isEqualTo("FUNCTION load");
            });
        }

        @Test
        void defined_type_matches_after_normalization() {
            LintResult result = check("DATA: Policy_Rule\n  id: string\nFUNCTION: load() → list of policy rule\n" + BODY);

            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void builtin_types_are_accepted() {
            LintResult result = check("DATA: Policy\n  id: string\nFUNCTION: count() → Integer\n" + BODY);

            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void skipped_without_data_blocks() {
            LintResult result = check("FUNCTION: load() → Report\n" + BODY);

            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getErrors()).isEmpty();
        }

        @Test
        void empty_return_type_is_tolerated() {
            LintResult result = check("DATA: Policy\n  id: string\nFUNCTION: not a signature\n" + BODY);

            assertThat(result.getWarnings()).isEmpty();
        }
    }

    @Test
    @DisplayName("type name normalization strips case, separators and collection prefixes")
    void normalize() {
        assertThat(TypeNames.normalize("List of Policy_Rule")).isEqualTo("policyrule");
        assertThat(TypeNames.normalize("set of Tag")).isEqualTo("tag");
        assertThat(TypeNames.normalize("ArrayOf")).isEqualTo("arrayof");
        assertThat(TypeNames.dataTypeName("Policy\n  id: string")).isEqualTo("Policy");
        assertThat(TypeNames.dataTypeName("Tag")).isEqualTo("Tag");
    }
}
