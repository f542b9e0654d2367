package com.simplexlint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SimplexLintApplicationTest {

    @Test
    void leading_lint_argument_selects_the_command_line() {
        assertThat(SimplexLintApplication.isCliInvocation(new String[]{"lint", "spec.md"})).isTrue();
        assertThat(SimplexLintApplication.cliArguments(new String[]{"lint", "--format", "json", "spec.md"}))
                .containsExactly("--format", "json", "spec.md");
    }

    @Test
    void lint_alone_reads_stdin() {
        assertThat(SimplexLintApplication.isCliInvocation(new String[]{"lint"})).isTrue();
        assertThat(SimplexLintApplication.cliArguments(new String[]{"lint"})).isEmpty();
    }

    @Test
    void other_arguments_start_the_server() {
        assertThat(SimplexLintApplication.isCliInvocation(new String[0])).isFalse();
        assertThat(SimplexLintApplication.isCliInvocation(new String[]{"--server.port=9090"})).isFalse();
        assertThat(SimplexLintApplication.isCliInvocation(new String[]{"spec.md", "lint"})).isFalse();
    }
}
