package com.simplexlint.infrastructure.output;

import com.simplexlint.domain.lint.model.LintError;
import com.simplexlint.domain.lint.model.LintReport;
import com.simplexlint.domain.lint.model.LintResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain-text rendering. Deterministic: same result, same text.
 *
 * <pre>
 * simplex-lint: spec.md
 *
 * ERRORS:
 *   E005 [FUNCTION add] FUNCTION missing ERRORS landmark
 *        suggestion: Add ERRORS: block ...
 *
 * SUMMARY:
 *   1 error(s), 0 warning(s)
 *   Spec is INVALID
 * </pre>
 */
@Component
public class TextReportRenderer {

    private static final String FILE_SEPARATOR = "-".repeat(60);
    private static final String OVERALL_SEPARATOR = "=".repeat(60);

    public String render(LintResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("simplex-lint: ").append(result.getFile()).append("\n\n");

        appendSection(sb, "ERRORS:", result.getErrors());
        appendSection(sb, "WARNINGS:", result.getWarnings());

        sb.append("SUMMARY:\n");
        sb.append(String.format("  %d error(s), %d warning(s)\n",
                result.getErrors().size(), result.getWarnings().size()));
        sb.append("  Spec is ").append(result.isValid() ? "VALID" : "INVALID").append('\n');
        return sb.toString();
    }

    public String render(LintReport report) {
        StringBuilder sb = new StringBuilder();
        List<LintResult> results = report.results();

        for (int i = 0; i < results.size(); i++) {
            sb.append(render(results.get(i)));
            if (i < results.size() - 1) {
                sb.append('\n').append(FILE_SEPARATOR).append("\n\n");
            }
        }

        sb.append('\n').append(OVERALL_SEPARATOR).append('\n');
        sb.append("OVERALL:\n");
        sb.append(String.format("  %d/%d specs valid\n", report.totalValid(), report.totalFiles()));
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String heading, List<LintError> issues) {
        if (issues.isEmpty()) {
            return;
        }

        sb.append(heading).append('\n');
        for (LintError issue : issues) {
            sb.append("  ").append(issue.code())
                    .append(" [").append(issue.location()).append("] ")
                    .append(issue.message()).append('\n');
            if (issue.hasSuggestion()) {
                sb.append("       suggestion: ").append(issue.suggestion()).append('\n');
            }
        }
        sb.append('\n');
    }
}
