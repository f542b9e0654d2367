package com.simplexlint.application.lint;

import com.simplexlint.domain.lint.model.LintCode;
import com.simplexlint.domain.lint.model.LintReport;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.domain.lint.model.LintStats;
import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.ParsedSpec;
import com.simplexlint.infrastructure.checks.ComplexityChecker;
import com.simplexlint.infrastructure.checks.ComplexityConfig;
import com.simplexlint.infrastructure.checks.DeterminismChecker;
import com.simplexlint.infrastructure.checks.EvolutionChecker;
import com.simplexlint.infrastructure.checks.RulesHeuristics;
import com.simplexlint.infrastructure.checks.StructuralChecker;
import com.simplexlint.infrastructure.parser.SoftParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Lint pipeline: parse → structural → complexity → evolution → determinism → stats.
 *
 * Stateless apart from its collaborators' configuration; one {@link LintResult} per call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpecLinter {

    public static final String DEFAULT_INPUT_NAME = "input";

    private final SoftParser parser;
    private final StructuralChecker structuralChecker;
    private final ComplexityChecker complexityChecker;
    private final EvolutionChecker evolutionChecker;
    private final DeterminismChecker determinismChecker;

    /**
     * Builds a linter outside a Spring context.
     */
    public static SpecLinter create(ComplexityConfig complexityConfig) {
        return new SpecLinter(
                SoftParser.create(),
                new StructuralChecker(),
                new ComplexityChecker(complexityConfig),
                new EvolutionChecker(),
                new DeterminismChecker()
        );
    }

    public static SpecLinter createDefault() {
        return create(ComplexityConfig.defaults());
    }

    public LintResult lint(String text) {
        return lint(DEFAULT_INPUT_NAME, text);
    }

    public LintResult lint(String name, String text) {
        LintResult result = new LintResult(name);
        ParsedSpec spec = parser.parse(text);

        for (String warning : spec.parseWarnings()) {
            result.addWarning(LintCode.PARSE_WARNING, warning, "parse");
        }

        structuralChecker.check(spec, result);
        complexityChecker.check(spec, result);
        evolutionChecker.check(spec, result);
        determinismChecker.check(spec, result);

        result.setStats(computeStats(spec));

        log.debug("[SpecLinter] {}: {} ({} errors, {} warnings)",
                name, result.isValid() ? "VALID" : "INVALID",
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    public LintReport lintAll(List<SpecInput> inputs) {
        List<LintResult> results = new ArrayList<>(inputs.size());
        for (SpecInput input : inputs) {
            results.add(lint(input.name(), input.content()));
        }
        return LintReport.of(results);
    }

    private LintStats computeStats(ParsedSpec spec) {
        int examples = 0;
        int branches = 0;
        for (FunctionBlock fn : spec.functions()) {
            examples += RulesHeuristics.countExamples(fn.examples());
            branches += RulesHeuristics.countBranches(fn.rules());
        }
        return LintStats.of(spec.functions().size(), branches, examples);
    }
}
