package com.simplexlint.interfaces.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.simplexlint.application.lint.SpecInput;
import com.simplexlint.application.lint.SpecLinter;
import com.simplexlint.domain.lint.model.LintReport;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.infrastructure.checks.ComplexityConfig;
import com.simplexlint.infrastructure.output.JsonReportWriter;
import com.simplexlint.infrastructure.output.TextReportRenderer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end.
 *
 * Exit codes:
 *   0 every spec is valid
 *   1 at least one spec is invalid
 *   2 an input could not be read, or the arguments were malformed
 */
@Slf4j
@Command(
        name = "simplex-lint",
        description = "Lint Simplex specification files for structure, complexity, evolution and determinism.",
        mixinStandardHelpOptions = true,
        version = "simplex-lint 0.1.0"
)
public class LintCommand implements Callable<Integer> {

    static final int EXIT_VALID = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_FAILURE = 2;

    static final String STDIN_NAME = "<stdin>";

    static final String BASE_LOGGER = "com.simplexlint";

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Spec files to lint; '-' or none reads standard input")
    private List<Path> files = new ArrayList<>();

    @Option(names = "--format", defaultValue = "TEXT", description = "Output format: ${COMPLETION-CANDIDATES}")
    private OutputFormat format;

    @Option(names = "--max-rules", description = "Override max RULES items (default ${DEFAULT-VALUE})",
            defaultValue = "" + ComplexityConfig.DEFAULT_MAX_RULES)
    private int maxRules;

    @Option(names = "--max-inputs", description = "Override max function inputs (default ${DEFAULT-VALUE})",
            defaultValue = "" + ComplexityConfig.DEFAULT_MAX_INPUTS)
    private int maxInputs;

    @Option(names = "--no-llm", description = "Skip semantic checks (offline mode)")
    private boolean noLlm;

    @Option(names = {"-v", "--verbose"}, description = "Log parse and check progress to stderr")
    private boolean verbose;

    private final InputStream stdin;

    public LintCommand() {
        this(System.in);
    }

    LintCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the command against the process streams and returns its exit code.
     */
    public static int run(String... args) {
        return newCommandLine(new LintCommand()).execute(args);
    }

    static CommandLine newCommandLine(LintCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (verbose) {
            enableDebugLogging();
        }

        List<SpecInput> inputs;
        try {
            inputs = readInputs();
        } catch (SpecReadException e) {
            log.error("[LintCommand] {}", e.getMessage(), e.getCause());
            err.println("simplex-lint: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }

        if (!noLlm) {
            log.debug("Semantic checks are not available; running deterministic checks only");
        }

        ComplexityConfig config = ComplexityConfig.defaults().withOverrides(maxRules, maxInputs);
        SpecLinter linter = SpecLinter.create(config);
        LintReport report = linter.lintAll(inputs);

        out.print(render(report));
        out.flush();

        return report.allValid() ? EXIT_VALID : EXIT_INVALID;
    }

    static void enableDebugLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger(BASE_LOGGER);
        logger.setLevel(Level.DEBUG);
    }

    private String render(LintReport report) {
        if (report.results().size() == 1) {
            LintResult single = report.results().get(0);
            return format == OutputFormat.JSON
                    ? new JsonReportWriter().write(single) + "\n"
                    : new TextReportRenderer().render(single);
        }
        return format == OutputFormat.JSON
                ? new JsonReportWriter().write(report) + "\n"
                : new TextReportRenderer().render(report);
    }

    private List<SpecInput> readInputs() {
        if (files.isEmpty() || (files.size() == 1 && "-".equals(files.get(0).toString()))) {
            return List.of(new SpecInput(STDIN_NAME, readStdin()));
        }

        List<SpecInput> inputs = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                inputs.add(new SpecInput(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new SpecReadException("failed to read " + file, e);
            }
        }
        return inputs;
    }

    private String readStdin() {
        try {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpecReadException("failed to read stdin", e);
        }
    }
}
