package com.simplexlint;

import com.simplexlint.interfaces.cli.LintCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * simplex-lint - HTTP front end for the Simplex specification linter.
 *
 * Started with a leading {@code lint} argument it runs the command-line linter instead
 * of the web server: {@code java -jar simplex-lint.jar lint spec.md}.
 */
@SpringBootApplication
public class SimplexLintApplication {

	static final String CLI_COMMAND = "lint";

	public static void main(String[] args) {
		if (isCliInvocation(args)) {
			System.exit(LintCommand.run(cliArguments(args)));
		}
		SpringApplication.run(SimplexLintApplication.class, args);
	}

	static boolean isCliInvocation(String[] args) {
		return args.length > 0 && CLI_COMMAND.equals(args[0]);
	}

	static String[] cliArguments(String[] args) {
		return Arrays.copyOfRange(args, 1, args.length);
	}

}
