package com.simplexlint.infrastructure.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counting heuristics over RULES and EXAMPLES content. All methods are pure.
 *
 * Branch counting is a keyword scan, not a parse of conditionals. It over-counts
 * when "if" appears inside quoted example text and under-counts rules that branch
 * without any of the recognised keywords.
 */
public final class RulesHeuristics {

    private static final Pattern EITHER_OR = Pattern.compile("\\beither\\b[^,\\n]*\\bor\\b");
    private static final Pattern IF_OR = Pattern.compile("\\bif\\b[^,\\n]*\\bor\\b");
    private static final Pattern IF_ELSE = Pattern.compile("\\bif\\b[^,\\n]*\\b(?:otherwise|else)\\b");
    private static final Pattern IF = Pattern.compile("\\bif\\b");
    private static final Pattern WHEN = Pattern.compile("\\bwhen\\b");
    private static final Pattern OPTIONALLY = Pattern.compile("\\boptionally\\b");

    private RulesHeuristics() {
    }

    /**
     * Rule items are {@code -} lines with the dash stripped. When there are none,
     * every non-blank line is an item.
     */
    public static List<String> extractRuleItems(String rules) {
        List<String> items = new ArrayList<>();
        if (rules == null || rules.isBlank()) {
            return items;
        }

        String[] lines = rules.split("\n");
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.startsWith("-")) {
                String item = trimmed.substring(1).strip();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }

        if (items.isEmpty()) {
            for (String line : lines) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
        }

        return items;
    }

    public static int countRuleItems(String rules) {
        return extractRuleItems(rules).size();
    }

    /**
     * An example is a line starting with {@code (} or containing an arrow ({@code →} or {@code ->}).
     */
    public static int countExamples(String examples) {
        if (examples == null || examples.isBlank()) {
            return 0;
        }

        int count = 0;
        for (String line : examples.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("(") || trimmed.contains("→") || trimmed.contains("->")) {
                count++;
            }
        }
        return count;
    }

    /**
     * Heuristic number of conditional paths in a RULES block (case-insensitive):
     * <ol>
     *   <li>"either … or …" counts 2; its line is then excluded from the if/when scan</li>
     *   <li>"if … or …" and "if … otherwise|else …" count 2, any other "if" counts 1</li>
     *   <li>"when" counts 1</li>
     *   <li>"optionally" counts 2, on any line</li>
     * </ol>
     * Non-blank rules with no keyword count as one branch.
     */
    public static int countBranches(String rules) {
        if (rules == null || rules.isBlank()) {
            return 0;
        }

        String content = rules.toLowerCase(Locale.ROOT);
        int count = 0;

        for (String line : content.split("\n")) {
            int either = countMatches(EITHER_OR, line);
            if (either > 0) {
                count += either * 2;
                continue;
            }

            int ifOr = countMatches(IF_OR, line);
            int ifElse = countMatches(IF_ELSE, line);
            int simpleIf = countMatches(IF, line) - ifOr - ifElse;

            count += ifOr * 2 + ifElse * 2 + Math.max(0, simpleIf);
            count += countMatches(WHEN, line);
        }

        count += countMatches(OPTIONALLY, content) * 2;

        return count == 0 ? 1 : count;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
