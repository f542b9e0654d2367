package com.simplexlint.infrastructure.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code name(a, b) → type} signatures. Both the unicode arrow and {@code ->} are accepted.
 */
@Component
public class SignatureParser {

    private static final Pattern SIGNATURE = Pattern.compile(
            "^(\\w+)\\s*\\(([^)]*)\\)\\s*(?:→|->)\\s*(.+)$"
    );

    /**
     * Only the first line of the FUNCTION content is considered. A line that does not
     * match degrades to {@link Signature#unparsed(String)} rather than failing.
     */
    public Signature parse(String functionContent) {
        String line = firstLine(functionContent).strip();

        Matcher matcher = SIGNATURE.matcher(line);
        if (!matcher.matches()) {
            return Signature.unparsed(line);
        }

        return new Signature(
                line,
                matcher.group(1),
                splitInputs(matcher.group(2)),
                matcher.group(3).strip()
        );
    }

    private static String firstLine(String content) {
        if (content == null) {
            return "";
        }
        int newline = content.indexOf('\n');
        return newline >= 0 ? content.substring(0, newline) : content;
    }

    private static List<String> splitInputs(String args) {
        List<String> inputs = new ArrayList<>();
        for (String arg : args.split(",")) {
            String trimmed = arg.strip();
            if (!trimmed.isEmpty()) {
                inputs.add(trimmed);
            }
        }
        return inputs;
    }
}
