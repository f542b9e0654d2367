package com.simplexlint.infrastructure.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds landmark declarations: an upper-case name anchored at column zero, a colon,
 * then an optional remainder on the same line.
 *
 * Candidates that do not start a line (inside prose, indented list items, quoted
 * example strings) are never landmarks.
 */
@Component
public class LandmarkScanner {

    // Group 1: name, group 2: same-line remainder
    private static final Pattern LANDMARK = Pattern.compile(
            "^([A-Z][A-Z_]*):[ \\t]*(.*)$",
            Pattern.MULTILINE
    );

    /**
     * @param text raw specification text
     * @return declarations in document order, empty for null or blank input
     */
    public List<LandmarkMatch> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<LandmarkMatch> matches = new ArrayList<>();
        Matcher matcher = LANDMARK.matcher(text);
        int line = 1;
        int counted = 0;

        while (matcher.find()) {
            line += countLineBreaks(text, counted, matcher.start());
            counted = matcher.start();

            matches.add(new LandmarkMatch(
                    matcher.group(1),
                    matcher.group(2).strip(),
                    line,
                    matcher.start(),
                    matcher.end()
            ));
        }

        return matches;
    }

    private static int countLineBreaks(String text, int from, int to) {
        int breaks = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                breaks++;
            }
        }
        return breaks;
    }
}
