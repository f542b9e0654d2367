package com.simplexlint.infrastructure.parser;

import java.util.List;

/**
 * Parsed FUNCTION signature line.
 */
public record Signature(
        String line,
        String name,
        List<String> inputs,
        String returnType
) {
    public Signature {
        inputs = List.copyOf(inputs);
    }

    /**
     * Fallback for a line that is not of the form {@code name(args) → type}.
     */
    public static Signature unparsed(String line) {
        return new Signature(line, line, List.of(), "");
    }
}
