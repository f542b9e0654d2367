package com.simplexlint.domain.spec.model;

import java.util.List;
import java.util.Optional;

/**
 * Structure extracted from one specification text. Immutable.
 *
 * @param functions     FUNCTION blocks in document order
 * @param dataBlocks    top-level DATA landmarks
 * @param constraints   top-level CONSTRAINT landmarks
 * @param rawText       the text that was parsed
 * @param parseWarnings non-fatal parse findings
 */
public record ParsedSpec(
        List<FunctionBlock> functions,
        List<Landmark> dataBlocks,
        List<Landmark> constraints,
        String rawText,
        List<String> parseWarnings
) {
    public ParsedSpec {
        functions = List.copyOf(functions);
        dataBlocks = List.copyOf(dataBlocks);
        constraints = List.copyOf(constraints);
        parseWarnings = List.copyOf(parseWarnings);
    }

    public static ParsedSpec empty(String rawText) {
        return new ParsedSpec(List.of(), List.of(), List.of(), rawText, List.of());
    }

    public boolean hasFunctions() {
        return !functions.isEmpty();
    }

    public Optional<FunctionBlock> functionByName(String name) {
        return functions.stream()
                .filter(fn -> fn.name().equals(name))
                .findFirst();
    }
}
