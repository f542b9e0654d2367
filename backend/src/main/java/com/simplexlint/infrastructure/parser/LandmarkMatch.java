package com.simplexlint.infrastructure.parser;

/**
 * A landmark declaration found by {@link LandmarkScanner}, before its content is sliced.
 *
 * @param name          landmark name
 * @param sameLine      trimmed text after the colon on the declaration line
 * @param lineNumber    1-based line of the declaration
 * @param startIndex    offset of the declaration's first character
 * @param endIndex      offset just past the declaration line (before its line break)
 */
public record LandmarkMatch(
        String name,
        String sameLine,
        int lineNumber,
        int startIndex,
        int endIndex
) {}
