package com.simplexlint.application.lint;

/**
 * A named specification text to lint.
 *
 * @param name    file path, "<stdin>" or "input"
 * @param content specification body
 */
public record SpecInput(String name, String content) {}
