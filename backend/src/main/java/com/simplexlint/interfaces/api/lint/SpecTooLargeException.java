package com.simplexlint.interfaces.api.lint;

public class SpecTooLargeException extends RuntimeException {

    public SpecTooLargeException(String message) {
        super(message);
    }
}
