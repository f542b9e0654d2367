package com.simplexlint.interfaces.cli;

public class SpecReadException extends RuntimeException {

    public SpecReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
