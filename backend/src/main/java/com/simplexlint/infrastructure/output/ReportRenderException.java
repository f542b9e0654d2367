package com.simplexlint.infrastructure.output;

public class ReportRenderException extends RuntimeException {

    public ReportRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
