package com.simplexlint.interfaces.cli;

public enum OutputFormat {
    TEXT,
    JSON
}
