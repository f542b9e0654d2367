package com.simplexlint.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;

public record LintRequest(
        @NotEmpty(message = "spec field is required")
        String spec
) {}
