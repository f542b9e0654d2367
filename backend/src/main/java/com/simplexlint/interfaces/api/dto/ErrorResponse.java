package com.simplexlint.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
