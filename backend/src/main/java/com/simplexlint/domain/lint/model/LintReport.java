package com.simplexlint.domain.lint.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Aggregate of several per-file results.
 */
@JsonPropertyOrder({"results", "total_valid", "total_files"})
public record LintReport(
        List<LintResult> results,
        @JsonProperty("total_valid") int totalValid,
        @JsonProperty("total_files") int totalFiles
) {
    public static LintReport of(List<LintResult> results) {
        int valid = (int) results.stream().filter(LintResult::isValid).count();
        return new LintReport(List.copyOf(results), valid, results.size());
    }

    @JsonIgnore
    public boolean allValid() {
        return totalValid == totalFiles;
    }
}
