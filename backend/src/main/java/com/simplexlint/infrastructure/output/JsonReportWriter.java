package com.simplexlint.infrastructure.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.simplexlint.domain.lint.model.LintReport;
import com.simplexlint.domain.lint.model.LintResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pretty-printed JSON for one result or a multi-file report.
 */
@Component
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    @Autowired
    public JsonReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public JsonReportWriter() {
        this(new ObjectMapper());
    }

    public String write(LintResult result) {
        return serialize(result, result.getFile());
    }

    public String write(LintReport report) {
        return serialize(report, report.totalFiles() + " files");
    }

    private String serialize(Object value, String label) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReportRenderException("Failed to serialize lint output for " + label, e);
        }
    }
}
