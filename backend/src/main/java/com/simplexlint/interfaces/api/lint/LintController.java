package com.simplexlint.interfaces.api.lint;

import com.simplexlint.application.lint.SpecLinter;
import com.simplexlint.domain.lint.model.LintResult;
import com.simplexlint.interfaces.api.dto.LintRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Body size is capped in bytes by {@link RequestSizeLimitFilter}.
 */
@RestController
@RequestMapping("/api/lint")
@RequiredArgsConstructor
public class LintController {

    private final SpecLinter specLinter;

    @PostMapping
    public ResponseEntity<LintResult> lint(@Valid @RequestBody LintRequest request) {
        return ResponseEntity.ok(specLinter.lint(request.spec()));
    }
}
