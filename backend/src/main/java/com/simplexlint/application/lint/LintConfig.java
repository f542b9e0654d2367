package com.simplexlint.application.lint;

import com.simplexlint.infrastructure.checks.ComplexityConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LintConfig {

    @Value("${lint.complexity.max-rules:15}")
    private int maxRules;

    @Value("${lint.complexity.max-inputs:6}")
    private int maxInputs;

    @Value("${lint.complexity.max-rule-length:200}")
    private int maxRuleLength;

    @Value("${lint.complexity.max-functions:10}")
    private int maxFunctions;

    @Bean
    public ComplexityConfig complexityConfig() {
        return new ComplexityConfig(maxRules, maxInputs, maxRuleLength, maxFunctions);
    }
}
