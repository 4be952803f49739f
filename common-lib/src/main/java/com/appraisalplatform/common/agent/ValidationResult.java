package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.message.AgentRequest;

import java.util.List;

/**
 * Outcome of input validation. {@code validatedData}, when present, replaces the
 * original request for processing (normalized or defaulted input).
 */
public record ValidationResult(boolean valid, List<ValidationIssue> issues, AgentRequest validatedData) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), null);
    }

    public static ValidationResult ok(AgentRequest validatedData) {
        return new ValidationResult(true, List.of(), validatedData);
    }

    public static ValidationResult invalid(List<ValidationIssue> issues) {
        return new ValidationResult(false, issues, null);
    }

    public static ValidationResult invalid(ValidationIssue issue) {
        return invalid(List.of(issue));
    }
}
