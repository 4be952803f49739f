package com.appraisalplatform.common.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One problem found by {@link Agent#validateInput}. {@code remediation} is an optional hint
 * for the caller.
 */
public record ValidationIssue(
    @JsonProperty("field")       String field,
    @JsonProperty("type")        String type,
    @JsonProperty("description") String description,
    @JsonProperty("severity")    IssueSeverity severity,
    @JsonProperty("remediation") String remediation
) {
    public ValidationIssue {
        Objects.requireNonNull(type, "type");
        severity = severity == null ? IssueSeverity.MEDIUM : severity;
    }

    public static ValidationIssue of(String field, String type, String description, IssueSeverity severity) {
        return new ValidationIssue(field, type, description, severity, null);
    }
}
