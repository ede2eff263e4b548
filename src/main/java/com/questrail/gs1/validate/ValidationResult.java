package com.questrail.gs1.validate;

import com.questrail.gs1.api.DiagnosticCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a validator: validity, coded issues and decoded metadata.
 *
 * <p>A result is valid exactly when it carries no issues.</p>
 */
public record ValidationResult(List<ValidationIssue> issues, Map<String, Object> metadata)
{
    public ValidationResult {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata")));
    }

    public static ValidationResult ok(Map<String, Object> metadata) {
        return new ValidationResult(List.of(), metadata);
    }

    public static ValidationResult failure(DiagnosticCode code, String message) {
        return new ValidationResult(List.of(new ValidationIssue(code, message)), Map.of());
    }

    public static ValidationResult failure(DiagnosticCode code, String message, Map<String, Object> metadata) {
        return new ValidationResult(List.of(new ValidationIssue(code, message)), metadata);
    }

    public boolean valid() {
        return issues.isEmpty();
    }

    /** Issue messages in order. */
    public List<String> errors() {
        List<String> out = new ArrayList<>(issues.size());
        for (ValidationIssue issue : issues) {
            out.add(issue.message());
        }
        return out;
    }
}
