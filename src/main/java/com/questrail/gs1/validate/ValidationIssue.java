package com.questrail.gs1.validate;

import com.questrail.gs1.api.DiagnosticCode;

import java.util.Objects;

/**
 * A single validator finding.
 */
public record ValidationIssue(DiagnosticCode code, String message)
{
    public ValidationIssue {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }
}
