package com.questrail.gs1.api;

import java.util.Objects;

/**
 * A coded problem found while decoding.
 *
 * @param code     diagnostic code
 * @param severity ERROR or WARNING
 * @param message  human-readable description
 * @param position offset in the normalized input, or {@code -1} if not tied
 *                 to a position
 * @param aiCode   AI the diagnostic refers to, or {@code null}
 */
public record Diagnostic(
    DiagnosticCode code,
    Severity severity,
    String message,
    int position,
    String aiCode
) {
    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        if (position < -1) {
            throw new IllegalArgumentException("position must be >= -1");
        }
    }

    public static Diagnostic error(DiagnosticCode code, String message, int position, String aiCode) {
        return new Diagnostic(code, Severity.ERROR, message, position, aiCode);
    }

    public static Diagnostic warning(DiagnosticCode code, String message, int position, String aiCode) {
        return new Diagnostic(code, Severity.WARNING, message, position, aiCode);
    }

    /**
     * The hard-failure diagnostic used when nothing could be decoded.
     */
    public static Diagnostic noValidParse() {
        return error(DiagnosticCode.INVALID_FORMAT, "No valid parse found", -1, null);
    }
}
