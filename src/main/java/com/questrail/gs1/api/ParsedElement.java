package com.questrail.gs1.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One decoded AI field.
 *
 * <p>The span {@code [start, end)} covers the AI digits and the value in the
 * normalized input. Separators are never part of a span.</p>
 *
 * @param ai         AI code
 * @param title      data title from the catalog
 * @param raw        value exactly as it appeared in the input
 * @param value      normalized value (ISO date, plain decimal, or raw)
 * @param valid      whether every validator accepted the value
 * @param issues     coded validator findings, empty when valid
 * @param metadata   decoded details keyed by {@code MetaKeys} names
 * @param start      span start in the normalized input
 * @param end        span end (exclusive)
 */
public record ParsedElement(
    String ai,
    String title,
    String raw,
    String value,
    boolean valid,
    List<Diagnostic> issues,
    Map<String, Object> metadata,
    int start,
    int end
) {
    public ParsedElement {
        Objects.requireNonNull(ai, "ai");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(value, "value");
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata")));
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /** Validator messages, in the order the checks ran. */
    public List<String> errors() {
        return issues.stream().map(Diagnostic::message).toList();
    }

    public int length() {
        return end - start;
    }

    public Optional<Object> meta(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /**
     * Returns true for {@code YYMMD0} dates whose day was given as {@code 00}.
     */
    public boolean isDayUnspecified() {
        return Boolean.TRUE.equals(metadata.get("dayUnspecified"));
    }

    @Override
    public String toString() {
        return "(" + ai + ")" + raw + (valid ? "" : " !" + errors());
    }
}
