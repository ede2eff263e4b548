package com.questrail.gs1.catalog;

import com.questrail.gs1.api.ApplicationIdentifier;

import java.util.Objects;

/**
 * A registered AI found at a position of the input.
 *
 * @param definition the matched definition
 * @param position   offset of the first AI digit
 */
public record AiMatch(ApplicationIdentifier definition, int position)
{
    public AiMatch {
        Objects.requireNonNull(definition, "definition");
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
    }

    public String code() {
        return definition.code();
    }

    /** Number of AI digits. */
    public int length() {
        return definition.code().length();
    }

    /** Offset of the first value character. */
    public int valueStart() {
        return position + length();
    }
}
