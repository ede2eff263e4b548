package com.questrail.gs1.api;

import java.util.List;
import java.util.Objects;

/**
 * One component of an Application Identifier's syntax specification, e.g.
 * {@code N13,csum,key} or {@code X..17}.
 *
 * @param type    character class of the component
 * @param min     minimum length
 * @param max     maximum length
 * @param linters linter names attached to the component (e.g. {@code csum},
 *                {@code yymmd0}), in declaration order
 */
public record SyntaxComponent(DataType type, int min, int max, List<String> linters)
{
    public SyntaxComponent {
        Objects.requireNonNull(type, "type");
        linters = List.copyOf(Objects.requireNonNull(linters, "linters"));
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid component length " + min + ".." + max);
        }
    }

    public boolean fixedSize() {
        return min == max;
    }

    public boolean hasLinter(String linter) {
        return linters.contains(linter);
    }
}
