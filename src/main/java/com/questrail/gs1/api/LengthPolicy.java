package com.questrail.gs1.api;

/**
 * Length rule for an Application Identifier's data field.
 *
 * <p>A <em>fixed</em> policy means the field length is predefined by the GS1
 * table of fixed-length element strings, so no separator ever follows it.
 * A variable policy may still have {@code min == max}; such fields are
 * separator-terminated all the same.</p>
 *
 * @param fixed whether the length is predefined
 * @param min   minimum data length (inclusive)
 * @param max   maximum data length (inclusive)
 */
public record LengthPolicy(boolean fixed, int min, int max)
{
    public LengthPolicy {
        if (min < 0) {
            throw new IllegalArgumentException("min must be non-negative");
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min");
        }
        if (fixed && min != max) {
            throw new IllegalArgumentException("fixed length requires min == max");
        }
    }

    public static LengthPolicy fixed(int length) {
        return new LengthPolicy(true, length, length);
    }

    public static LengthPolicy variable(int min, int max) {
        return new LengthPolicy(false, min, max);
    }

    /**
     * Returns true if {@code length} satisfies this policy.
     */
    public boolean accepts(int length) {
        return length >= min && length <= max;
    }

    @Override
    public String toString() {
        return fixed ? "fixed(" + max + ")" : "variable(" + min + ".." + max + ")";
    }
}
