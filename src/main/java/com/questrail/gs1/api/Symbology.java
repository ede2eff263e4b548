package com.questrail.gs1.api;

import java.util.Optional;

/**
 * GS1 symbologies recognised by their ISO/IEC 15424 symbology identifier.
 */
public enum Symbology
{
    GS1_DATAMATRIX("]d2"),
    GS1_128("]C1"),
    GS1_DATABAR("]e0"),
    GS1_DATABAR_LIMITED("]e1"),
    GS1_DATABAR_EXPANDED("]e2"),
    GS1_QR_CODE("]Q3"),

    /** No symbology identifier was present. */
    NONE("");

    private final String prefix;

    Symbology(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Returns the symbology whose identifier starts {@code input}.
     */
    public static Optional<Symbology> detect(String input) {
        for (Symbology s : values()) {
            if (s != NONE && input.startsWith(s.prefix)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
