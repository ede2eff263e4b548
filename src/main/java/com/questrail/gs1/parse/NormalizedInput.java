package com.questrail.gs1.parse;

import com.questrail.gs1.api.Symbology;

import java.util.Objects;

/**
 * Scanner output after symbology stripping and separator normalization.
 *
 * @param raw               input exactly as received
 * @param text              normalized text every engine works on
 * @param symbology         symbology named by the stripped identifier
 * @param separatorsPresent whether any separator stand-in occurred in the input
 */
public record NormalizedInput(String raw, String text, Symbology symbology, boolean separatorsPresent)
{
    public NormalizedInput {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(symbology, "symbology");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public int length() {
        return text.length();
    }
}
