package com.questrail.gs1.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ParseResult
 * -----------------------------------------------------------------------------
 * Outcome of decoding one element string.
 *
 * <p>Whatever engine ran, callers receive this single shape: the chosen
 * element sequence, coded diagnostics, a bounded list of alternatives and an
 * overall confidence in [0,1]. A result with no elements and confidence 0 is
 * the "no valid parse" outcome; it is never signalled by an exception.</p>
 */
public record ParseResult(
    String input,
    String normalizedInput,
    Symbology symbology,
    boolean separatorsPresent,
    ParseStrategy strategy,
    List<ParsedElement> elements,
    List<Diagnostic> diagnostics,
    List<Alternative> alternatives,
    double confidence
) {
    public ParseResult {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(normalizedInput, "normalizedInput");
        Objects.requireNonNull(symbology, "symbology");
        Objects.requireNonNull(strategy, "strategy");
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        alternatives = List.copyOf(Objects.requireNonNull(alternatives, "alternatives"));
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
    }

    /**
     * Returns the first element with the given AI code.
     */
    public Optional<ParsedElement> element(String ai) {
        return elements.stream().filter(e -> e.ai().equals(ai)).findFirst();
    }

    public boolean hasDiagnostic(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    public List<String> aiOrder() {
        return elements.stream().map(ParsedElement::ai).toList();
    }

    public boolean empty() {
        return elements.isEmpty();
    }

    /**
     * Returns true when every element is valid.
     */
    public boolean allValid() {
        return elements.stream().allMatch(ParsedElement::valid);
    }

    /**
     * Returns true when the element spans are contiguous and, together with
     * the separators between them, cover the whole normalized input.
     */
    public boolean coversInput(char separator) {
        int pos = 0;
        for (ParsedElement e : elements) {
            while (pos < e.start() && normalizedInput.charAt(pos) == separator) {
                pos++;
            }
            if (e.start() != pos) {
                return false;
            }
            pos = e.end();
        }
        while (pos < normalizedInput.length() && normalizedInput.charAt(pos) == separator) {
            pos++;
        }
        return pos == normalizedInput.length();
    }
}
