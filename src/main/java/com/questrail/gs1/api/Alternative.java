package com.questrail.gs1.api;

import java.util.List;
import java.util.Objects;

/**
 * A runner-up interpretation of the input.
 *
 * @param elements   element sequence of this interpretation
 * @param score      raw score (beam) or confidence product (solver)
 * @param confidence confidence relative to the chosen parse, in [0,1]
 * @param reasoning  scoring trail
 */
public record Alternative(
    List<ParsedElement> elements,
    double score,
    double confidence,
    List<String> reasoning
) {
    public Alternative {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        reasoning = List.copyOf(Objects.requireNonNull(reasoning, "reasoning"));
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]");
        }
    }

    public List<String> aiOrder() {
        return elements.stream().map(ParsedElement::ai).toList();
    }
}
