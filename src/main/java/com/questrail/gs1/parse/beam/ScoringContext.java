package com.questrail.gs1.parse.beam;

import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.parse.Candidate;

import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * What a {@link ScoringRule} sees when a candidate has just been extended.
 *
 * @param candidate   the extended candidate, {@link #added()} included
 * @param inputLength length of the normalized input
 * @param centuryPivot pivot used when a rule decodes a date
 * @param internalWhitelist internal-use AIs exempt from the internal penalties
 * @param maxLengthOf maximum value length per AI in the beam catalog
 */
public record ScoringContext(
    Candidate candidate,
    int inputLength,
    int centuryPivot,
    Set<String> internalWhitelist,
    ToIntFunction<String> maxLengthOf
) {
    public List<ParsedElement> elements() {
        return candidate.elements();
    }

    public ParsedElement added() {
        List<ParsedElement> elements = candidate.elements();
        return elements.get(elements.size() - 1);
    }

    public boolean complete() {
        return candidate.position() >= inputLength;
    }

    /**
     * Returns the last {@code n} AI codes, or an empty list when fewer exist.
     */
    public List<String> lastCodes(int n) {
        List<String> order = candidate.aiOrder();
        if (order.size() < n) {
            return List.of();
        }
        return order.subList(order.size() - n, order.size());
    }
}
