package com.questrail.gs1.parse.beam;

import com.questrail.gs1.api.ApplicationIdentifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses which value lengths the beam tries for a variable-length AI.
 *
 * <ul>
 *   <li>internal-use AIs (90-99): the narrowed window {@code [min, min + 9]}</li>
 *   <li>other AIs: each length whose end is the end of the input or the start
 *       of a beam AI code, plus the maximal length</li>
 *   <li>if nothing qualifies: every length in range</li>
 * </ul>
 */
final class LengthPlanner
{
    static final int INTERNAL_WINDOW = 10;

    private final List<String> boundaryCodes;

    LengthPlanner(List<String> boundaryCodes)
    {
        this.boundaryCodes = List.copyOf(boundaryCodes);
    }

    List<Integer> lengths(String text, int dataStart, ApplicationIdentifier ai)
    {
        int max = Math.min(ai.maxLength(), text.length() - dataStart);
        int min = ai.minLength();
        if (max < min) {
            return List.of();
        }

        List<Integer> lengths = new ArrayList<>();
        if (ai.internalUse()) {
            for (int len = min; len < Math.min(max + 1, min + INTERNAL_WINDOW); len++) {
                lengths.add(len);
            }
            return lengths;
        }

        for (int len = min; len <= max; len++) {
            int next = dataStart + len;
            if (next >= text.length() || len == max || startsBoundary(text, next)) {
                lengths.add(len);
            }
        }
        if (lengths.isEmpty()) {
            for (int len = min; len <= max; len++) {
                lengths.add(len);
            }
        }
        return lengths;
    }

    private boolean startsBoundary(String text, int pos)
    {
        for (String code : boundaryCodes) {
            if (text.startsWith(code, pos)) {
                return true;
            }
        }
        return false;
    }
}
