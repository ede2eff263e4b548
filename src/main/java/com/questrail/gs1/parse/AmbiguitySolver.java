package com.questrail.gs1.parse;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.catalog.AiCatalog;
import com.questrail.gs1.catalog.AiMatch;
import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.validate.CharacterSets;
import com.questrail.gs1.validate.ElementValidator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * AmbiguitySolver
 * -----------------------------------------------------------------------------
 * Enumerates every segmentation of the input into AI fields and ranks them.
 *
 * <p>The search is a dynamic program over input positions. {@code memo.get(p)}
 * holds the best completions of the suffix starting at {@code p}; it is
 * filled from the end of the input backwards, so each entry only reads
 * entries to its right and no call-stack recursion is needed. Each entry is
 * truncated to {@code 2 x maxAlternatives} before it is stored.</p>
 *
 * <p>A field that ends at a separator or at the end of the input may take any
 * length its AI allows. A boundary guessed from an AI code that follows the
 * field is only tried within the first {@value #INTERNAL_GUESS_WINDOW}
 * lengths for the internal-use AIs 90-99, whose X..90 range would otherwise
 * multiply the work on long digit runs.</p>
 *
 * <p>Completion confidence is the product of per-element factors:</p>
 * <ul>
 *   <li>1.0 for a valid element, 0.7 for an invalid one</li>
 *   <li>{@code 0.8 + 0.2 x len/max} for a variable field with no terminating separator</li>
 *   <li>0.7 for a variable field ending the input that swallows text where
 *       another AI could start</li>
 * </ul>
 * <p>Crossing a separator multiplies the continuation by 1.05 (capped at 1).
 * Completions are ranked by confidence plus {@code 0.2 x valid fraction},
 * clamped to 1; ties keep generation order. That ranking score is what
 * callers see as the completion's confidence.</p>
 */
final class AmbiguitySolver
{
    static final double INVALID_ELEMENT_FACTOR = 0.7;
    static final double SWALLOWED_AI_FACTOR = 0.7;
    static final double SEPARATOR_BONUS = 1.05;
    static final int INTERNAL_GUESS_WINDOW = 10;
    static final String GUESSED_BOUNDARY = "Guessed boundary for AI(%s)";

    private static final char GS = DecoderOptions.GS;

    private final AiCatalog catalog;
    private final ElementValidator validator;
    private final boolean strict;
    private final int maxAlternatives;

    AmbiguitySolver(AiCatalog catalog, ElementValidator validator, boolean strict, int maxAlternatives)
    {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.strict = strict;
        this.maxAlternatives = maxAlternatives;
    }

    /**
     * Returns up to {@code maxAlternatives + 1} complete segmentations of
     * {@code text}, best first, each scored with its ranking score.
     *
     * @param separatorSeen whether the input carried separators; controls the
     *                      order in which variable lengths are tried
     */
    List<Candidate> solve(String text, boolean separatorSeen)
    {
        final int n = text.length();
        final int keep = Math.max(1, maxAlternatives * 2);

        List<List<Candidate>> memo = new ArrayList<>(n + 1);
        for (int pos = 0; pos < n; pos++) {
            memo.add(List.of());
        }
        memo.add(List.of(new Candidate(List.of(), 1.0, n, List.of())));

        for (int pos = n - 1; pos >= 0; pos--) {
            List<Candidate> paths = new ArrayList<>();

            if (text.charAt(pos) == GS) {
                for (Candidate c : memo.get(pos + 1)) {
                    paths.add(c.withScore(Math.min(1.0, c.score() * SEPARATOR_BONUS), pos));
                }
            }

            for (AiMatch match : catalog.matchesAt(text, pos)) {
                extend(text, match, separatorSeen, memo, paths);
            }

            paths.sort(Comparator.comparingDouble(AmbiguitySolver::rank).reversed());
            memo.set(pos, paths.size() > keep ? List.copyOf(paths.subList(0, keep)) : paths);
        }

        List<Candidate> ranked = new ArrayList<>();
        for (Candidate c : memo.get(0)) {
            if (c.elements().isEmpty()) {
                continue;
            }
            ranked.add(c.withScore(rank(c), n));
            if (ranked.size() == maxAlternatives + 1) {
                break;
            }
        }
        return ranked;
    }

    private void extend(String text, AiMatch match, boolean separatorSeen,
                        List<List<Candidate>> memo, List<Candidate> paths)
    {
        final int n = text.length();
        ApplicationIdentifier ai = match.definition();
        int dataStart = match.valueStart();

        for (int len : lengths(ai, n - dataStart, separatorSeen)) {
            int end = dataStart + len;
            if (end > n) {
                continue;
            }
            String value = text.substring(dataStart, end);
            if (value.indexOf(GS) >= 0) {
                continue;
            }
            boolean atEnd = end == n;
            boolean terminated = atEnd || text.charAt(end) == GS;
            if (!terminated && !catalog.startsAt(text, end)) {
                continue;
            }
            if (!terminated && ai.internalUse() && len >= ai.minLength() + INTERNAL_GUESS_WINDOW) {
                continue;
            }
            if (ai.dataType() == DataType.NUMERIC && !CharacterSets.isNumeric(value)) {
                continue;
            }
            ParsedElement element = validator.element(ai, value, match.position());
            if (strict && !element.valid()) {
                continue;
            }

            double factor = element.valid() ? 1.0 : INVALID_ELEMENT_FACTOR;
            String note = null;
            if (ai.separatorRequired() && !terminated) {
                double ratio = Math.min(1.0, (double) len / Math.max(ai.maxLength(), 1));
                factor *= 0.8 + 0.2 * ratio;
                note = String.format(GUESSED_BOUNDARY, ai.code());
            }
            if (!ai.fixedLength() && atEnd && swallowsAi(value, ai.minLength())) {
                factor *= SWALLOWED_AI_FACTOR;
            }

            for (Candidate rest : memo.get(end)) {
                paths.add(rest.prepend(element, factor, match.position(), note));
            }
        }
    }

    private static int[] lengths(ApplicationIdentifier ai, int remaining, boolean ascending)
    {
        if (ai.fixedLength()) {
            return new int[] { ai.maxLength() };
        }
        int max = Math.min(ai.maxLength(), remaining);
        int min = Math.max(ai.minLength(), 1);
        if (max < min) {
            return new int[0];
        }
        int[] out = new int[max - min + 1];
        for (int i = 0; i < out.length; i++) {
            out[i] = ascending ? min + i : max - i;
        }
        return out;
    }

    private boolean swallowsAi(String value, int minLength)
    {
        for (int i = minLength; i < value.length() - 1; i++) {
            if (catalog.startsAt(value, i)) {
                return true;
            }
        }
        return false;
    }

    static double rank(Candidate c)
    {
        double score = c.score();
        if (!c.elements().isEmpty()) {
            score += 0.2 * c.validCount() / c.elements().size();
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
