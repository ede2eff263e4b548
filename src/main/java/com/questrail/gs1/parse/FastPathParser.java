package com.questrail.gs1.parse;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.Diagnostic;
import com.questrail.gs1.api.DiagnosticCode;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.catalog.AiCatalog;
import com.questrail.gs1.catalog.AiMatch;
import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.validate.ElementValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FastPathParser
 * -----------------------------------------------------------------------------
 * Deterministic single pass over separator-bearing input.
 *
 * <pre>
 *   SCAN ──► MATCH_AI ──► CONSUME(fixed | variable) ──► SCAN ... end of input
 * </pre>
 *
 * <p>Recoverable problems (unknown AI, truncated value, superfluous separator)
 * are recorded and scanning continues. A variable-length field with no
 * terminating separator whose remainder could hold another AI is not guessed:
 * the outcome is marked {@link Outcome#needsSolver()} and the caller decides
 * whether to run the {@link AmbiguitySolver}. The elements returned in that
 * case take such a field to its maximum length.</p>
 */
final class FastPathParser
{
    private static final char GS = DecoderOptions.GS;

    private final AiCatalog catalog;
    private final ElementValidator validator;

    FastPathParser(AiCatalog catalog, ElementValidator validator)
    {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Result of one pass.
     *
     * @param elements    elements in input order
     * @param diagnostics structural findings of the scan
     * @param needsSolver whether an ambiguous field boundary was met
     */
    record Outcome(List<ParsedElement> elements, List<Diagnostic> diagnostics, boolean needsSolver)
    {
        Outcome {
            elements = List.copyOf(elements);
            diagnostics = List.copyOf(diagnostics);
        }

        boolean allValid()
        {
            return elements.stream().allMatch(ParsedElement::valid);
        }
    }

    Outcome parse(String text)
    {
        List<ParsedElement> elements = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        boolean needsSolver = false;
        ApplicationIdentifier previous = null;

        int pos = 0;
        final int n = text.length();
        while (pos < n) {
            // SCAN
            if (text.charAt(pos) == GS) {
                if (pos > 0 && text.charAt(pos - 1) == GS) {
                    diagnostics.add(Diagnostic.warning(DiagnosticCode.EXTRA_SEPARATOR,
                            "Repeated separator", pos, null));
                }
                else if (previous != null && !previous.separatorRequired()
                        && !catalog.startsAt(text, pos + 1)) {
                    diagnostics.add(Diagnostic.warning(DiagnosticCode.EXTRA_SEPARATOR,
                            "Superfluous separator after fixed-length AI(" + previous.code() + ")",
                            pos, previous.code()));
                }
                pos++;
                continue;
            }

            // MATCH_AI
            Optional<AiMatch> match = catalog.longestMatch(text, pos);
            if (match.isEmpty()) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.UNKNOWN_AI,
                        "Unknown AI at position " + pos + ": " + text.substring(pos, Math.min(n, pos + 4)),
                        pos, null));
                int next = text.indexOf(GS, pos);
                pos = next < 0 ? n : next;
                previous = null;
                continue;
            }

            // CONSUME
            ApplicationIdentifier ai = match.get().definition();
            int aiStart = pos;
            int valueStart = match.get().valueStart();
            String value;

            if (ai.fixedLength()) {
                int end = valueStart + ai.maxLength();
                if (end > n) {
                    diagnostics.add(Diagnostic.error(DiagnosticCode.TRUNCATED_DATA,
                            "Truncated data for AI(" + ai.code() + ")", valueStart, ai.code()));
                    end = n;
                }
                value = text.substring(valueStart, end);
                pos = end;
            }
            else {
                int next = text.indexOf(GS, valueStart);
                if (next >= 0) {
                    value = text.substring(valueStart, next);
                    pos = next;
                }
                else if (hiddenAi(text, valueStart, ai)) {
                    needsSolver = true;
                    diagnostics.add(Diagnostic.warning(DiagnosticCode.MISSING_SEPARATOR,
                            "AI(" + ai.code() + ") variable-length field may be followed by another AI without separator",
                            valueStart, ai.code()));
                    int end = Math.min(n, valueStart + ai.maxLength());
                    value = text.substring(valueStart, end);
                    pos = end;
                }
                else {
                    value = text.substring(valueStart);
                    pos = n;
                }
            }

            elements.add(validator.element(ai, value, aiStart));
            previous = ai;
        }

        return new Outcome(elements, diagnostics, needsSolver);
    }

    /**
     * Returns true if another registered AI could start inside the
     * unterminated value beginning at {@code valueStart}.
     */
    private boolean hiddenAi(String text, int valueStart, ApplicationIdentifier ai)
    {
        int remaining = text.length() - valueStart;
        int limit = Math.min(ai.maxLength(), remaining);
        for (int len = ai.minLength(); len < limit; len++) {
            if (remaining - len >= 2 && catalog.startsAt(text, valueStart + len)) {
                return true;
            }
        }
        return false;
    }
}
