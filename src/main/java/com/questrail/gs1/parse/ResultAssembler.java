package com.questrail.gs1.parse;

import com.questrail.gs1.api.Alternative;
import com.questrail.gs1.api.Diagnostic;
import com.questrail.gs1.api.DiagnosticCode;
import com.questrail.gs1.api.ParseResult;
import com.questrail.gs1.api.ParseStrategy;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.parse.beam.BeamOutcome;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the outcome of any engine into a {@link ParseResult}.
 *
 * <p>Element validation issues are lifted into the top-level diagnostics,
 * alternatives are bounded by {@code maxAlternatives} and the confidence is
 * clamped to [0,1].</p>
 */
final class ResultAssembler
{
    static final String AMBIGUOUS_MESSAGE = "Multiple valid parses found; returning best with alternatives";
    static final String NO_SEPARATOR_MESSAGE = "Input has no separators; field boundaries inferred by scoring";

    private final int maxAlternatives;

    ResultAssembler(int maxAlternatives)
    {
        this.maxAlternatives = maxAlternatives;
    }

    ParseResult noParse(NormalizedInput in, List<Diagnostic> prior)
    {
        List<Diagnostic> diagnostics = new ArrayList<>(prior);
        diagnostics.add(Diagnostic.noValidParse());
        return new ParseResult(in.raw(), in.text(), in.symbology(), in.separatorsPresent(),
                ParseStrategy.NONE, List.of(), diagnostics, List.of(), 0.0);
    }

    ParseResult fromFastPath(NormalizedInput in, FastPathParser.Outcome outcome, ParseStrategy strategy)
    {
        return assemble(in, strategy, outcome.elements(), outcome.diagnostics(), List.of(),
                fastPathConfidence(outcome));
    }

    /**
     * The fast-path guess used when the ambiguity solver may not run.
     */
    ParseResult fromGuess(NormalizedInput in, FastPathParser.Outcome outcome, ParseStrategy strategy, double confidence)
    {
        List<Diagnostic> diagnostics = new ArrayList<>(outcome.diagnostics());
        if (diagnostics.stream().noneMatch(d -> d.code() == DiagnosticCode.MISSING_SEPARATOR)) {
            diagnostics.add(Diagnostic.warning(DiagnosticCode.MISSING_SEPARATOR,
                    "Variable-length field boundary guessed", -1, null));
        }
        return assemble(in, strategy, outcome.elements(), diagnostics, List.of(), confidence);
    }

    ParseResult fromSolver(NormalizedInput in, List<Candidate> ranked, ParseStrategy strategy)
    {
        Candidate best = ranked.get(0);
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (in.separatorsPresent() || ranked.size() > 1) {
            Set<String> notes = new LinkedHashSet<>(best.reasoning());
            for (String note : notes) {
                diagnostics.add(Diagnostic.warning(DiagnosticCode.MISSING_SEPARATOR, note, -1, null));
            }
        }
        if (ranked.size() > 1) {
            diagnostics.add(Diagnostic.warning(DiagnosticCode.AMBIGUOUS_PARSE, AMBIGUOUS_MESSAGE, -1, null));
        }

        List<Alternative> alternatives = new ArrayList<>();
        for (Candidate alt : ranked.subList(1, Math.min(ranked.size(), maxAlternatives + 1))) {
            alternatives.add(new Alternative(alt.elements(), alt.score(), clamp(alt.score()), alt.reasoning()));
        }
        return assemble(in, strategy, best.elements(), diagnostics, alternatives, best.score());
    }

    ParseResult fromBeam(NormalizedInput in, BeamOutcome outcome)
    {
        Candidate best = outcome.best();
        List<Diagnostic> diagnostics = new ArrayList<>();
        diagnostics.add(Diagnostic.warning(DiagnosticCode.MISSING_SEPARATOR, NO_SEPARATOR_MESSAGE, -1, null));
        if (outcome.ambiguous()) {
            diagnostics.add(Diagnostic.warning(DiagnosticCode.AMBIGUOUS_PARSE, AMBIGUOUS_MESSAGE, -1, null));
        }

        List<Alternative> alternatives = new ArrayList<>();
        List<Candidate> ranked = outcome.ranked();
        for (Candidate alt : ranked.subList(1, Math.min(ranked.size(), maxAlternatives + 1))) {
            double relative = best.score() > 0 ? clamp(alt.score() / best.score()) : 0.0;
            alternatives.add(new Alternative(alt.elements(), alt.score(), relative, alt.reasoning()));
        }
        return assemble(in, ParseStrategy.NO_SEPARATOR_BEAM, best.elements(), diagnostics, alternatives,
                outcome.confidence());
    }

    /**
     * Returns {@code result} with its confidence capped at {@code cap} and
     * {@code extra} appended unless an equal-coded diagnostic is present.
     */
    ParseResult capped(ParseResult result, double cap, Diagnostic extra)
    {
        List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics());
        if (!result.hasDiagnostic(extra.code())) {
            diagnostics.add(0, extra);
        }
        return new ParseResult(result.input(), result.normalizedInput(), result.symbology(),
                result.separatorsPresent(), result.strategy(), result.elements(), diagnostics,
                result.alternatives(), Math.min(cap, result.confidence()));
    }

    /**
     * 1.0 for a clean pass; {@code 0.9 - 0.05 x diagnostics} otherwise, then
     * scaled by {@code 0.8 + 0.2 x valid fraction}.
     */
    static double fastPathConfidence(FastPathParser.Outcome outcome)
    {
        double confidence = 1.0;
        int structural = outcome.diagnostics().size();
        if (structural > 0) {
            confidence = 0.9 - structural * 0.05;
        }
        List<ParsedElement> elements = outcome.elements();
        if (!elements.isEmpty()) {
            long valid = elements.stream().filter(ParsedElement::valid).count();
            confidence *= 0.8 + 0.2 * valid / elements.size();
        }
        return clamp(confidence);
    }

    private ParseResult assemble(NormalizedInput in, ParseStrategy strategy, List<ParsedElement> elements,
                                 List<Diagnostic> engineDiagnostics, List<Alternative> alternatives,
                                 double confidence)
    {
        List<Diagnostic> diagnostics = new ArrayList<>(engineDiagnostics);
        for (ParsedElement e : elements) {
            diagnostics.addAll(e.issues());
        }
        List<Alternative> bounded = alternatives.size() > maxAlternatives
                ? alternatives.subList(0, maxAlternatives)
                : alternatives;
        return new ParseResult(in.raw(), in.text(), in.symbology(), in.separatorsPresent(),
                strategy, elements, diagnostics, bounded, clamp(confidence));
    }

    static double clamp(double v)
    {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
