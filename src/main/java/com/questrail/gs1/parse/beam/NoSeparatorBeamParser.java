package com.questrail.gs1.parse.beam;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.catalog.AiCatalog;
import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.parse.Candidate;
import com.questrail.gs1.validate.ElementValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * NoSeparatorBeamParser
 * -----------------------------------------------------------------------------
 * Scored beam search for element strings whose separators were stripped.
 *
 * <p>The search runs over a small catalog: GTIN (01), expiry (17), batch (10),
 * serial (21) and the internal-use AIs 90-99, in that order, restricted to
 * the codes the configured catalog defines. Each round every
 * unfinished candidate is extended by every beam AI whose code starts at its
 * position:</p>
 * <ul>
 *   <li>fixed-length AIs give one extension, dropped if it overruns the input
 *       or fails its check digit</li>
 *   <li>variable-length AIs give one extension per length chosen by the
 *       {@link LengthPlanner}</li>
 * </ul>
 * <p>Extensions are scored by {@link ScoringRules}; the new beam is sorted by
 * score (stable) and cut to {@code beamWidth}. The search stops when the beam
 * is empty or after {@code maxBeamIterations} rounds.</p>
 *
 * <p>Confidence: 0.95 for a single completed candidate, otherwise
 * {@code min(1, max(0.5, 1 / (1 + 50 / (gap + 1))))} with {@code gap} the
 * best-vs-runner-up score difference.</p>
 */
public final class NoSeparatorBeamParser
{
    private static final Logger log = LoggerFactory.getLogger(NoSeparatorBeamParser.class);

    public static final List<String> BEAM_CODES = List.of(
            "01", "17", "10", "21",
            "90", "91", "92", "93", "94", "95", "96", "97", "98", "99");

    static final double SINGLE_CANDIDATE_CONFIDENCE = 0.95;

    private final AiCatalog beamCatalog;
    private final ElementValidator validator;
    private final ScoringRules scoring;
    private final LengthPlanner planner;
    private final int beamWidth;
    private final int maxIterations;
    private final boolean strict;
    private final int centuryPivot;
    private final double ambiguityGap;
    private final Set<String> whitelist;

    public NoSeparatorBeamParser(DecoderOptions options)
    {
        this(options, ScoringRules.standard(options.scoringWeights()));
    }

    public NoSeparatorBeamParser(DecoderOptions options, ScoringRules scoring)
    {
        Objects.requireNonNull(options, "options");
        List<String> codes = BEAM_CODES.stream()
                .filter(options.catalog()::contains)
                .toList();
        this.beamCatalog = options.catalog().subset(codes);
        this.validator = new ElementValidator(options.centuryPivot());
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.planner = new LengthPlanner(codes);
        this.beamWidth = options.beamWidth();
        this.maxIterations = options.maxBeamIterations();
        this.strict = options.strictMode();
        this.centuryPivot = options.centuryPivot();
        this.ambiguityGap = options.scoringWeights().ambiguityGap();
        this.whitelist = options.internalWhitelist();
    }

    public BeamOutcome parse(String text)
    {
        List<Candidate> complete = search(text);
        if (complete.isEmpty()) {
            return BeamOutcome.none();
        }

        List<Candidate> ranked = new ArrayList<>(complete);
        ranked.sort(Comparator.comparingDouble(Candidate::score).reversed());

        double gap = ranked.size() > 1 ? ranked.get(0).score() - ranked.get(1).score() : Double.POSITIVE_INFINITY;
        double confidence;
        if (ranked.get(0).elements().isEmpty()) {
            confidence = 0.0;
        }
        else if (ranked.size() > 1) {
            confidence = Math.min(1.0, Math.max(0.5, 1.0 / (1.0 + 50.0 / (gap + 1))));
        }
        else {
            confidence = SINGLE_CANDIDATE_CONFIDENCE;
        }
        if (Double.isNaN(confidence)) {
            confidence = 0.5;
        }
        boolean ambiguous = ranked.size() > 1 && gap < ambiguityGap;

        log.debug("Beam over {} chars: {} complete candidates, best={} score={}",
                text.length(), ranked.size(), ranked.get(0).aiOrder(), ranked.get(0).score());
        return new BeamOutcome(ranked, confidence, ambiguous);
    }

    /**
     * Runs the beam and returns the candidates that consumed the whole input,
     * in the order they completed.
     */
    List<Candidate> search(String text)
    {
        List<Candidate> beam = List.of(Candidate.start(0.0));
        List<Candidate> complete = new ArrayList<>();

        int iteration = 0;
        while (!beam.isEmpty() && iteration < maxIterations) {
            iteration++;
            List<Candidate> next = new ArrayList<>();
            for (Candidate candidate : beam) {
                if (candidate.position() >= text.length()) {
                    complete.add(candidate);
                    continue;
                }
                extend(text, candidate, next);
            }
            next.sort(Comparator.comparingDouble(Candidate::score).reversed());
            beam = next.size() > beamWidth ? next.subList(0, beamWidth) : next;
        }

        // candidates that finished in the last permitted round
        for (Candidate candidate : beam) {
            if (candidate.position() >= text.length()) {
                complete.add(candidate);
            }
        }
        return complete;
    }

    private void extend(String text, Candidate candidate, List<Candidate> out)
    {
        int pos = candidate.position();
        for (ApplicationIdentifier ai : beamCatalog.definitions()) {
            if (!text.startsWith(ai.code(), pos)) {
                continue;
            }
            int dataStart = pos + ai.code().length();

            if (ai.fixedLength()) {
                int end = dataStart + ai.maxLength();
                if (end > text.length()) {
                    continue;
                }
                ParsedElement element = validator.element(ai, text.substring(dataStart, end), pos);
                if (!element.valid() && (ai.checkDigit() || strict)) {
                    continue;
                }
                out.add(score(text, candidate.append(element, end)));
            }
            else {
                for (int len : planner.lengths(text, dataStart, ai)) {
                    int end = dataStart + len;
                    ParsedElement element = validator.element(ai, text.substring(dataStart, end), pos);
                    if (strict && !element.valid()) {
                        continue;
                    }
                    out.add(score(text, candidate.append(element, end)));
                }
            }
        }
    }

    private Candidate score(String text, Candidate extended)
    {
        return scoring.score(new ScoringContext(
                extended, text.length(), centuryPivot, whitelist,
                code -> beamCatalog.lookup(code).map(ApplicationIdentifier::maxLength).orElse(0)));
    }
}
