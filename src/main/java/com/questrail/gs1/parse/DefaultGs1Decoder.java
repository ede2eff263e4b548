package com.questrail.gs1.parse;

import com.questrail.gs1.api.Diagnostic;
import com.questrail.gs1.api.DiagnosticCode;
import com.questrail.gs1.api.Gs1Decoder;
import com.questrail.gs1.api.ParseResult;
import com.questrail.gs1.api.ParseStrategy;
import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.observability.DecodeCompletedEvent;
import com.questrail.gs1.observability.DecodeObservabilitySink;
import com.questrail.gs1.parse.beam.BeamOutcome;
import com.questrail.gs1.parse.beam.NoSeparatorBeamParser;
import com.questrail.gs1.validate.ElementValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * DefaultGs1Decoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link Gs1Decoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Normalization: symbology identifier, separator stand-ins, trimming</li>
 *   <li>Strategy selection:
 *     <ul>
 *       <li>no separators in the input: {@link NoSeparatorBeamParser}, falling
 *           back to a full-catalog scan (confidence capped at
 *           {@value #FALLBACK_CONFIDENCE_CAP}) when the beam finds nothing</li>
 *       <li>separators present: {@link FastPathParser}, handing ambiguous
 *           boundaries to the {@link AmbiguitySolver}</li>
 *     </ul>
 *   </li>
 *   <li>Assembly into a single {@link ParseResult} shape</li>
 * </ol>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class DefaultGs1Decoder implements Gs1Decoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultGs1Decoder.class);

    static final double FALLBACK_CONFIDENCE_CAP = 0.3;
    static final double UNSOLVED_CONFIDENCE = 0.5;

    private final DecoderOptions options;
    private final InputNormalizer normalizer;
    private final FastPathParser fastPath;
    private final AmbiguitySolver solver;
    private final NoSeparatorBeamParser beam;
    private final ResultAssembler assembler;
    private final DecodeObservabilitySink sink;

    public DefaultGs1Decoder()
    {
        this(DecoderOptions.defaults());
    }

    public DefaultGs1Decoder(DecoderOptions options)
    {
        this.options = Objects.requireNonNull(options, "options");
        ElementValidator validator = new ElementValidator(options.centuryPivot());
        this.normalizer = new InputNormalizer(options);
        this.fastPath = new FastPathParser(options.catalog(), validator);
        this.solver = new AmbiguitySolver(options.catalog(), validator, options.strictMode(), options.maxAlternatives());
        this.beam = new NoSeparatorBeamParser(options);
        this.assembler = new ResultAssembler(options.maxAlternatives());
        this.sink = options.observabilitySink();
    }

    public DecoderOptions options()
    {
        return options;
    }

    @Override
    public ParseResult decode(String input)
    {
        Objects.requireNonNull(input, "input");
        long startNanos = System.nanoTime();

        NormalizedInput in = normalizer.normalize(input);
        ParseResult result;
        if (in.isEmpty()) {
            result = assembler.noParse(in, List.of());
        }
        else if (!in.separatorsPresent()) {
            result = decodeWithoutSeparators(in);
        }
        else {
            result = decodeWithCatalog(in, ParseStrategy.FAST_PATH);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        log.debug("Decoded '{}' via {} -> {} (confidence {})",
                in.text(), result.strategy(), result.aiOrder(), result.confidence());
        sink.onDecodeCompleted(new DecodeCompletedEvent(Instant.now(), result, elapsed));
        return result;
    }

    private ParseResult decodeWithoutSeparators(NormalizedInput in)
    {
        BeamOutcome outcome = beam.parse(in.text());
        if (outcome.found()) {
            return assembler.fromBeam(in, outcome);
        }

        log.debug("Beam found no complete parse of '{}'; scanning with the full catalog", in.text());
        ParseResult fallback = decodeWithCatalog(in, ParseStrategy.FALLBACK);
        if (fallback.empty()) {
            return fallback;
        }
        return assembler.capped(fallback, FALLBACK_CONFIDENCE_CAP,
                Diagnostic.warning(DiagnosticCode.MISSING_SEPARATOR,
                        ResultAssembler.NO_SEPARATOR_MESSAGE, -1, null));
    }

    /**
     * Fast path, escalating to the ambiguity solver when a field boundary is
     * ambiguous. {@code strategy} names the fast-path outcome; solver outcomes
     * report {@link ParseStrategy#AMBIGUITY_SOLVER} unless this is a fallback.
     */
    private ParseResult decodeWithCatalog(NormalizedInput in, ParseStrategy strategy)
    {
        FastPathParser.Outcome fp = fastPath.parse(in.text());

        if (!fp.needsSolver()) {
            if (fp.elements().isEmpty() || (options.strictMode() && !fp.allValid())) {
                return assembler.noParse(in, fp.diagnostics());
            }
            return assembler.fromFastPath(in, fp, strategy);
        }

        ParseStrategy solverStrategy = strategy == ParseStrategy.FALLBACK ? strategy : ParseStrategy.AMBIGUITY_SOLVER;
        if (!options.allowAmbiguous()) {
            return assembler.fromGuess(in, fp, strategy, UNSOLVED_CONFIDENCE);
        }
        if (in.length() > options.maxSolverPositions()) {
            log.debug("Input of {} chars exceeds solver bound {}; returning fast-path guess",
                    in.length(), options.maxSolverPositions());
            return assembler.fromGuess(in, fp, strategy, UNSOLVED_CONFIDENCE);
        }

        List<Candidate> ranked = solver.solve(in.text(), in.separatorsPresent());
        if (ranked.isEmpty()) {
            return assembler.noParse(in, fp.diagnostics());
        }
        return assembler.fromSolver(in, ranked, solverStrategy);
    }
}
