package com.questrail.gs1.config;

import com.questrail.gs1.catalog.AiCatalog;
import com.questrail.gs1.observability.DecodeObservabilitySink;
import com.questrail.gs1.observability.NullObservabilitySink;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for a GS1 decoder.
 *
 * <p>All bounds are hard limits that guarantee termination on adversarial
 * input: {@code beamWidth}, {@code maxBeamIterations} and
 * {@code maxSolverPositions}.</p>
 */
public record DecoderOptions(
    boolean strictMode,
    int maxAlternatives,
    int centuryPivot,
    boolean normalizeSeparators,
    boolean allowAmbiguous,
    int beamWidth,
    int maxBeamIterations,
    int maxSolverPositions,
    Set<String> internalWhitelist,
    List<String> separatorStandIns,
    ScoringWeights scoringWeights,
    AiCatalog catalog,
    DecodeObservabilitySink observabilitySink
) {
    /** ASCII 29, the transmitted form of FNC1. */
    public static final char GS = '\u001d';

    public static final List<String> DEFAULT_SEPARATOR_STAND_INS =
        List.of(String.valueOf(GS), "<GS>", "~", "|", "^");

    public DecoderOptions {
        if (maxAlternatives < 0) {
            throw new IllegalArgumentException("maxAlternatives must be non-negative");
        }
        if (centuryPivot < 0 || centuryPivot > 99) {
            throw new IllegalArgumentException("centuryPivot must be 0-99");
        }
        if (beamWidth < 1) {
            throw new IllegalArgumentException("beamWidth must be positive");
        }
        if (maxBeamIterations < 1) {
            throw new IllegalArgumentException("maxBeamIterations must be positive");
        }
        if (maxSolverPositions < 0) {
            throw new IllegalArgumentException("maxSolverPositions must be non-negative");
        }
        Objects.requireNonNull(internalWhitelist, "internalWhitelist");
        for (String code : internalWhitelist) {
            if (!code.matches("9\\d")) {
                throw new IllegalArgumentException("Not an internal-use AI: " + code);
            }
        }
        internalWhitelist = Set.copyOf(internalWhitelist);
        Objects.requireNonNull(separatorStandIns, "separatorStandIns");
        for (String s : separatorStandIns) {
            if (s.isEmpty()) {
                throw new IllegalArgumentException("Separator stand-in must not be empty");
            }
            if (s.chars().anyMatch(c -> c >= '0' && c <= '9')) {
                throw new IllegalArgumentException("Separator stand-in must not contain digits: " + s);
            }
        }
        separatorStandIns = List.copyOf(new LinkedHashSet<>(separatorStandIns));
        Objects.requireNonNull(scoringWeights, "scoringWeights");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static DecoderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
            .withStrictMode(strictMode)
            .withMaxAlternatives(maxAlternatives)
            .withCenturyPivot(centuryPivot)
            .withNormalizeSeparators(normalizeSeparators)
            .withAllowAmbiguous(allowAmbiguous)
            .withBeamWidth(beamWidth)
            .withMaxBeamIterations(maxBeamIterations)
            .withMaxSolverPositions(maxSolverPositions)
            .withInternalWhitelist(internalWhitelist)
            .withSeparatorStandIns(separatorStandIns)
            .withScoringWeights(scoringWeights)
            .withCatalog(catalog)
            .withObservabilitySink(observabilitySink);
    }

    public static final class Builder {
        private boolean strictMode = false;
        private int maxAlternatives = 5;
        private int centuryPivot = 51;
        private boolean normalizeSeparators = true;
        private boolean allowAmbiguous = true;
        private int beamWidth = 200;
        private int maxBeamIterations = 20;
        private int maxSolverPositions = 256;
        private Set<String> internalWhitelist = Set.of();
        private List<String> separatorStandIns = DEFAULT_SEPARATOR_STAND_INS;
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private AiCatalog catalog;
        private DecodeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder withMaxAlternatives(int maxAlternatives) {
            this.maxAlternatives = maxAlternatives;
            return this;
        }

        public Builder withCenturyPivot(int centuryPivot) {
            this.centuryPivot = centuryPivot;
            return this;
        }

        public Builder withNormalizeSeparators(boolean normalizeSeparators) {
            this.normalizeSeparators = normalizeSeparators;
            return this;
        }

        /**
         * When false, an ambiguous variable-length field is not handed to the
         * ambiguity solver; the fast-path guess is returned instead.
         */
        public Builder withAllowAmbiguous(boolean allowAmbiguous) {
            this.allowAmbiguous = allowAmbiguous;
            return this;
        }

        public Builder withBeamWidth(int beamWidth) {
            this.beamWidth = beamWidth;
            return this;
        }

        public Builder withMaxBeamIterations(int maxBeamIterations) {
            this.maxBeamIterations = maxBeamIterations;
            return this;
        }

        public Builder withMaxSolverPositions(int maxSolverPositions) {
            this.maxSolverPositions = maxSolverPositions;
            return this;
        }

        public Builder withInternalWhitelist(Set<String> internalWhitelist) {
            this.internalWhitelist = internalWhitelist;
            return this;
        }

        public Builder withSeparatorStandIns(List<String> separatorStandIns) {
            this.separatorStandIns = separatorStandIns;
            return this;
        }

        public Builder withScoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder withCatalog(AiCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder withObservabilitySink(DecodeObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DecoderOptions build() {
            return new DecoderOptions(
                strictMode,
                maxAlternatives,
                centuryPivot,
                normalizeSeparators,
                allowAmbiguous,
                beamWidth,
                maxBeamIterations,
                maxSolverPositions,
                internalWhitelist,
                separatorStandIns,
                scoringWeights,
                catalog != null ? catalog : AiCatalog.standard(),
                observabilitySink);
        }
    }
}
