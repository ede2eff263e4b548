package com.questrail.gs1.config;

/**
 * Score deltas used by the no-separator beam parser.
 *
 * <p>Bonuses are positive and penalties negative; each value is added to a
 * candidate's score as-is when its rule fires. {@link #ambiguityGap()} is the
 * best-vs-runner-up score gap below which a result is flagged ambiguous.</p>
 */
public record ScoringWeights(
    double validGtin,
    double validExpiry,
    double expiryDayUnspecified,
    double tailOrder,
    double serialEmbeddedDate,
    double standardStart,
    double fullOrder,
    double batchLength,
    double serialLength,
    double internalAbsorbable,
    double repeatedBatch,
    double repeatedSerial,
    double internalWithBatchAndSerial,
    double longBatch,
    double shortSerial,
    double compactCompletion,
    double ambiguityGap
) {
    public ScoringWeights {
        if (ambiguityGap < 0) {
            throw new IllegalArgumentException("ambiguityGap must be non-negative");
        }
    }

    public static ScoringWeights defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double validGtin = 1000;
        private double validExpiry = 250;
        private double expiryDayUnspecified = 190;
        private double tailOrder = 120;
        private double serialEmbeddedDate = 90;
        private double standardStart = 15;
        private double fullOrder = 30;
        private double batchLength = 20;
        private double serialLength = 15;
        private double internalAbsorbable = -200;
        private double repeatedBatch = -150;
        private double repeatedSerial = -120;
        private double internalWithBatchAndSerial = -80;
        private double longBatch = -50;
        private double shortSerial = -50;
        private double compactCompletion = 10;
        private double ambiguityGap = 40;

        public Builder withValidGtin(double v) { this.validGtin = v; return this; }
        public Builder withValidExpiry(double v) { this.validExpiry = v; return this; }
        public Builder withExpiryDayUnspecified(double v) { this.expiryDayUnspecified = v; return this; }
        public Builder withTailOrder(double v) { this.tailOrder = v; return this; }
        public Builder withSerialEmbeddedDate(double v) { this.serialEmbeddedDate = v; return this; }
        public Builder withStandardStart(double v) { this.standardStart = v; return this; }
        public Builder withFullOrder(double v) { this.fullOrder = v; return this; }
        public Builder withBatchLength(double v) { this.batchLength = v; return this; }
        public Builder withSerialLength(double v) { this.serialLength = v; return this; }
        public Builder withInternalAbsorbable(double v) { this.internalAbsorbable = v; return this; }
        public Builder withRepeatedBatch(double v) { this.repeatedBatch = v; return this; }
        public Builder withRepeatedSerial(double v) { this.repeatedSerial = v; return this; }
        public Builder withInternalWithBatchAndSerial(double v) { this.internalWithBatchAndSerial = v; return this; }
        public Builder withLongBatch(double v) { this.longBatch = v; return this; }
        public Builder withShortSerial(double v) { this.shortSerial = v; return this; }
        public Builder withCompactCompletion(double v) { this.compactCompletion = v; return this; }
        public Builder withAmbiguityGap(double v) { this.ambiguityGap = v; return this; }

        public ScoringWeights build() {
            return new ScoringWeights(
                validGtin, validExpiry, expiryDayUnspecified, tailOrder, serialEmbeddedDate,
                standardStart, fullOrder, batchLength, serialLength, internalAbsorbable,
                repeatedBatch, repeatedSerial, internalWithBatchAndSerial, longBatch,
                shortSerial, compactCompletion, ambiguityGap);
        }
    }
}
