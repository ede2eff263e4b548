package com.questrail.gs1.parse.beam;

import java.util.Objects;

/**
 * A score delta produced by one {@link ScoringRule}, with the line it adds to
 * the candidate's reasoning trail. A delta of negative infinity eliminates
 * the candidate.
 */
public record ScoreAdjustment(String tag, double delta, String reason)
{
    public ScoreAdjustment {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(reason, "reason");
        if (Double.isNaN(delta)) {
            throw new IllegalArgumentException("delta must not be NaN");
        }
    }

    public boolean eliminates() {
        return delta == Double.NEGATIVE_INFINITY;
    }
}
