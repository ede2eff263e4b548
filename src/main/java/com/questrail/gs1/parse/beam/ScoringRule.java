package com.questrail.gs1.parse.beam;

import java.util.Optional;

/**
 * One tagged entry of the beam parser's scoring table.
 */
public interface ScoringRule
{
    /**
     * Short stable identifier of the rule.
     */
    String tag();

    /**
     * Scores the candidate in {@code context}, which has just been extended by
     * {@link ScoringContext#added()}.
     *
     * @return the adjustment, or empty if the rule does not fire
     */
    Optional<ScoreAdjustment> evaluate(ScoringContext context);
}
