package com.questrail.gs1.parse.beam;

import com.questrail.gs1.parse.Candidate;

import java.util.List;
import java.util.Objects;

/**
 * Completed beam candidates, best first.
 *
 * @param ranked     candidates that consumed the whole input, by descending score
 * @param confidence confidence of the best candidate
 * @param ambiguous  whether the runner-up scored within the ambiguity gap
 */
public record BeamOutcome(List<Candidate> ranked, double confidence, boolean ambiguous)
{
    public BeamOutcome {
        ranked = List.copyOf(Objects.requireNonNull(ranked, "ranked"));
    }

    public static BeamOutcome none() {
        return new BeamOutcome(List.of(), 0.0, false);
    }

    /**
     * Returns true if at least one candidate with elements consumed the input.
     */
    public boolean found() {
        return !ranked.isEmpty() && !ranked.get(0).elements().isEmpty();
    }

    public Candidate best() {
        if (ranked.isEmpty()) {
            throw new IllegalStateException("No completed candidate");
        }
        return ranked.get(0);
    }

    /** Best score minus runner-up score, or positive infinity for a single candidate. */
    public double gap() {
        if (ranked.size() < 2) {
            return Double.POSITIVE_INFINITY;
        }
        return ranked.get(0).score() - ranked.get(1).score();
    }
}
