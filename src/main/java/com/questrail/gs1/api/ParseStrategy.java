package com.questrail.gs1.api;

/**
 * Which engine produced the elements of a {@link ParseResult}.
 */
public enum ParseStrategy
{
    /** Deterministic scan of separator-bearing input. */
    FAST_PATH,

    /** Memoized search over ambiguous field boundaries. */
    AMBIGUITY_SOLVER,

    /** Scored beam search over input without separators. */
    NO_SEPARATOR_BEAM,

    /** Full-catalog scan after the beam found nothing. */
    FALLBACK,

    /** Nothing was decoded. */
    NONE
}
