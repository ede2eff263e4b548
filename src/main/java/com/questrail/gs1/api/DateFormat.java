package com.questrail.gs1.api;

import java.util.Optional;

/**
 * Date layouts used by GS1 date and date-time Application Identifiers.
 */
public enum DateFormat
{
    /** Two-digit year, month, day. */
    YYMMDD("yymmdd", 6),

    /** As {@link #YYMMDD}, but day {@code 00} means "day not specified". */
    YYMMD0("yymmd0", 6),

    /** Four-digit year, month, day. */
    YYYYMMDD("yyyymmdd", 8),

    /** Two-digit year, month, day, hour; optionally followed by minutes. */
    YYMMDDHH("yymmddhh", 8);

    private final String linter;
    private final int digits;

    DateFormat(String linter, int digits) {
        this.linter = linter;
        this.digits = digits;
    }

    /**
     * Returns the linter name this format carries in the syntax dictionary.
     */
    public String linter() {
        return linter;
    }

    /**
     * Returns the minimum number of digits a value in this format occupies.
     */
    public int digits() {
        return digits;
    }

    public static Optional<DateFormat> fromLinter(String linter) {
        for (DateFormat format : values()) {
            if (format.linter.equalsIgnoreCase(linter)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
