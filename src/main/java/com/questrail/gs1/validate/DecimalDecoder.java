package com.questrail.gs1.validate;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Decodes measure and amount values whose AI carries the number of implied
 * decimal places (310n, 392n, ...).
 */
public final class DecimalDecoder
{
    private DecimalDecoder() {}

    /**
     * Inserts {@code positions} implied decimal places into {@code digits}.
     *
     * @throws IllegalArgumentException if {@code digits} is not numeric or
     *                                  {@code positions} is not in 0..9
     */
    public static DecimalValue decode(String digits, int positions)
    {
        if (!CharacterSets.isNumeric(digits)) {
            throw new IllegalArgumentException("Value must be numeric: " + digits);
        }
        if (positions < 0 || positions > 9) {
            throw new IllegalArgumentException("Decimal positions must be 0-9: " + positions);
        }

        BigDecimal value = new BigDecimal(new BigInteger(digits), positions);
        if (positions == 0) {
            return new DecimalValue(value, digits, 0);
        }

        String padded = digits;
        if (padded.length() <= positions) {
            padded = "0".repeat(positions + 1 - padded.length()) + padded;
        }
        int point = padded.length() - positions;
        String formatted = padded.substring(0, point) + "." + padded.substring(point);
        return new DecimalValue(value, formatted, positions);
    }
}
