package com.questrail.gs1.validate;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A value with implied decimal places made explicit.
 *
 * @param value     exact numeric value
 * @param formatted the raw digits with the decimal point inserted, leading
 *                  zeros kept (e.g. {@code 0012.34})
 * @param positions number of decimal places
 */
public record DecimalValue(BigDecimal value, String formatted, int positions)
{
    public DecimalValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(formatted, "formatted");
    }

    /** Plain decimal string without exponent, e.g. {@code 12.34}. */
    public String plain() {
        return value.toPlainString();
    }
}
