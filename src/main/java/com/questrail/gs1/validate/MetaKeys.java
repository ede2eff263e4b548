package com.questrail.gs1.validate;

/**
 * Metadata keys written by the validators onto {@code ParsedElement.metadata()}.
 */
public final class MetaKeys
{
    public static final String CHECK_DIGIT_VALID = "checkDigitValid";
    public static final String CALCULATED_CHECK_DIGIT = "calculatedCheckDigit";
    public static final String PROVIDED_CHECK_DIGIT = "providedCheckDigit";

    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String ISO_DATE = "isoDate";
    public static final String DATE_DD_MM_YYYY = "dateDdMmYyyy";
    public static final String DAY_UNSPECIFIED = "dayUnspecified";
    public static final String HOUR = "hour";
    public static final String MINUTE = "minute";
    public static final String ISO_DATE_TIME = "isoDateTime";

    public static final String DECIMAL_VALUE = "decimalValue";
    public static final String DECIMAL_FORMATTED = "decimalFormatted";
    public static final String DECIMAL_POSITIONS = "decimalPositions";

    private MetaKeys() {}
}
