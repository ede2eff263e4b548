package com.questrail.gs1.validate;

import com.questrail.gs1.api.DateFormat;
import com.questrail.gs1.api.DiagnosticCode;

import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DateDecoder
 * -----------------------------------------------------------------------------
 * Decodes and validates GS1 dates.
 *
 * <p>Two-digit years resolve through a century pivot: {@code YY >= pivot}
 * gives 19YY, anything below gives 20YY. Month and day are checked against the
 * resolved year so leap years are honoured.</p>
 *
 * <p>{@link DateFormat#YYMMD0} accepts day {@code 00}. Such a date is flagged
 * {@link MetaKeys#DAY_UNSPECIFIED} and resolved to the last day of the
 * month.</p>
 */
public final class DateDecoder
{
    public static final int DEFAULT_CENTURY_PIVOT = 51;

    private DateDecoder() {}

    public static ValidationResult decode(String value, DateFormat format)
    {
        return decode(value, format, DEFAULT_CENTURY_PIVOT);
    }

    /**
     * Decodes {@code value} in {@code format}. Never throws on malformed input.
     */
    public static ValidationResult decode(String value, DateFormat format, int centuryPivot)
    {
        if (!CharacterSets.isNumeric(value)) {
            return ValidationResult.failure(DiagnosticCode.INVALID_DATE, "Date must be numeric");
        }

        switch (format) {
            case YYYYMMDD:
                if (value.length() != 8) {
                    return lengthFailure(format, "8", value.length());
                }
                return calendarDate(
                        number(value, 0, 4), number(value, 4, 6), number(value, 6, 8), false);

            case YYMMDDHH: {
                if (value.length() != 8 && value.length() != 10) {
                    return lengthFailure(format, "8 or 10", value.length());
                }
                ValidationResult date = calendarDate(
                        year(number(value, 0, 2), centuryPivot), number(value, 2, 4), number(value, 4, 6), false);
                if (!date.valid()) {
                    return date;
                }
                int hour = number(value, 6, 8);
                if (hour > 23) {
                    return ValidationResult.failure(DiagnosticCode.INVALID_DATE, "Invalid hour: " + hour);
                }
                int minute = value.length() == 10 ? number(value, 8, 10) : 0;
                if (minute > 59) {
                    return ValidationResult.failure(DiagnosticCode.INVALID_DATE, "Invalid minute: " + minute);
                }
                Map<String, Object> meta = new LinkedHashMap<>(date.metadata());
                meta.put(MetaKeys.HOUR, hour);
                if (value.length() == 10) {
                    meta.put(MetaKeys.MINUTE, minute);
                }
                meta.put(MetaKeys.ISO_DATE_TIME,
                        String.format("%sT%02d:%02d:00", meta.get(MetaKeys.ISO_DATE), hour, minute));
                return ValidationResult.ok(meta);
            }

            case YYMMD0:
            case YYMMDD:
            default:
                if (value.length() != 6) {
                    return lengthFailure(format, "6", value.length());
                }
                return calendarDate(
                        year(number(value, 0, 2), centuryPivot),
                        number(value, 2, 4),
                        number(value, 4, 6),
                        format == DateFormat.YYMMD0);
        }
    }

    /**
     * Returns true if {@code value} is a real {@code YYMMDD} date (day 00 not
     * allowed).
     */
    public static boolean isStrictDate(String value, int centuryPivot)
    {
        return value.length() == 6 && decode(value, DateFormat.YYMMDD, centuryPivot).valid();
    }

    /**
     * Resolves a two-digit year through the century pivot.
     */
    public static int year(int yy, int centuryPivot)
    {
        return yy >= centuryPivot ? 1900 + yy : 2000 + yy;
    }

    private static ValidationResult calendarDate(int year, int month, int day, boolean dayZeroAllowed)
    {
        if (month < 1 || month > 12) {
            return ValidationResult.failure(DiagnosticCode.INVALID_DATE, "Invalid month: " + month);
        }
        int lastDay = YearMonth.of(year, month).lengthOfMonth();
        boolean unspecified = false;
        if (day == 0 && dayZeroAllowed) {
            unspecified = true;
            day = lastDay;
        }
        else if (day < 1 || day > 31) {
            return ValidationResult.failure(DiagnosticCode.INVALID_DATE, "Invalid day: " + day);
        }
        else if (day > lastDay) {
            return ValidationResult.failure(DiagnosticCode.INVALID_DATE,
                    "Day " + day + " invalid for month " + month + " in year " + year);
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(MetaKeys.YEAR, year);
        meta.put(MetaKeys.MONTH, month);
        meta.put(MetaKeys.DAY, day);
        meta.put(MetaKeys.ISO_DATE, String.format("%04d-%02d-%02d", year, month, day));
        meta.put(MetaKeys.DATE_DD_MM_YYYY, String.format("%02d/%02d/%04d", day, month, year));
        if (unspecified) {
            meta.put(MetaKeys.DAY_UNSPECIFIED, Boolean.TRUE);
        }
        return ValidationResult.ok(meta);
    }

    private static ValidationResult lengthFailure(DateFormat format, String expected, int actual)
    {
        return ValidationResult.failure(DiagnosticCode.INVALID_DATE,
                format + " date must be " + expected + " digits, got " + actual);
    }

    private static int number(String s, int from, int to)
    {
        return Integer.parseInt(s, from, to, 10);
    }
}
