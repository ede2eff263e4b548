package com.questrail.gs1.validate;

import com.questrail.gs1.api.DateFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DateDecoderTest
{
    @Test
    void decodesTwoDigitYearThroughPivot()
    {
        ValidationResult result = DateDecoder.decode("290131", DateFormat.YYMMDD);

        assertTrue(result.valid());
        assertEquals(2029, result.metadata().get(MetaKeys.YEAR));
        assertEquals(1, result.metadata().get(MetaKeys.MONTH));
        assertEquals(31, result.metadata().get(MetaKeys.DAY));
        assertEquals("2029-01-31", result.metadata().get(MetaKeys.ISO_DATE));
        assertEquals("31/01/2029", result.metadata().get(MetaKeys.DATE_DD_MM_YYYY));
    }

    @Test
    void pivotBoundary()
    {
        assertEquals(1951, DateDecoder.year(51, DateDecoder.DEFAULT_CENTURY_PIVOT));
        assertEquals(2050, DateDecoder.year(50, DateDecoder.DEFAULT_CENTURY_PIVOT));
        assertEquals(1940, DateDecoder.year(40, 30));
        assertEquals(2029, DateDecoder.year(29, 30));
    }

    @Test
    void dayZeroResolvesToLastDayOfMonth()
    {
        ValidationResult nonLeap = DateDecoder.decode("290200", DateFormat.YYMMD0);
        assertTrue(nonLeap.valid());
        assertEquals(28, nonLeap.metadata().get(MetaKeys.DAY));
        assertEquals(Boolean.TRUE, nonLeap.metadata().get(MetaKeys.DAY_UNSPECIFIED));

        ValidationResult leap = DateDecoder.decode("280200", DateFormat.YYMMD0);
        assertEquals(29, leap.metadata().get(MetaKeys.DAY));
        assertEquals("2028-02-29", leap.metadata().get(MetaKeys.ISO_DATE));
    }

    @Test
    void dayZeroRejectedWhereNotAllowed()
    {
        ValidationResult result = DateDecoder.decode("290200", DateFormat.YYMMDD);
        assertFalse(result.valid());
        assertEquals("Invalid day: 0", result.errors().get(0));
    }

    @Test
    void rejectsImpossibleDates()
    {
        assertEquals("Invalid month: 13", DateDecoder.decode("291301", DateFormat.YYMMDD).errors().get(0));
        assertEquals("Invalid month: 0", DateDecoder.decode("290001", DateFormat.YYMMD0).errors().get(0));
        assertEquals("Day 30 invalid for month 2 in year 2029",
                DateDecoder.decode("290230", DateFormat.YYMMDD).errors().get(0));
        assertEquals("Day 31 invalid for month 4 in year 2028",
                DateDecoder.decode("280431", DateFormat.YYMMDD).errors().get(0));
    }

    @Test
    void rejectsWrongLengthAndNonDigits()
    {
        assertEquals("YYMMDD date must be 6 digits, got 4",
                DateDecoder.decode("2901", DateFormat.YYMMDD).errors().get(0));
        assertEquals("Date must be numeric", DateDecoder.decode("29A131", DateFormat.YYMMDD).errors().get(0));
    }

    @Test
    void fourDigitYear()
    {
        assertTrue(DateDecoder.decode("20240229", DateFormat.YYYYMMDD).valid());
        assertFalse(DateDecoder.decode("20230229", DateFormat.YYYYMMDD).valid());
    }

    @Test
    void dateWithHourAndOptionalMinutes()
    {
        ValidationResult withMinutes = DateDecoder.decode("2901311530", DateFormat.YYMMDDHH);
        assertTrue(withMinutes.valid());
        assertEquals("2029-01-31T15:30:00", withMinutes.metadata().get(MetaKeys.ISO_DATE_TIME));
        assertEquals(30, withMinutes.metadata().get(MetaKeys.MINUTE));

        ValidationResult hourOnly = DateDecoder.decode("29013107", DateFormat.YYMMDDHH);
        assertEquals("2029-01-31T07:00:00", hourOnly.metadata().get(MetaKeys.ISO_DATE_TIME));
        assertFalse(hourOnly.metadata().containsKey(MetaKeys.MINUTE));

        assertFalse(DateDecoder.decode("29013124", DateFormat.YYMMDDHH).valid());
        assertFalse(DateDecoder.decode("2901311560", DateFormat.YYMMDDHH).valid());
    }

    @Test
    void strictDateExcludesDayZero()
    {
        assertTrue(DateDecoder.isStrictDate("280430", 51));
        assertFalse(DateDecoder.isStrictDate("290200", 51));
        assertFalse(DateDecoder.isStrictDate("2804301", 51));
    }
}
