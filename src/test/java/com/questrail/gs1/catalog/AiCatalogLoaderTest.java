package com.questrail.gs1.catalog;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.DateFormat;
import com.questrail.gs1.observability.CatalogLoadedEvent;
import com.questrail.gs1.observability.CatalogRowRejectedEvent;
import com.questrail.gs1.observability.RecordingDecodeObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AiCatalogLoaderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link AiCatalogLoader}.
 *
 * <p>The bundled table is checked for a handful of representative rows; row
 * parsing and rejection are exercised on inline text.</p>
 */
final class AiCatalogLoaderTest
{
    private static final AiCatalog STANDARD = AiCatalog.standard();

    @Test
    void gtinRowIsFixedNumericWithCheckDigit()
    {
        ApplicationIdentifier gtin = STANDARD.lookup("01").orElseThrow();
        assertTrue(gtin.fixedLength());
        assertEquals(14, gtin.maxLength());
        assertEquals(DataType.NUMERIC, gtin.dataType());
        assertTrue(gtin.checkDigit());
        assertFalse(gtin.separatorRequired());
        assertArrayEquals(new int[] { 0, 14 }, gtin.checkDigitSpan().orElseThrow());
        assertTrue(gtin.digitalLinkKey());
        assertEquals(List.of("255", "37"), gtin.exclusiveWith());
    }

    @Test
    void expiryRowCarriesDayZeroDateFormat()
    {
        ApplicationIdentifier expiry = STANDARD.lookup("17").orElseThrow();
        assertEquals(DateFormat.YYMMD0, expiry.dateFormat().orElseThrow());
        assertEquals(6, expiry.maxLength());
        assertTrue(expiry.requiredWith().contains("01"));
    }

    @Test
    void batchRowIsVariableAndSeparatorTerminated()
    {
        ApplicationIdentifier batch = STANDARD.lookup("10").orElseThrow();
        assertFalse(batch.fixedLength());
        assertEquals(1, batch.minLength());
        assertEquals(20, batch.maxLength());
        assertTrue(batch.separatorRequired());
        assertEquals(DataType.ALPHANUMERIC, batch.dataType());
    }

    @Test
    void familyRowExpandsToTenCodesWithDecimals()
    {
        for (int n = 0; n < 10; n++) {
            ApplicationIdentifier weight = STANDARD.lookup("310" + n).orElseThrow();
            assertEquals(n, weight.decimalPositions().getAsInt());
            assertTrue(weight.fixedLength());
            assertEquals(6, weight.maxLength());
        }
    }

    @Test
    void internalRangeExpandsToNineCodes()
    {
        for (int i = 91; i <= 99; i++) {
            ApplicationIdentifier internal = STANDARD.lookup(String.valueOf(i)).orElseThrow();
            assertTrue(internal.internalUse());
            assertEquals(90, internal.maxLength());
            assertFalse(internal.decimalPositions().isPresent());
        }
        assertEquals(30, STANDARD.lookup("90").orElseThrow().maxLength());
        assertFalse(STANDARD.lookup("01").orElseThrow().internalUse());
    }

    @Test
    void multiComponentRowSumsLengths()
    {
        ApplicationIdentifier harvest = STANDARD.lookup("7007").orElseThrow();
        assertEquals(7, harvest.minLength());
        assertEquals(12, harvest.maxLength());
        assertEquals(2, harvest.components().size());
        assertEquals(DateFormat.YYMMDD, harvest.dateFormat().orElseThrow());
        assertArrayEquals(new int[] { 0, 6 }, harvest.dateSpan().orElseThrow());
    }

    @Test
    void checkDigitSpanSkipsLeadingFixedComponent()
    {
        ApplicationIdentifier grai = STANDARD.lookup("8003").orElseThrow();
        assertArrayEquals(new int[] { 1, 13 }, grai.checkDigitSpan().orElseThrow());
        assertEquals(DataType.ALPHANUMERIC, grai.dataType());
    }

    @Test
    void rangeOfFourDigitCodesTakesLastDigitAsDecimals() throws Exception
    {
        List<ApplicationIdentifier> rows = AiCatalogLoader.parseRow("3940-3943  *  N4   req=8111  # PERCENT OFF");
        assertEquals(4, rows.size());
        assertEquals("3940", rows.get(0).code());
        assertEquals(0, rows.get(0).decimalPositions().getAsInt());
        assertEquals("3943", rows.get(3).code());
        assertEquals(3, rows.get(3).decimalPositions().getAsInt());
    }

    @Test
    void parseRowRejectsMalformedRows()
    {
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("01 * N14"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("01 * N14 bogus # GTIN"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("10 * X..20 # BATCH"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("99-91 X..90 # INTERNAL"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("1A X..20 # BAD"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("17 * N4,yymmd0 # SHORT DATE"));
        assertThrows(CatalogFormatException.class, () -> AiCatalogLoader.parseRow("20 * N0 # EMPTY"));
    }

    @Test
    void badAndDuplicateRowsAreSkippedAndReported()
    {
        RecordingDecodeObservabilitySink sink = new RecordingDecodeObservabilitySink();
        String text = String.join("\n",
                "# test table",
                "01  *  N14,csum  # GTIN",
                "10     X..20     # BATCH",
                "zz     X..5      # BAD",
                "10     X..3      # DUPLICATE",
                "");

        AiCatalog catalog = new AiCatalogLoader(sink).parse(text, "inline");

        assertEquals(2, catalog.size());
        assertEquals(20, catalog.lookup("10").orElseThrow().maxLength());

        List<CatalogRowRejectedEvent> rejected = sink.getEvents(CatalogRowRejectedEvent.class);
        assertEquals(2, rejected.size());
        assertEquals(4, rejected.get(0).lineNumber());
        assertEquals(5, rejected.get(1).lineNumber());
        assertTrue(rejected.get(1).reason().contains("Duplicate AI 10"));

        List<CatalogLoadedEvent> loaded = sink.getEvents(CatalogLoadedEvent.class);
        assertEquals(1, loaded.size());
        assertEquals(2, loaded.get(0).definitions());
        assertEquals(2, loaded.get(0).rejectedRows());
        assertEquals("inline", loaded.get(0).source());
    }
}
