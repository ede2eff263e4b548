package com.questrail.gs1.parse;

import com.questrail.gs1.api.Alternative;
import com.questrail.gs1.api.DiagnosticCode;
import com.questrail.gs1.api.Gs1Decoder;
import com.questrail.gs1.api.ParseResult;
import com.questrail.gs1.api.ParseStrategy;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.api.Severity;
import com.questrail.gs1.api.Symbology;
import com.questrail.gs1.catalog.AiCatalog;
import com.questrail.gs1.config.DecoderOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultGs1DecoderTest
 * -----------------------------------------------------------------------------
 * End-to-end tests for {@link DefaultGs1Decoder}: strategy selection,
 * confidence and the diagnostics attached to each outcome.
 */
final class DefaultGs1DecoderTest
{
    private static final char GS = DecoderOptions.GS;

    private final Gs1Decoder decoder = new DefaultGs1Decoder();

    // ---------------------------------------------------------------------
    // Fast path
    // ---------------------------------------------------------------------

    @Test
    void cleanSeparatedInputDecodesWithFullConfidence()
    {
        ParseResult result = decoder.decode("]d20106285096000842" + "17290131" + "10ABC" + GS + "21ABCDEF");

        assertEquals(ParseStrategy.FAST_PATH, result.strategy());
        assertEquals(Symbology.GS1_DATAMATRIX, result.symbology());
        assertTrue(result.separatorsPresent());
        assertEquals(List.of("01", "17", "10", "21"), result.aiOrder());
        assertEquals(1.0, result.confidence(), 1e-9);
        assertTrue(result.diagnostics().isEmpty());
        assertTrue(result.alternatives().isEmpty());
        assertTrue(result.coversInput(GS));
        assertEquals("2029-01-31", result.element("17").orElseThrow().value());
    }

    @Test
    void standInSeparatorsAreHonoured()
    {
        ParseResult result = decoder.decode("0106285096000842|10ABC^21XYZ");

        assertEquals(ParseStrategy.FAST_PATH, result.strategy());
        assertEquals(List.of("01", "10", "21"), result.aiOrder());
        assertEquals("XYZ", result.element("21").orElseThrow().raw());
    }

    @Test
    void elementIssuesAreLiftedIntoDiagnostics()
    {
        ParseResult result = decoder.decode("0106285096000843" + GS + "10ABC");

        assertFalse(result.allValid());
        assertTrue(result.hasDiagnostic(DiagnosticCode.INVALID_CHECK_DIGIT));
        assertTrue(result.confidence() < 1.0);
        assertTrue(result.confidence() > 0.0);
    }

    @Test
    void truncatedInputLowersConfidence()
    {
        ParseResult result = decoder.decode("10ABC" + GS + "0106285096");

        assertEquals(ParseStrategy.FAST_PATH, result.strategy());
        assertTrue(result.hasDiagnostic(DiagnosticCode.TRUNCATED_DATA));
        assertTrue(result.hasDiagnostic(DiagnosticCode.INVALID_LENGTH));
        assertEquals((0.9 - 0.05) * (0.8 + 0.2 * 0.5), result.confidence(), 1e-9);
    }

    @Test
    void strictModeRefusesInvalidElements()
    {
        Gs1Decoder strict = new DefaultGs1Decoder(DecoderOptions.builder().withStrictMode(true).build());
        ParseResult result = strict.decode("10ABC" + GS + "0106285096");

        assertTrue(result.empty());
        assertEquals(ParseStrategy.NONE, result.strategy());
        assertEquals(0.0, result.confidence());
        assertTrue(result.hasDiagnostic(DiagnosticCode.TRUNCATED_DATA));
        assertTrue(result.hasDiagnostic(DiagnosticCode.INVALID_FORMAT));
    }

    // ---------------------------------------------------------------------
    // Ambiguity solver
    // ---------------------------------------------------------------------

    @Test
    void ambiguousBoundaryIsResolvedWithAlternatives()
    {
        ParseResult result = decoder.decode("0106285096000842|10ABC17290131");

        assertEquals(ParseStrategy.AMBIGUITY_SOLVER, result.strategy());
        assertEquals(List.of("01", "10", "17"), result.aiOrder());
        assertEquals("ABC", result.element("10").orElseThrow().raw());
        assertEquals("290131", result.element("17").orElseThrow().raw());
        assertFalse(result.alternatives().isEmpty());
        assertTrue(result.hasDiagnostic(DiagnosticCode.AMBIGUOUS_PARSE));
        assertTrue(result.hasDiagnostic(DiagnosticCode.MISSING_SEPARATOR));
        assertTrue(result.coversInput(GS));

        for (Alternative alt : result.alternatives()) {
            assertNotEquals(result.aiOrder().toString() + result.element("10").orElseThrow().raw(),
                    alt.aiOrder().toString() + alt.elements().get(1).raw());
            assertTrue(alt.confidence() >= 0.0 && alt.confidence() <= 1.0);
        }
        result.diagnostics().stream()
                .filter(d -> d.code() == DiagnosticCode.AMBIGUOUS_PARSE)
                .forEach(d -> assertEquals(Severity.WARNING, d.severity()));
    }

    @Test
    void solverDisabledReturnsFastPathGuess()
    {
        Gs1Decoder noSolver = new DefaultGs1Decoder(DecoderOptions.builder().withAllowAmbiguous(false).build());
        ParseResult result = noSolver.decode("0106285096000842|10ABC17290131");

        assertEquals(ParseStrategy.FAST_PATH, result.strategy());
        assertEquals("ABC17290131", result.element("10").orElseThrow().raw());
        assertEquals(DefaultGs1Decoder.UNSOLVED_CONFIDENCE, result.confidence(), 1e-9);
        assertTrue(result.hasDiagnostic(DiagnosticCode.MISSING_SEPARATOR));
    }

    @Test
    void solverIsSkippedBeyondPositionBound()
    {
        Gs1Decoder bounded = new DefaultGs1Decoder(DecoderOptions.builder().withMaxSolverPositions(10).build());
        ParseResult result = bounded.decode("0106285096000842|10ABC17290131");

        assertEquals(ParseStrategy.FAST_PATH, result.strategy());
        assertEquals(DefaultGs1Decoder.UNSOLVED_CONFIDENCE, result.confidence(), 1e-9);
    }

    @Test
    void maxAlternativesBoundsTheList()
    {
        Gs1Decoder one = new DefaultGs1Decoder(DecoderOptions.builder().withMaxAlternatives(1).build());
        ParseResult result = one.decode("0106285096000842|10ABC17290131");
        assertTrue(result.alternatives().size() <= 1);
    }

    // ---------------------------------------------------------------------
    // No separators
    // ---------------------------------------------------------------------

    @Test
    void pharmaStringWithoutSeparators()
    {
        ParseResult result = decoder.decode("01062867400002491728043010GB2C2171490437969853");

        assertEquals(ParseStrategy.NO_SEPARATOR_BEAM, result.strategy());
        assertFalse(result.separatorsPresent());
        assertEquals(List.of("01", "17", "10", "21"), result.aiOrder());
        assertEquals("06286740000249", result.element("01").orElseThrow().raw());
        assertEquals("2028-04-30", result.element("17").orElseThrow().value());
        assertEquals("GB2C", result.element("10").orElseThrow().raw());
        assertEquals("71490437969853", result.element("21").orElseThrow().raw());
        assertTrue(result.hasDiagnostic(DiagnosticCode.MISSING_SEPARATOR));
        assertTrue(result.confidence() >= 0.5 && result.confidence() <= 1.0);
        assertTrue(result.coversInput(GS));
    }

    @Test
    void serialBeforeExpiryAndBatch()
    {
        ParseResult result = decoder.decode("01062911037315552164SSI54CE688QZ1727021410C601");

        assertEquals(List.of("01", "21", "17", "10"), result.aiOrder());
        assertEquals("64SSI54CE688QZ", result.element("21").orElseThrow().raw());
        assertEquals("270214", result.element("17").orElseThrow().raw());
        assertEquals("C601", result.element("10").orElseThrow().raw());
    }

    @Test
    void internalAiIsNotPreferredOverSerial()
    {
        ParseResult result = decoder.decode("010622300001036517270903103056442130564439945626");

        assertEquals("30564439945626", result.element("21").orElseThrow().raw());
        assertTrue(result.aiOrder().stream().noneMatch(ai -> ai.startsWith("9")));
    }

    @Test
    void expiryWithUnspecifiedDay()
    {
        ParseResult result = decoder.decode("010625115902606717290400104562202106902409792902");

        ParsedElement expiry = result.element("17").orElseThrow();
        assertTrue(expiry.isDayUnspecified());
        assertEquals("06902409792902", result.element("21").orElseThrow().raw());
        assertFalse(result.aiOrder().contains("90"));
    }

    @Test
    void singleGtinWithoutSeparators()
    {
        ParseResult result = decoder.decode("0106285096000842");

        assertEquals(List.of("01"), result.aiOrder());
        assertEquals(0.95, result.confidence(), 1e-9);
        assertTrue(result.alternatives().isEmpty());
    }

    @Test
    void beamMissFallsBackWithCappedConfidence()
    {
        ParseResult result = decoder.decode("3103001234");

        assertEquals(ParseStrategy.FALLBACK, result.strategy());
        assertEquals(List.of("3103"), result.aiOrder());
        assertEquals("1.234", result.element("3103").orElseThrow().value());
        assertTrue(result.confidence() <= DefaultGs1Decoder.FALLBACK_CONFIDENCE_CAP);
        assertTrue(result.hasDiagnostic(DiagnosticCode.MISSING_SEPARATOR));
    }

    @Test
    void truncatedInputWithoutSeparatorsStaysLowConfidence()
    {
        ParseResult result = decoder.decode("01062850960008");

        assertTrue(result.confidence() <= DefaultGs1Decoder.FALLBACK_CONFIDENCE_CAP);
        assertTrue(result.hasDiagnostic(DiagnosticCode.TRUNCATED_DATA));
    }

    // ---------------------------------------------------------------------
    // Custom catalogs
    // ---------------------------------------------------------------------

    @Test
    void trimmedCatalogWithoutInternalAisStillDecodes()
    {
        AiCatalog pharma = AiCatalog.fromText(
                "01 * N14,csum # GTIN\n" +
                "17 * N6,yymmd0 # EXP\n" +
                "10 X..20 # BATCH\n" +
                "21 X..20 # SERIAL\n");
        Gs1Decoder trimmed = new DefaultGs1Decoder(DecoderOptions.builder().withCatalog(pharma).build());

        ParseResult result = trimmed.decode("01062867400002491728043010GB2C2171490437969853");

        assertEquals(ParseStrategy.NO_SEPARATOR_BEAM, result.strategy());
        assertEquals(List.of("01", "17", "10", "21"), result.aiOrder());
        assertEquals("GB2C", result.element("10").orElseThrow().raw());
        assertEquals("71490437969853", result.element("21").orElseThrow().raw());
    }

    @Test
    void catalogWithNoBeamAisFallsBack()
    {
        AiCatalog weights = AiCatalog.fromText("310n * N6 # NET WEIGHT (kg)\n");
        Gs1Decoder trimmed = new DefaultGs1Decoder(DecoderOptions.builder().withCatalog(weights).build());

        ParseResult result = trimmed.decode("3103001234");

        assertEquals(ParseStrategy.FALLBACK, result.strategy());
        assertEquals(List.of("3103"), result.aiOrder());
        assertEquals("1.234", result.element("3103").orElseThrow().value());
    }

    // ---------------------------------------------------------------------
    // No parse and bounds
    // ---------------------------------------------------------------------

    @Test
    void emptyInputHasNoParse()
    {
        ParseResult result = decoder.decode("   ");

        assertTrue(result.empty());
        assertEquals(ParseStrategy.NONE, result.strategy());
        assertEquals(0.0, result.confidence());
        assertTrue(result.hasDiagnostic(DiagnosticCode.INVALID_FORMAT));
        assertEquals("No valid parse found", result.diagnostics().get(0).message());
    }

    @Test
    void unknownTextHasNoParse()
    {
        ParseResult result = decoder.decode("HELLO WORLD");
        assertTrue(result.empty());
        assertEquals(0.0, result.confidence());
    }

    @Test
    void nullInputIsRejected()
    {
        assertThrows(NullPointerException.class, () -> decoder.decode(null));
    }

    @Test
    void longDigitStringsTerminate()
    {
        String digits = "10".repeat(200);
        String separated = "0106285096000842" + GS + "10" + "1017".repeat(150);

        assertTimeoutPreemptively(Duration.ofSeconds(20), () ->
        {
            ParseResult a = decoder.decode(digits);
            ParseResult b = decoder.decode(separated);
            assertTrue(a.confidence() >= 0.0 && a.confidence() <= 1.0);
            assertEquals(DefaultGs1Decoder.UNSOLVED_CONFIDENCE, b.confidence(), 1e-9);
        });
    }

    @Test
    void longInternalAiRunFallsBackQuickly()
    {
        String nines = "9".repeat(250);

        ParseResult result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> decoder.decode(nines));

        assertEquals(ParseStrategy.FALLBACK, result.strategy());
        assertFalse(result.empty());
        assertTrue(result.aiOrder().stream().allMatch("99"::equals));
        assertTrue(result.confidence() <= DefaultGs1Decoder.FALLBACK_CONFIDENCE_CAP);
        assertTrue(result.coversInput(GS));
    }
}
