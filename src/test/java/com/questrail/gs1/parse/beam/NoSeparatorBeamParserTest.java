package com.questrail.gs1.parse.beam;

import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.config.ScoringWeights;
import com.questrail.gs1.parse.Candidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class NoSeparatorBeamParserTest
{
    private final NoSeparatorBeamParser parser = new NoSeparatorBeamParser(DecoderOptions.defaults());

    @Test
    void standardOrderScoresEveryPreference()
    {
        BeamOutcome outcome = parser.parse("01062867400002491728043010GB2C2171490437969853");

        assertTrue(outcome.found());
        Candidate best = outcome.best();
        assertEquals(List.of("01", "17", "10", "21"), best.aiOrder());
        // 1000 + 250 + 15 + 20 + 120 + 30 + 15 + 10
        assertEquals(1460.0, best.score(), 1e-9);
        assertTrue(best.reasoning().contains("+1000: Valid GTIN with correct check digit"));
        assertTrue(outcome.confidence() >= 0.5 && outcome.confidence() <= 1.0);
    }

    @Test
    void rankedByDescendingScore()
    {
        BeamOutcome outcome = parser.parse("01062867400002491728043010GB2C2171490437969853");
        List<Candidate> ranked = outcome.ranked();
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score());
        }
        if (ranked.size() > 1) {
            assertEquals(ranked.get(0).score() - ranked.get(1).score(), outcome.gap(), 1e-9);
        }
    }

    @Test
    void singleCompletionHasFixedConfidence()
    {
        BeamOutcome outcome = parser.parse("0106285096000842");

        assertEquals(1, outcome.ranked().size());
        assertEquals(NoSeparatorBeamParser.SINGLE_CANDIDATE_CONFIDENCE, outcome.confidence(), 1e-9);
        assertFalse(outcome.ambiguous());
        assertEquals(Double.POSITIVE_INFINITY, outcome.gap());
    }

    /*
     * "10AB21CD" completes two ways:
     *   10=AB21CD          +20 batch length, +10 compact            =  30
     *   10=AB, 21=CD       +20 batch length, -50 short serial, +10  = -20
     */
    private static final String TWO_WAY_SPLIT = "10AB21CD";

    @Test
    void competingCompletionsUseGapConfidence()
    {
        BeamOutcome outcome = parser.parse(TWO_WAY_SPLIT);

        assertEquals(2, outcome.ranked().size());
        assertEquals(List.of("10"), outcome.best().aiOrder());
        assertEquals(30.0, outcome.best().score(), 1e-9);
        assertEquals(List.of("10", "21"), outcome.ranked().get(1).aiOrder());
        assertEquals(-20.0, outcome.ranked().get(1).score(), 1e-9);
        assertEquals(50.0, outcome.gap(), 1e-9);
        // 1 / (1 + 50 / 51)
        assertEquals(51.0 / 101.0, outcome.confidence(), 1e-12);
        assertFalse(outcome.ambiguous());
    }

    @Test
    void gapBelowThresholdIsAmbiguous()
    {
        DecoderOptions wide = DecoderOptions.builder()
                .withScoringWeights(ScoringWeights.builder().withAmbiguityGap(60).build())
                .build();

        BeamOutcome outcome = new NoSeparatorBeamParser(wide).parse(TWO_WAY_SPLIT);

        assertTrue(outcome.ambiguous());
        assertEquals(50.0, outcome.gap(), 1e-9);
        assertEquals(51.0 / 101.0, outcome.confidence(), 1e-12);
    }

    @Test
    void tiedCompletionsFloorConfidenceAtHalf()
    {
        NoSeparatorBeamParser unscored = new NoSeparatorBeamParser(DecoderOptions.defaults(), ScoringRules.of(List.of()));

        BeamOutcome outcome = unscored.parse(TWO_WAY_SPLIT);

        assertEquals(2, outcome.ranked().size());
        assertEquals(0.0, outcome.gap(), 1e-9);
        assertTrue(outcome.ambiguous());
        // 1 / (1 + 50 / 1) is below the floor
        assertEquals(0.5, outcome.confidence(), 1e-12);
        // ties keep completion order: the single-field split finishes a round earlier
        assertEquals(List.of("10"), outcome.best().aiOrder());
    }

    @Test
    void invalidGtinNeverCompletes()
    {
        BeamOutcome outcome = parser.parse("0106285096000843");
        assertFalse(outcome.found());
        assertThrows(IllegalStateException.class, outcome::best);
    }

    @Test
    void nonBeamAisFindNothing()
    {
        assertFalse(parser.parse("3103001234").found());
        assertEquals(0.0, parser.parse("3103001234").confidence());
    }

    @Test
    void iterationCapBoundsTheSearch()
    {
        NoSeparatorBeamParser shallow = new NoSeparatorBeamParser(
                DecoderOptions.builder().withMaxBeamIterations(1).build());

        // one round can place only the GTIN
        assertFalse(shallow.parse("01062867400002491728043010GB2C2171490437969853").found());
        assertTrue(shallow.parse("0106285096000842").found());
    }

    @Test
    void customRuleTableIsUsed()
    {
        ScoringRules flat = ScoringRules.of(List.of());
        NoSeparatorBeamParser unscored = new NoSeparatorBeamParser(DecoderOptions.defaults(), flat);

        BeamOutcome outcome = unscored.parse("0106285096000842");
        assertEquals(0.0, outcome.best().score());
        assertTrue(outcome.best().reasoning().isEmpty());
    }
}
