package com.questrail.gs1.parse.beam;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.catalog.AiCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LengthPlannerTest
{
    private final LengthPlanner planner = new LengthPlanner(NoSeparatorBeamParser.BEAM_CODES);

    private static ApplicationIdentifier ai(String code)
    {
        return AiCatalog.standard().lookup(code).orElseThrow();
    }

    @Test
    void stopsWhereABeamCodeStartsOrAtTheEnd()
    {
        // value starts at 2: "GB2C21ABC"
        List<Integer> lengths = planner.lengths("10GB2C21ABC", 2, ai("10"));
        assertEquals(List.of(4, 9), lengths);
    }

    @Test
    void internalAiTriesNarrowWindow()
    {
        String text = "91" + "X".repeat(40);
        List<Integer> lengths = planner.lengths(text, 2, ai("91"));
        assertEquals(LengthPlanner.INTERNAL_WINDOW, lengths.size());
        assertEquals(1, lengths.get(0));
        assertEquals(10, lengths.get(lengths.size() - 1));
    }

    @Test
    void noRoomGivesNoLengths()
    {
        assertTrue(planner.lengths("10", 2, ai("10")).isEmpty());
    }
}
