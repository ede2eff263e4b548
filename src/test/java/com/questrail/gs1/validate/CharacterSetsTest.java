package com.questrail.gs1.validate;

import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.DiagnosticCode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class CharacterSetsTest
{
    @Test
    void cset82Membership()
    {
        for (char c : "AZaz09!\"%&'()*+,-./:;<=>?_".toCharArray()) {
            assertTrue(CharacterSets.isCset82(c), "expected in set 82: " + c);
        }
        for (char c : " #$@[]~\u001dé".toCharArray()) {
            assertFalse(CharacterSets.isCset82(c), "expected outside set 82: " + c);
        }
    }

    @Test
    void cset39Membership()
    {
        assertTrue(CharacterSets.isCset39('#'));
        assertTrue(CharacterSets.isCset39('-'));
        assertTrue(CharacterSets.isCset39('Q'));
        assertFalse(CharacterSets.isCset39('q'));
        assertFalse(CharacterSets.isCset39('+'));
    }

    @Test
    void numericCheck()
    {
        assertTrue(CharacterSets.isNumeric("0123"));
        assertFalse(CharacterSets.isNumeric(""));

        Optional<ValidationIssue> issue = CharacterSets.check(DataType.NUMERIC, "12a");
        assertTrue(issue.isPresent());
        assertEquals(DiagnosticCode.INVALID_FORMAT, issue.get().code());
        assertEquals("Value contains non-numeric characters", issue.get().message());
    }

    @Test
    void alphanumericCheckListsOffendingCharacters()
    {
        Optional<ValidationIssue> issue = CharacterSets.check(DataType.ALPHANUMERIC, "AB #C");
        assertTrue(issue.isPresent());
        assertTrue(issue.get().message().startsWith("Invalid characters: "));
        assertTrue(issue.get().message().contains("#"));

        assertTrue(CharacterSets.check(DataType.ALPHANUMERIC, "GB2C-01/x").isEmpty());
    }
}
