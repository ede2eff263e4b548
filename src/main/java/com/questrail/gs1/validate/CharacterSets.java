package com.questrail.gs1.validate;

import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.DiagnosticCode;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * GS1 AI encodable character sets 82 and 39.
 */
public final class CharacterSets
{
    private static final String CSET82 =
            "!\"%&'()*+,-./0123456789:;<=>?"
            + "ABCDEFGHIJKLMNOPQRSTUVWXYZ_"
            + "abcdefghijklmnopqrstuvwxyz";

    private static final String CSET39 = "#-/0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final boolean[] IN_CSET82 = table(CSET82);
    private static final boolean[] IN_CSET39 = table(CSET39);

    private CharacterSets() {}

    private static boolean[] table(String chars)
    {
        boolean[] t = new boolean[128];
        for (int i = 0; i < chars.length(); i++) {
            t[chars.charAt(i)] = true;
        }
        return t;
    }

    public static boolean isCset82(char c)
    {
        return c < 128 && IN_CSET82[c];
    }

    public static boolean isCset39(char c)
    {
        return c < 128 && IN_CSET39[c];
    }

    public static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    /**
     * Returns true if {@code s} is non-empty and all digits.
     */
    public static boolean isNumeric(CharSequence s)
    {
        if (s.length() == 0) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean accepts(DataType type, char c)
    {
        switch (type) {
            case NUMERIC:
                return isDigit(c);
            case RESTRICTED_ALPHANUMERIC:
                return isCset39(c);
            case ALPHANUMERIC:
            default:
                return isCset82(c);
        }
    }

    /**
     * Checks every character of {@code value} against {@code type}.
     *
     * @return the issue, or empty if all characters are allowed
     */
    public static Optional<ValidationIssue> check(DataType type, CharSequence value)
    {
        Set<Character> invalid = new TreeSet<>();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!accepts(type, c)) {
                invalid.add(c);
            }
        }
        if (invalid.isEmpty()) {
            return Optional.empty();
        }
        if (type == DataType.NUMERIC) {
            return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_FORMAT,
                    "Value contains non-numeric characters"));
        }
        return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_FORMAT,
                "Invalid characters: " + invalid));
    }
}
