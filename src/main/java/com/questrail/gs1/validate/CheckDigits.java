package com.questrail.gs1.validate;

import com.questrail.gs1.api.DiagnosticCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CheckDigits
 * -----------------------------------------------------------------------------
 * GS1 Mod-10 check digit, as used by GTIN, SSCC, GLN, GSIN, GDTI and the
 * other {@code csum} keys.
 *
 * <p>From the rightmost data digit leftwards the weights alternate 3, 1, 3,
 * 1... The check digit is {@code (10 - sum mod 10) mod 10}.</p>
 */
public final class CheckDigits
{
    private CheckDigits() {}

    /**
     * Computes the check digit for {@code digits} (data digits only).
     *
     * @throws IllegalArgumentException if {@code digits} is empty or not numeric
     */
    public static int compute(CharSequence digits)
    {
        if (digits.length() == 0) {
            throw new IllegalArgumentException("No digits");
        }
        int sum = 0;
        int weight = 3;
        for (int i = digits.length() - 1; i >= 0; i--) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Non-digit '" + c + "'");
            }
            sum += (c - '0') * weight;
            weight = 4 - weight;
        }
        return (10 - sum % 10) % 10;
    }

    /**
     * Returns true if the last digit of {@code value} is the check digit of
     * the digits before it. Never throws.
     */
    public static boolean isValid(CharSequence value)
    {
        if (value.length() < 2 || !CharacterSets.isNumeric(value)) {
            return false;
        }
        int provided = value.charAt(value.length() - 1) - '0';
        return compute(value.subSequence(0, value.length() - 1)) == provided;
    }

    /**
     * Validates {@code value} (data digits followed by the check digit).
     */
    public static ValidationResult validate(String value)
    {
        if (!CharacterSets.isNumeric(value)) {
            return ValidationResult.failure(DiagnosticCode.INVALID_FORMAT,
                    "Value must be numeric for check digit validation");
        }
        if (value.length() < 2) {
            return ValidationResult.failure(DiagnosticCode.INVALID_LENGTH,
                    "Value too short for check digit validation");
        }
        int provided = value.charAt(value.length() - 1) - '0';
        int calculated = compute(value.substring(0, value.length() - 1));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(MetaKeys.CALCULATED_CHECK_DIGIT, calculated);
        meta.put(MetaKeys.PROVIDED_CHECK_DIGIT, provided);
        meta.put(MetaKeys.CHECK_DIGIT_VALID, provided == calculated);

        if (provided != calculated) {
            return ValidationResult.failure(DiagnosticCode.INVALID_CHECK_DIGIT,
                    "Check digit mismatch: expected " + calculated + ", got " + provided, meta);
        }
        return ValidationResult.ok(meta);
    }

    /**
     * Returns {@code digits} followed by its check digit.
     */
    public static String append(String digits)
    {
        return digits + compute(digits);
    }
}
