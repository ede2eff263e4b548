package com.questrail.gs1.validate;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.DateFormat;
import com.questrail.gs1.api.Diagnostic;
import com.questrail.gs1.api.DiagnosticCode;
import com.questrail.gs1.api.LengthPolicy;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.api.SyntaxComponent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ElementValidator
 * -----------------------------------------------------------------------------
 * Validates one AI value against its definition and builds the resulting
 * {@link ParsedElement}.
 *
 * <p>Checks run in this order:</p>
 * <ol>
 *   <li>length against the definition's {@link LengthPolicy}</li>
 *   <li>character set per syntax component</li>
 *   <li>Mod-10 check digit on the {@code csum} component</li>
 *   <li>date on the component carrying the date linter</li>
 *   <li>implied decimal places</li>
 * </ol>
 *
 * <p>Steps 3 to 5 only run when the value is well-formed. Failures are
 * recorded on the element; nothing here throws on scan data.</p>
 */
public final class ElementValidator
{
    private final int centuryPivot;

    public ElementValidator()
    {
        this(DateDecoder.DEFAULT_CENTURY_PIVOT);
    }

    public ElementValidator(int centuryPivot)
    {
        if (centuryPivot < 0 || centuryPivot > 99) {
            throw new IllegalArgumentException("centuryPivot must be 0-99");
        }
        this.centuryPivot = centuryPivot;
    }

    public int centuryPivot()
    {
        return centuryPivot;
    }

    /**
     * Builds the element for {@code definition} whose AI digits start at
     * {@code start} in the normalized input and whose value is {@code raw}.
     */
    public ParsedElement element(ApplicationIdentifier definition, String raw, int start)
    {
        ValidationResult result = validate(definition, raw);
        int end = start + definition.code().length() + raw.length();
        List<Diagnostic> issues = new ArrayList<>(result.issues().size());
        for (ValidationIssue issue : result.issues()) {
            issues.add(Diagnostic.error(issue.code(), issue.message(), start, definition.code()));
        }
        return new ParsedElement(
                definition.code(),
                definition.title(),
                raw,
                normalize(raw, result),
                result.valid(),
                issues,
                result.metadata(),
                start,
                end);
    }

    public ValidationResult validate(ApplicationIdentifier definition, String value)
    {
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, Object> meta = new LinkedHashMap<>();

        lengthIssue(definition.lengthPolicy(), value.length()).ifPresent(issues::add);
        charsetIssue(definition, value).ifPresent(issues::add);
        if (!issues.isEmpty()) {
            return new ValidationResult(issues, meta);
        }

        Optional<int[]> csum = definition.checkDigitSpan();
        if (csum.isPresent()) {
            collect(CheckDigits.validate(slice(value, csum.get())), issues, meta);
        }

        Optional<DateFormat> format = definition.dateFormat();
        Optional<int[]> dateSpan = definition.dateSpan();
        if (format.isPresent() && dateSpan.isPresent()) {
            String date = slice(value, dateSpan.get());
            collect(DateDecoder.decode(date, format.get(), centuryPivot), issues, meta);
        }

        if (definition.decimalPositions().isPresent()) {
            String digits = decimalDigits(definition, value);
            if (CharacterSets.isNumeric(digits)) {
                DecimalValue decimal = DecimalDecoder.decode(digits, definition.decimalPositions().getAsInt());
                meta.put(MetaKeys.DECIMAL_VALUE, decimal.value());
                meta.put(MetaKeys.DECIMAL_FORMATTED, decimal.formatted());
                meta.put(MetaKeys.DECIMAL_POSITIONS, decimal.positions());
            }
        }

        return new ValidationResult(issues, meta);
    }

    private static Optional<ValidationIssue> lengthIssue(LengthPolicy policy, int length)
    {
        if (length == 0 && policy.min() > 0) {
            return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_LENGTH,
                    "Value is empty but minimum length required"));
        }
        if (policy.fixed()) {
            if (length != policy.max()) {
                return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_LENGTH,
                        "Length must be exactly " + policy.max() + ", got " + length));
            }
            return Optional.empty();
        }
        if (length < policy.min()) {
            return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_LENGTH,
                    "Length " + length + " below minimum " + policy.min()));
        }
        if (length > policy.max()) {
            return Optional.of(new ValidationIssue(DiagnosticCode.INVALID_LENGTH,
                    "Length " + length + " exceeds maximum " + policy.max()));
        }
        return Optional.empty();
    }

    private static Optional<ValidationIssue> charsetIssue(ApplicationIdentifier definition, String value)
    {
        List<SyntaxComponent> components = definition.components();
        if (components.size() <= 1) {
            return CharacterSets.check(definition.dataType(), value);
        }
        int offset = 0;
        for (SyntaxComponent c : components) {
            if (offset >= value.length()) {
                break;
            }
            int end = Math.min(value.length(), offset + c.max());
            Optional<ValidationIssue> issue = CharacterSets.check(c.type(), value.substring(offset, end));
            if (issue.isPresent()) {
                return issue;
            }
            offset = end;
        }
        if (offset < value.length()) {
            return CharacterSets.check(definition.dataType(), value.substring(offset));
        }
        return Optional.empty();
    }

    /**
     * The implied decimal places apply to the last component, which is the
     * whole value for single-component AIs.
     */
    private static String decimalDigits(ApplicationIdentifier definition, String value)
    {
        List<SyntaxComponent> components = definition.components();
        int offset = 0;
        for (int i = 0; i < components.size() - 1; i++) {
            offset += components.get(i).max();
        }
        return offset < value.length() ? value.substring(offset) : "";
    }

    private static String slice(String value, int[] span)
    {
        int from = Math.min(span[0], value.length());
        int to = Math.min(span[0] + span[1], value.length());
        return value.substring(from, to);
    }

    private static void collect(ValidationResult result, List<ValidationIssue> issues, Map<String, Object> meta)
    {
        issues.addAll(result.issues());
        meta.putAll(result.metadata());
    }

    private static String normalize(String raw, ValidationResult result)
    {
        Map<String, Object> meta = result.metadata();
        if (result.valid()) {
            Object dateTime = meta.get(MetaKeys.ISO_DATE_TIME);
            if (dateTime != null) {
                return dateTime.toString();
            }
            Object date = meta.get(MetaKeys.ISO_DATE);
            if (date != null) {
                return date.toString();
            }
        }
        Object decimal = meta.get(MetaKeys.DECIMAL_VALUE);
        if (decimal != null) {
            return ((BigDecimal) decimal).toPlainString();
        }
        return raw;
    }
}
