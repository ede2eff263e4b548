package com.questrail.gs1.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * ApplicationIdentifier
 * -----------------------------------------------------------------------------
 * Immutable definition of a single GS1 Application Identifier (AI).
 *
 * <p>Definitions are produced once by the catalog loader and shared read-only
 * by every parse. Family rows of the syntax dictionary (e.g. {@code 310n}) are
 * expanded into one definition per concrete code before they reach this type,
 * so {@link #decimalPositions()} is already resolved.</p>
 *
 * <p>Component offsets ({@link #checkDigitSpan()}, {@link #dateSpan()}) are
 * only meaningful when every component before the one carrying the linter has
 * a fixed size, which holds for every row of the GS1 dictionary.</p>
 */
public final class ApplicationIdentifier
{
    private final String code;
    private final String title;
    private final DataType dataType;
    private final LengthPolicy lengthPolicy;
    private final boolean separatorRequired;
    private final boolean checkDigit;
    private final DateFormat dateFormat;
    private final Integer decimalPositions;
    private final List<String> requiredWith;
    private final List<String> exclusiveWith;
    private final List<SyntaxComponent> components;
    private final boolean digitalLinkKey;

    private ApplicationIdentifier(Builder b) {
        this.code = Objects.requireNonNull(b.code, "code");
        this.title = Objects.requireNonNull(b.title, "title");
        this.dataType = Objects.requireNonNull(b.dataType, "dataType");
        this.lengthPolicy = Objects.requireNonNull(b.lengthPolicy, "lengthPolicy");
        this.separatorRequired = b.separatorRequired;
        this.checkDigit = b.checkDigit;
        this.dateFormat = b.dateFormat;
        this.decimalPositions = b.decimalPositions;
        this.requiredWith = List.copyOf(b.requiredWith);
        this.exclusiveWith = List.copyOf(b.exclusiveWith);
        this.components = List.copyOf(b.components);
        this.digitalLinkKey = b.digitalLinkKey;

        if (code.length() < 2 || code.length() > 4 || !code.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("AI code must be 2-4 digits: " + code);
        }
    }

    public static Builder builder(String code) {
        return new Builder(code);
    }

    public String code() {
        return code;
    }

    public String title() {
        return title;
    }

    public DataType dataType() {
        return dataType;
    }

    public LengthPolicy lengthPolicy() {
        return lengthPolicy;
    }

    public boolean fixedLength() {
        return lengthPolicy.fixed();
    }

    public int minLength() {
        return lengthPolicy.min();
    }

    public int maxLength() {
        return lengthPolicy.max();
    }

    /**
     * Returns true if a separator must terminate this field when it is not the
     * last element of the string.
     */
    public boolean separatorRequired() {
        return separatorRequired;
    }

    public boolean checkDigit() {
        return checkDigit;
    }

    public Optional<DateFormat> dateFormat() {
        return Optional.ofNullable(dateFormat);
    }

    /**
     * Number of implied decimal places for weight/measure/amount AIs.
     */
    public OptionalInt decimalPositions() {
        return decimalPositions == null ? OptionalInt.empty() : OptionalInt.of(decimalPositions);
    }

    /** AIs that should accompany this one in the same element string. */
    public List<String> requiredWith() {
        return requiredWith;
    }

    /** AIs that must not appear together with this one. */
    public List<String> exclusiveWith() {
        return exclusiveWith;
    }

    public List<SyntaxComponent> components() {
        return components;
    }

    public boolean digitalLinkKey() {
        return digitalLinkKey;
    }

    /**
     * Returns true for the internal-use codes 90 through 99.
     */
    public boolean internalUse() {
        return code.length() == 2 && code.charAt(0) == '9';
    }

    /**
     * Returns {offset, length} of the component carrying the Mod-10 check
     * digit, or empty if there is none. Without component detail the whole
     * fixed field is assumed.
     */
    public Optional<int[]> checkDigitSpan() {
        if (!checkDigit) {
            return Optional.empty();
        }
        Optional<int[]> span = spanOfLinter("csum");
        if (span.isPresent()) {
            return span;
        }
        return Optional.of(new int[] { 0, lengthPolicy.max() });
    }

    /**
     * Returns {offset, length} of the component carrying the date, or empty if
     * this AI has no date format.
     */
    public Optional<int[]> dateSpan() {
        if (dateFormat == null) {
            return Optional.empty();
        }
        Optional<int[]> span = spanOfLinter(dateFormat.linter());
        if (span.isPresent()) {
            return span;
        }
        return Optional.of(new int[] { 0, lengthPolicy.max() });
    }

    private Optional<int[]> spanOfLinter(String linter) {
        int offset = 0;
        for (SyntaxComponent component : components) {
            if (component.hasLinter(linter)) {
                return Optional.of(new int[] { offset, component.max() });
            }
            if (!component.fixedSize()) {
                return Optional.empty();
            }
            offset += component.max();
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApplicationIdentifier other)) return false;
        return code.equals(other.code)
                && title.equals(other.title)
                && lengthPolicy.equals(other.lengthPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, title, lengthPolicy);
    }

    @Override
    public String toString() {
        return "ApplicationIdentifier[" +
                "code=" + code +
                ", title=" + title +
                ", type=" + dataType.tag() +
                ", length=" + lengthPolicy +
                (checkDigit ? ", csum" : "") +
                (dateFormat != null ? ", date=" + dateFormat : "") +
                (decimalPositions != null ? ", decimals=" + decimalPositions : "") +
                ']';
    }

    public static final class Builder
    {
        private final String code;
        private String title;
        private DataType dataType = DataType.ALPHANUMERIC;
        private LengthPolicy lengthPolicy;
        private boolean separatorRequired = true;
        private boolean checkDigit;
        private DateFormat dateFormat;
        private Integer decimalPositions;
        private List<String> requiredWith = new ArrayList<>();
        private List<String> exclusiveWith = new ArrayList<>();
        private List<SyntaxComponent> components = new ArrayList<>();
        private boolean digitalLinkKey;

        private Builder(String code) {
            this.code = code;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder dataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        /**
         * Sets the length policy. A fixed policy also clears the
         * separator-required flag.
         */
        public Builder lengthPolicy(LengthPolicy lengthPolicy) {
            this.lengthPolicy = lengthPolicy;
            this.separatorRequired = !lengthPolicy.fixed();
            return this;
        }

        /**
         * Overrides the flag derived from the length policy. Must be called
         * after {@link #lengthPolicy(LengthPolicy)}.
         */
        public Builder separatorRequired(boolean separatorRequired) {
            this.separatorRequired = separatorRequired;
            return this;
        }

        public Builder checkDigit(boolean checkDigit) {
            this.checkDigit = checkDigit;
            return this;
        }

        public Builder dateFormat(DateFormat dateFormat) {
            this.dateFormat = dateFormat;
            return this;
        }

        public Builder decimalPositions(Integer decimalPositions) {
            this.decimalPositions = decimalPositions;
            return this;
        }

        public Builder requiredWith(List<String> requiredWith) {
            this.requiredWith = new ArrayList<>(requiredWith);
            return this;
        }

        public Builder exclusiveWith(List<String> exclusiveWith) {
            this.exclusiveWith = new ArrayList<>(exclusiveWith);
            return this;
        }

        public Builder components(List<SyntaxComponent> components) {
            this.components = new ArrayList<>(components);
            return this;
        }

        public Builder digitalLinkKey(boolean digitalLinkKey) {
            this.digitalLinkKey = digitalLinkKey;
            return this;
        }

        public ApplicationIdentifier build() {
            return new ApplicationIdentifier(this);
        }
    }
}
