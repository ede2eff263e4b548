package com.questrail.gs1.api;

/**
 * Machine-readable diagnostic codes attached to a {@link ParseResult}.
 */
public enum DiagnosticCode
{
    /** No registered AI starts at the current position. */
    UNKNOWN_AI(Category.STRUCTURAL),

    /** A fixed-length value runs past the end of the input. */
    TRUNCATED_DATA(Category.STRUCTURAL),

    /** A separator appears where none is needed. */
    EXTRA_SEPARATOR(Category.STRUCTURAL),

    /** A variable-length field boundary had to be inferred. */
    MISSING_SEPARATOR(Category.STRUCTURAL),

    INVALID_CHECK_DIGIT(Category.SEMANTIC),
    INVALID_DATE(Category.SEMANTIC),
    INVALID_LENGTH(Category.SEMANTIC),
    INVALID_FORMAT(Category.SEMANTIC),

    /** More than one interpretation scored close to the chosen one. */
    AMBIGUOUS_PARSE(Category.AMBIGUITY);

    public enum Category
    {
        STRUCTURAL,
        SEMANTIC,
        AMBIGUITY
    }

    private final Category category;

    DiagnosticCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean structural() {
        return category == Category.STRUCTURAL;
    }
}
