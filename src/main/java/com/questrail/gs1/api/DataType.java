package com.questrail.gs1.api;

/**
 * Character class of an Application Identifier's data field.
 *
 * <p>The single-letter tags are those used by the GS1 Barcode Syntax
 * Dictionary ({@code N}, {@code X}, {@code Y}).</p>
 */
public enum DataType
{
    /** Digits only. */
    NUMERIC('N'),

    /** GS1 AI encodable character set 82. */
    ALPHANUMERIC('X'),

    /** GS1 AI encodable character set 39. */
    RESTRICTED_ALPHANUMERIC('Y');

    private final char tag;

    DataType(char tag) {
        this.tag = tag;
    }

    public char tag() {
        return tag;
    }

    /**
     * Resolves a syntax dictionary tag.
     *
     * @throws IllegalArgumentException if the tag is not N, X or Y
     */
    public static DataType fromTag(char tag) {
        for (DataType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type tag: " + tag);
    }
}
