package com.questrail.gs1.catalog;

/**
 * Raised for a malformed catalog row. Never escapes the loader; the row is
 * skipped instead.
 */
final class CatalogFormatException extends Exception
{
    CatalogFormatException(String message)
    {
        super(message);
    }

    CatalogFormatException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
