package com.questrail.gs1.api;

/**
 * Gs1Decoder
 * -----------------------------------------------------------------------------
 * Decodes a scanned GS1 element string into typed AI fields.
 *
 * <p>Implementations are immutable and safe to share between threads. Decoding
 * never throws for malformed scan data; problems are reported as
 * {@link Diagnostic}s on the returned {@link ParseResult}.</p>
 */
public interface Gs1Decoder
{
    /**
     * Decodes {@code input}, which may carry a symbology identifier and any of
     * the configured separator stand-ins.
     *
     * @throws NullPointerException if {@code input} is null
     */
    ParseResult decode(String input);
}
