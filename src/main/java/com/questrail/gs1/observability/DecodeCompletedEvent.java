package com.questrail.gs1.observability;

import com.questrail.gs1.api.ParseResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing one finished decode.
 */
public record DecodeCompletedEvent(
    Instant timestamp,
    ParseResult result,
    Duration elapsed
) {
    /**
     * Checks if the decode produced no elements.
     */
    public boolean isNoParse() {
        return result.elements().isEmpty();
    }
}
