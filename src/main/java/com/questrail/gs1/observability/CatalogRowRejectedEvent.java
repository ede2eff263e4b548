package com.questrail.gs1.observability;

import java.time.Instant;

/**
 * Record describing a catalog row that was skipped because it could not be parsed.
 */
public record CatalogRowRejectedEvent(
    Instant timestamp,
    String source,
    int lineNumber,
    String line,
    String reason
) {
}
