package com.questrail.gs1.observability;

import java.time.Instant;

/**
 * Record describing a completed catalog build.
 */
public record CatalogLoadedEvent(
    Instant timestamp,
    String source,
    int definitions,
    int rejectedRows
) {
}
