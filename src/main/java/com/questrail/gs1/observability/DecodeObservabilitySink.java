package com.questrail.gs1.observability;

/**
 * Main interface for receiving decoder observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DecodeObservabilitySink {
    /**
     * Called once a catalog has been built.
     * @param event the load summary
     */
    void onCatalogLoaded(CatalogLoadedEvent event);

    /**
     * Called when a catalog row is malformed and skipped.
     * @param event the rejected row details
     */
    void onCatalogRowRejected(CatalogRowRejectedEvent event);

    /**
     * Called after every decode, including decodes that found nothing.
     * @param event the decode summary
     */
    void onDecodeCompleted(DecodeCompletedEvent event);
}
