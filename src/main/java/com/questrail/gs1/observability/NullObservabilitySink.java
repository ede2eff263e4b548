package com.questrail.gs1.observability;

/**
 * No-op implementation of DecodeObservabilitySink.
 */
public final class NullObservabilitySink implements DecodeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCatalogLoaded(CatalogLoadedEvent event) {}

    @Override
    public void onCatalogRowRejected(CatalogRowRejectedEvent event) {}

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event) {}
}
