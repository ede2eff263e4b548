package com.questrail.gs1.observability;

import com.questrail.gs1.api.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DecodeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDecodeObservabilitySink implements DecodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDecodeObservabilitySink.class);

    @Override
    public void onCatalogLoaded(CatalogLoadedEvent event) {
        log.info("GS1 catalog '{}' loaded: {} definitions, {} rows rejected",
            event.source(),
            event.definitions(),
            event.rejectedRows());
    }

    @Override
    public void onCatalogRowRejected(CatalogRowRejectedEvent event) {
        log.warn("GS1 catalog '{}' line {} skipped: {} [{}]",
            event.source(),
            event.lineNumber(),
            event.reason(),
            event.line());
    }

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event) {
        ParseResult result = event.result();
        if (event.isNoParse()) {
            log.debug("GS1 decode found nothing in '{}' ({} us)",
                result.input(),
                event.elapsed().toNanos() / 1_000);
            return;
        }
        log.debug("GS1 decode via {}: {} confidence={} diagnostics={} ({} us)",
            result.strategy(),
            result.aiOrder(),
            String.format("%.3f", result.confidence()),
            result.diagnostics().size(),
            event.elapsed().toNanos() / 1_000);
    }
}
