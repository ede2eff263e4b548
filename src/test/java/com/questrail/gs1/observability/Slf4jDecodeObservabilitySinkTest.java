package com.questrail.gs1.observability;

import com.questrail.gs1.api.ParseResult;
import com.questrail.gs1.config.DecoderOptions;
import com.questrail.gs1.parse.DefaultGs1Decoder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jDecodeObservabilitySinkTest
{
    @Test
    void logsEveryEventKindWithoutFailing()
    {
        Slf4jDecodeObservabilitySink sink = new Slf4jDecodeObservabilitySink();
        ParseResult empty = new DefaultGs1Decoder().decode("");

        assertDoesNotThrow(() -> sink.onCatalogLoaded(new CatalogLoadedEvent(Instant.now(), "inline", 3, 1)));
        assertDoesNotThrow(() -> sink.onCatalogRowRejected(
                new CatalogRowRejectedEvent(Instant.now(), "inline", 4, "zz X..5 # BAD", "Bad AI code 'zz'")));
        assertDoesNotThrow(() -> sink.onDecodeCompleted(new DecodeCompletedEvent(Instant.now(), empty, Duration.ZERO)));
    }

    @Test
    void decoderReportsEveryDecodeToItsSink()
    {
        RecordingDecodeObservabilitySink sink = new RecordingDecodeObservabilitySink();
        DefaultGs1Decoder decoder = new DefaultGs1Decoder(
                DecoderOptions.builder().withObservabilitySink(sink).build());

        decoder.decode("0106285096000842");
        decoder.decode("");

        List<DecodeCompletedEvent> events = sink.getEvents(DecodeCompletedEvent.class);
        assertEquals(2, events.size());
        assertFalse(events.get(0).isNoParse());
        assertTrue(events.get(1).isNoParse());
        assertFalse(events.get(0).elapsed().isNegative());
    }
}
