package com.phillippitts.gesturelauncher.service.source;

import java.io.IOException;
import java.util.Optional;

/**
 * Feed of per-frame observations from the external hand tracker.
 *
 * Provides a test seam so the tick loop can be driven by a scripted sequence of ticks.
 */
public interface ObservationSource extends AutoCloseable {

    /**
     * Opens the feed. Called once before the first {@link #next()}.
     *
     * @throws com.phillippitts.gesturelauncher.exception.ObservationSourceException if the feed
     *         cannot be opened
     */
    void open();

    /**
     * Blocks until the next frame arrives.
     *
     * @return the next tick, or empty at end of stream
     * @throws IOException if the feed fails while reading
     */
    Optional<Tick> next() throws IOException;

    /** Human-readable description for logs. */
    String describe();

    @Override
    void close();
}
