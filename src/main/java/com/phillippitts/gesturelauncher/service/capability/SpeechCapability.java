package com.phillippitts.gesturelauncher.service.capability;

import java.io.IOException;

/** Text-to-speech engine. Speaking enqueues the utterance and returns without waiting. */
public interface SpeechCapability extends AutoCloseable {

    void speak(String text) throws IOException;

    /** Name for logs/health. */
    String name();

    /** Releases the engine handle. */
    @Override
    void close();
}
