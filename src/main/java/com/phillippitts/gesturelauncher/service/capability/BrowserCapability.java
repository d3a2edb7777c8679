package com.phillippitts.gesturelauncher.service.capability;

import java.io.IOException;
import java.net.URI;

/** Opens URLs in the user's default browser. */
public interface BrowserCapability {
    /** @return true if some route to a browser exists in the current environment */
    boolean isAvailable();

    /**
     * Requests the browser to open {@code uri}. Fire-and-forget: success means the request was
     * issued, not that the page loaded.
     *
     * @throws IOException if the request could not be issued
     */
    void open(URI uri) throws IOException;

    /** Name for logs/health. */
    String name();
}
