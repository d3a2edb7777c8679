package com.phillippitts.gesturelauncher.service.capability;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so capabilities can be tested without spawning
 * real processes.
 *
 * <p>Production code uses {@link DefaultProcessLauncher}.
 */
public interface ProcessLauncher {
    /**
     * Starts a detached process and returns immediately; never waits for it to finish.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process launch(List<String> command) throws IOException;
}
