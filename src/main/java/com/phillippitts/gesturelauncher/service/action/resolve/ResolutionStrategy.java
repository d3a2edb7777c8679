package com.phillippitts.gesturelauncher.service.action.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One step of executable resolution. Implementations are pure lookups against the file
 * system and must not throw.
 */
public interface ResolutionStrategy {
    /** Human-readable name for logs. */
    String name();

    /**
     * @param program configured program parameter (path, executable name or lookup key)
     * @return the executable to launch, or empty to let the next strategy try
     */
    Optional<Path> resolve(String program);
}
