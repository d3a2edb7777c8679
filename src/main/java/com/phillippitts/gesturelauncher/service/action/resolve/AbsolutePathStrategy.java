package com.phillippitts.gesturelauncher.service.action.resolve;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/** Accepts the parameter itself when it is an absolute path that exists. */
final class AbsolutePathStrategy implements ResolutionStrategy {

    @Override
    public String name() {
        return "absolute-path";
    }

    @Override
    public Optional<Path> resolve(String program) {
        return existingAbsolute(program);
    }

    static Optional<Path> existingAbsolute(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            Path p = Path.of(candidate);
            return p.isAbsolute() && Files.exists(p) ? Optional.of(p) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
