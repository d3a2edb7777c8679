package com.phillippitts.gesturelauncher.service.action.resolve;

import com.phillippitts.gesturelauncher.service.platform.PathSearch;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** Looks for an executable literally named like the parameter on the search path. */
final class PathSearchStrategy implements ResolutionStrategy {

    private final PathSearch pathSearch;

    PathSearchStrategy(PathSearch pathSearch) {
        this.pathSearch = Objects.requireNonNull(pathSearch);
    }

    @Override
    public String name() {
        return "path-search";
    }

    @Override
    public Optional<Path> resolve(String program) {
        return pathSearch.which(program);
    }
}
