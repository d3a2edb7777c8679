package com.phillippitts.gesturelauncher.service.action.resolve;

import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a configured program to an executable by trying strategies in order until one
 * succeeds. Standard order: absolute path → search path → per-platform lookup table.
 */
public final class ExecutableResolver {

    private static final Logger LOG = LogManager.getLogger(ExecutableResolver.class);

    private final List<ResolutionStrategy> strategies;

    public ExecutableResolver(List<ResolutionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one resolution strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static ExecutableResolver standard(PathSearch pathSearch, ProgramLookupTable table, Platform platform) {
        return new ExecutableResolver(List.of(
                new AbsolutePathStrategy(),
                new PathSearchStrategy(pathSearch),
                new PlatformLookupStrategy(table, platform, pathSearch)));
    }

    /**
     * @param program configured program parameter
     * @return the first executable any strategy finds, or empty
     */
    public Optional<Path> resolve(String program) {
        if (program == null || program.isBlank()) {
            return Optional.empty();
        }
        for (ResolutionStrategy s : strategies) {
            Optional<Path> hit = s.resolve(program);
            if (hit.isPresent()) {
                LOG.debug("Resolved '{}' via {} -> {}", program, s.name(), hit.get());
                return hit;
            }
        }
        LOG.debug("No strategy resolved '{}' (tried {})", program, strategyNames());
        return Optional.empty();
    }

    List<String> strategyNames() {
        return strategies.stream().map(ResolutionStrategy::name).toList();
    }
}
