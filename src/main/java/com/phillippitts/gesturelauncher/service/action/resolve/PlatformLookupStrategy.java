package com.phillippitts.gesturelauncher.service.action.resolve;

import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Treats the parameter as a logical program name and walks its candidate table: groups for the
 * current platform first, then every group as a fallback. Each candidate is tried as an
 * absolute path, then on the search path.
 */
final class PlatformLookupStrategy implements ResolutionStrategy {

    private final ProgramLookupTable table;
    private final Platform platform;
    private final PathSearch pathSearch;

    PlatformLookupStrategy(ProgramLookupTable table, Platform platform, PathSearch pathSearch) {
        this.table = Objects.requireNonNull(table);
        this.platform = Objects.requireNonNull(platform);
        this.pathSearch = Objects.requireNonNull(pathSearch);
    }

    @Override
    public String name() {
        return "platform-lookup";
    }

    @Override
    public Optional<Path> resolve(String program) {
        Map<String, List<String>> groups = table.candidates(program);
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            if (platform.matchesGroup(group.getKey())) {
                Optional<Path> hit = firstUsable(group.getValue());
                if (hit.isPresent()) {
                    return hit;
                }
            }
        }
        for (List<String> candidates : groups.values()) {
            Optional<Path> hit = firstUsable(candidates);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private Optional<Path> firstUsable(List<String> candidates) {
        for (String candidate : candidates) {
            Optional<Path> abs = AbsolutePathStrategy.existingAbsolute(candidate);
            if (abs.isPresent()) {
                return abs;
            }
            Optional<Path> onPath = pathSearch.which(candidate);
            if (onPath.isPresent()) {
                return onPath;
            }
        }
        return Optional.empty();
    }
}
