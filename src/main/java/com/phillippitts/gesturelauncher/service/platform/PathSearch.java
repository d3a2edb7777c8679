package com.phillippitts.gesturelauncher.service.platform;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Looks up executables on a PATH-style search list, the way a shell does.
 *
 * <p>On Windows a bare name is also tried with every {@code PATHEXT} extension.
 * A name containing a path separator is checked directly and never searched.
 *
 * <p>Stateless after construction and thread-safe. Tests construct it with a synthetic
 * search path to stay hermetic.
 */
public final class PathSearch {

    private static final Logger LOG = LogManager.getLogger(PathSearch.class);
    private static final String DEFAULT_PATHEXT = ".COM;.EXE;.BAT;.CMD";

    private final List<Path> directories;
    private final Platform platform;
    private final List<String> extensions;

    public PathSearch(String searchPath, Platform platform, String pathExt) {
        this.platform = platform;
        this.directories = split(searchPath);
        List<String> ext = new ArrayList<>();
        if (platform == Platform.WINDOWS) {
            String raw = (pathExt == null || pathExt.isBlank()) ? DEFAULT_PATHEXT : pathExt;
            for (String e : raw.split(";")) {
                if (!e.isBlank()) {
                    ext.add(e.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.extensions = List.copyOf(ext);
    }

    /** Builds a search over the process {@code PATH} (and {@code PATHEXT} on Windows). */
    public static PathSearch fromEnvironment(Platform platform) {
        return new PathSearch(System.getenv("PATH"), platform, System.getenv("PATHEXT"));
    }

    /**
     * @param name executable name, or a relative/absolute path containing a separator
     * @return absolute path of the first matching executable file
     */
    public Optional<Path> which(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            if (name.indexOf('/') >= 0 || name.indexOf(File.separatorChar) >= 0) {
                Path direct = Path.of(name);
                return isExecutableFile(direct) ? Optional.of(direct.toAbsolutePath()) : Optional.empty();
            }
            for (Path dir : directories) {
                for (String candidate : candidateNames(name)) {
                    Path p = dir.resolve(candidate);
                    if (isExecutableFile(p)) {
                        return Optional.of(p.toAbsolutePath());
                    }
                }
            }
        } catch (InvalidPathException e) {
            LOG.debug("Ignoring unusable executable name '{}': {}", name, e.getMessage());
        }
        return Optional.empty();
    }

    public Platform platform() {
        return platform;
    }

    private List<String> candidateNames(String name) {
        if (extensions.isEmpty()) {
            return List.of(name);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext)) {
                return List.of(name);
            }
        }
        List<String> names = new ArrayList<>(extensions.size() + 1);
        for (String ext : extensions) {
            names.add(name + ext);
        }
        names.add(name);
        return names;
    }

    private static boolean isExecutableFile(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }

    private static List<Path> split(String searchPath) {
        if (searchPath == null || searchPath.isBlank()) {
            return List.of();
        }
        List<Path> dirs = new ArrayList<>();
        for (String entry : searchPath.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                dirs.add(Path.of(entry.trim()));
            } catch (InvalidPathException e) {
                LOG.debug("Skipping invalid PATH entry '{}'", entry);
            }
        }
        return List.copyOf(dirs);
    }
}
