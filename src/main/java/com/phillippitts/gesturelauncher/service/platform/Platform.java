package com.phillippitts.gesturelauncher.service.platform;

import java.util.Locale;

/**
 * Host operating system family. Each family has a short id used as the key of per-platform
 * candidate lists ({@code win32}, {@code darwin}, {@code linux}).
 */
public enum Platform {
    WINDOWS("win32"),
    MACOS("darwin"),
    LINUX("linux"),
    OTHER("other");

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * A candidate group applies to this platform when its key is a prefix of the platform id,
     * so "win" matches win32 and "linux" matches linux.
     */
    public boolean matchesGroup(String groupKey) {
        if (groupKey == null || groupKey.isBlank()) {
            return false;
        }
        return id.startsWith(groupKey.trim().toLowerCase(Locale.ROOT));
    }

    public static Platform current() {
        return fromOsName(System.getProperty("os.name"));
    }

    static Platform fromOsName(String osName) {
        if (osName == null) {
            return OTHER;
        }
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return WINDOWS;
        }
        if (os.startsWith("mac") || os.startsWith("darwin")) {
            return MACOS;
        }
        if (os.startsWith("linux")) {
            return LINUX;
        }
        return OTHER;
    }
}
