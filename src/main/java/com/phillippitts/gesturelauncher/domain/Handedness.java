package com.phillippitts.gesturelauncher.domain;

import java.util.Locale;

/**
 * Handedness label reported by the external hand tracker.
 * Tracker labels assume a mirrored (selfie) camera view.
 */
public enum Handedness {
    LEFT,
    RIGHT,
    UNKNOWN;

    /**
     * Parses a tracker label such as "Left" or "Right". Anything else, including null, maps to
     * {@link #UNKNOWN}.
     */
    public static Handedness fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "LEFT" -> LEFT;
            case "RIGHT" -> RIGHT;
            default -> UNKNOWN;
        };
    }
}
