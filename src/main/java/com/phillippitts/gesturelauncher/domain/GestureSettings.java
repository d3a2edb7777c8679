package com.phillippitts.gesturelauncher.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Debounce and cooldown thresholds.
 *
 * @param stableFrames consecutive ticks a count must persist before it is stable (≥ 1)
 * @param cooldown     minimum time between two dispatched actions (≥ 0)
 */
public record GestureSettings(int stableFrames, Duration cooldown) {

    public static final int DEFAULT_STABLE_FRAMES = 6;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(3);

    public GestureSettings {
        if (stableFrames < 1) {
            throw new IllegalArgumentException("stableFrames must be >= 1, got: " + stableFrames);
        }
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0, got: " + cooldown);
        }
    }

    public static GestureSettings defaults() {
        return new GestureSettings(DEFAULT_STABLE_FRAMES, DEFAULT_COOLDOWN);
    }
}
