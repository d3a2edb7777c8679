package com.phillippitts.gesturelauncher.service.gesture;

import java.util.OptionalInt;

/**
 * Snapshot of the debounce state after one tick.
 *
 * @param lastCount        most recent finger count, empty after a tick with no hand
 * @param consecutiveTicks ticks {@code lastCount} has been observed in a row (0 when empty)
 * @param stable           whether {@code consecutiveTicks} reached the configured threshold
 */
public record StabilityState(OptionalInt lastCount, int consecutiveTicks, boolean stable) {

    public static final StabilityState INITIAL = new StabilityState(OptionalInt.empty(), 0, false);

    public StabilityState {
        lastCount = lastCount == null ? OptionalInt.empty() : lastCount;
        if (consecutiveTicks < 0) {
            throw new IllegalArgumentException("consecutiveTicks must be >= 0, got: " + consecutiveTicks);
        }
    }
}
