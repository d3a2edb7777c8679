package com.phillippitts.gesturelauncher.service.gesture;

import java.util.OptionalInt;

/**
 * Debounces finger counts: a count becomes stable once it has been seen on
 * {@code stableFrames} consecutive ticks.
 *
 * <p><b>State Transitions</b> (one per tick):
 * <pre>
 * no hand            → {empty, 0}
 * count == lastCount → {lastCount, ticks + 1}
 * count != lastCount → {count, 1}
 * </pre>
 *
 * <p>The counter is not reset after a trigger, so a gesture held past the cooldown
 * stays stable and fires again.
 *
 * <p><b>Thread Safety:</b> not thread-safe. Owned by the tick thread.
 */
public final class StabilityTracker {

    private final int stableFrames;

    // state
    private OptionalInt lastCount = OptionalInt.empty();
    private int consecutiveTicks;

    public StabilityTracker(int stableFrames) {
        if (stableFrames < 1) {
            throw new IllegalArgumentException("stableFrames must be >= 1, got: " + stableFrames);
        }
        this.stableFrames = stableFrames;
    }

    /**
     * Advances the state machine by one tick.
     *
     * @param count finger count seen this tick, or empty when no hand was detected
     * @return state after the transition
     */
    public StabilityState advance(OptionalInt count) {
        if (count == null || count.isEmpty()) {
            reset();
            return state();
        }
        int c = count.getAsInt();
        if (lastCount.isPresent() && lastCount.getAsInt() == c) {
            if (consecutiveTicks < Integer.MAX_VALUE) {
                consecutiveTicks++;
            }
        } else {
            lastCount = OptionalInt.of(c);
            consecutiveTicks = 1; // the current tick counts
        }
        return state();
    }

    public StabilityState state() {
        return new StabilityState(lastCount, consecutiveTicks, consecutiveTicks >= stableFrames);
    }

    public void reset() {
        lastCount = OptionalInt.empty();
        consecutiveTicks = 0;
    }

    public int stableFrames() {
        return stableFrames;
    }
}
