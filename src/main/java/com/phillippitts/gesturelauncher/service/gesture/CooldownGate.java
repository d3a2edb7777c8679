package com.phillippitts.gesturelauncher.service.gesture;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Enforces a minimum interval between two dispatched actions. Knows nothing about fingers.
 *
 * <p>Before the first {@link #record(Instant)} the gate is always open.
 * {@code record} must only be called after the dispatcher reports that an action was
 * actually performed, so a gesture that cannot be dispatched never consumes the window.
 *
 * <p><b>Thread Safety:</b> written by the tick thread only; {@link #lastTrigger()} may be
 * read from other threads.
 */
public final class CooldownGate {

    private final Duration cooldown;
    private volatile Instant lastTrigger;

    public CooldownGate(Duration cooldown) {
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0, got: " + cooldown);
        }
        this.cooldown = cooldown;
    }

    /** @return true if no action was recorded yet, or at least {@code cooldown} has elapsed */
    public boolean allow(Instant now) {
        Instant last = lastTrigger;
        if (last == null) {
            return true;
        }
        return Duration.between(last, now).compareTo(cooldown) >= 0;
    }

    /** Marks {@code now} as the time of the last performed action. */
    public void record(Instant now) {
        this.lastTrigger = Objects.requireNonNull(now, "now");
    }

    /** @return time left before {@link #allow(Instant)} returns true; zero when open */
    public Duration remaining(Instant now) {
        Instant last = lastTrigger;
        if (last == null) {
            return Duration.ZERO;
        }
        Duration left = cooldown.minus(Duration.between(last, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Optional<Instant> lastTrigger() {
        return Optional.ofNullable(lastTrigger);
    }

    public Duration cooldown() {
        return cooldown;
    }
}
