package com.phillippitts.gesturelauncher.service.gesture;

import com.phillippitts.gesturelauncher.domain.FingerState;
import com.phillippitts.gesturelauncher.domain.Handedness;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one tick.
 *
 * @param tick              1-based tick number
 * @param at                tick time
 * @param fingerState       extracted fingers, empty when no hand was seen
 * @param handedness        handedness of the observed hand ({@code UNKNOWN} when none)
 * @param stability         debounce state after this tick
 * @param triggered         whether stability and cooldown both cleared and a dispatch was attempted
 * @param acted             whether the dispatcher reported the action as performed
 * @param cooldownRemaining time left on the cooldown after this tick
 */
public record TickOutcome(long tick,
                          Instant at,
                          Optional<FingerState> fingerState,
                          Handedness handedness,
                          StabilityState stability,
                          boolean triggered,
                          boolean acted,
                          Duration cooldownRemaining) {

    public TickOutcome {
        Objects.requireNonNull(at, "at");
        fingerState = fingerState == null ? Optional.empty() : fingerState;
        handedness = handedness == null ? Handedness.UNKNOWN : handedness;
        Objects.requireNonNull(stability, "stability");
        cooldownRemaining = cooldownRemaining == null ? Duration.ZERO : cooldownRemaining;
    }
}
