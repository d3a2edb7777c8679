package com.phillippitts.gesturelauncher.service.source;

import com.phillippitts.gesturelauncher.domain.HandObservation;

import java.time.Instant;
import java.util.Optional;

/**
 * One frame's worth of input from the hand tracker.
 *
 * @param observation the tracked hand, empty when no hand was detected
 * @param timestamp   frame time reported by the tracker, empty to use the local clock
 */
public record Tick(Optional<HandObservation> observation, Optional<Instant> timestamp) {

    public Tick {
        observation = observation == null ? Optional.empty() : observation;
        timestamp = timestamp == null ? Optional.empty() : timestamp;
    }

    public static Tick noHand() {
        return new Tick(Optional.empty(), Optional.empty());
    }

    public static Tick of(HandObservation observation) {
        return new Tick(Optional.of(observation), Optional.empty());
    }
}
