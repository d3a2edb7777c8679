package com.phillippitts.gesturelauncher.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A stable, cooldown-cleared gesture about to be dispatched. Lives for a single dispatch call.
 *
 * @param count      stable finger count
 * @param timestamp  tick time of the decision
 * @param descriptor action looked up for {@code count}
 */
public record GestureEvent(int count, Instant timestamp, ActionDescriptor descriptor) {

    public GestureEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(descriptor, "descriptor");
    }
}
