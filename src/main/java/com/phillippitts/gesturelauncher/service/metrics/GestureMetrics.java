package com.phillippitts.gesturelauncher.service.metrics;

import com.phillippitts.gesturelauncher.domain.ActionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for gesture triggers and action dispatch.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Triggered gestures per finger count</li>
 *   <li>Performed and failed actions per action kind</li>
 *   <li>Dispatch latency per action kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class GestureMetrics {

    private static final String METRIC_PREFIX = "gesturelauncher";

    private final MeterRegistry registry;

    public GestureMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the trigger counter for a finger count.
     *
     * @param count stable finger count that cleared the cooldown
     */
    public void incrementTriggered(int count) {
        Counter.builder(METRIC_PREFIX + ".gesture.triggered")
                .description("Number of stable gestures handed to the dispatcher")
                .tag("count", Integer.toString(count))
                .register(registry)
                .increment();
    }

    /**
     * Increments the performed counter for an action kind.
     */
    public void incrementPerformed(ActionKind kind) {
        Counter.builder(METRIC_PREFIX + ".action.performed")
                .description("Number of actions the dispatcher reported as performed")
                .tag("kind", kind.tag())
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for an action kind.
     *
     * @param kind   action kind
     * @param reason short failure reason (unresolved, exception class name, unavailable, ...)
     */
    public void incrementFailure(ActionKind kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".action.failed")
                .description("Number of actions that could not be performed")
                .tag("kind", kind.tag())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a dispatch call took.
     *
     * @param kind          action kind
     * @param durationNanos duration in nanoseconds
     */
    public void recordDispatchLatency(ActionKind kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".action.latency")
                .description("Time spent issuing an action to its capability")
                .tag("kind", kind.tag())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
