package com.phillippitts.gesturelauncher.service.gesture;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.domain.FingerState;
import com.phillippitts.gesturelauncher.domain.GestureEvent;
import com.phillippitts.gesturelauncher.domain.HandObservation;
import com.phillippitts.gesturelauncher.domain.Handedness;
import com.phillippitts.gesturelauncher.service.action.ActionDispatcher;
import com.phillippitts.gesturelauncher.service.extract.FingerStateExtractor;
import com.phillippitts.gesturelauncher.service.gesture.event.ActionPerformedEvent;
import com.phillippitts.gesturelauncher.service.gesture.event.ActionSkippedEvent;
import com.phillippitts.gesturelauncher.service.gesture.event.GestureTriggeredEvent;
import com.phillippitts.gesturelauncher.service.metrics.GestureMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Turns one observation per tick into at most one dispatched gesture.
 *
 * <p>Per tick:
 * <ol>
 *   <li>extract the finger state (when a hand is present) and advance the {@link StabilityTracker};</li>
 *   <li>if the count is stable and the {@link CooldownGate} is open, look up the action
 *       (a miss means no-op) and dispatch it;</li>
 *   <li>record the cooldown only when the dispatcher reports the action as performed.</li>
 * </ol>
 *
 * <p>A failed or no-op dispatch neither records the cooldown nor resets stability, so the
 * next tick retries immediately. Nothing is buffered across ticks.
 *
 * <p><b>Thread Safety:</b> {@link #onTick} must be called from a single thread (the tick loop).
 * {@link #snapshot()} is safe to call from any thread.
 *
 * @since 1.0
 */
@Service
public class GestureEventEmitter {

    private static final Logger LOG = LogManager.getLogger(GestureEventEmitter.class);

    private final FingerStateExtractor extractor;
    private final StabilityTracker tracker;
    private final CooldownGate cooldown;
    private final ActionMapping mapping;
    private final ActionDispatcher dispatcher;
    private final ApplicationEventPublisher publisher;
    private final GestureMetrics metrics;

    private long ticks;
    // counts already reported as unmapped
    private final Set<Integer> unmappedReported = new HashSet<>();
    private volatile TickOutcome last;

    public GestureEventEmitter(FingerStateExtractor extractor,
                               StabilityTracker tracker,
                               CooldownGate cooldown,
                               ActionMapping mapping,
                               ActionDispatcher dispatcher,
                               ApplicationEventPublisher publisher,
                               GestureMetrics metrics) {
        this.extractor = Objects.requireNonNull(extractor);
        this.tracker = Objects.requireNonNull(tracker);
        this.cooldown = Objects.requireNonNull(cooldown);
        this.mapping = Objects.requireNonNull(mapping);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Processes one tick.
     *
     * @param observation the hand seen this tick, or empty when no hand was detected
     * @param now         tick time
     * @return what happened on this tick
     */
    public TickOutcome onTick(Optional<HandObservation> observation, Instant now) {
        Objects.requireNonNull(now, "now");
        ticks++;

        Optional<FingerState> fingers = observation.map(extractor::extract);
        Handedness handedness = observation.map(HandObservation::handedness).orElse(Handedness.UNKNOWN);
        OptionalInt count = fingers.map(f -> OptionalInt.of(f.count())).orElse(OptionalInt.empty());
        StabilityState stability = tracker.advance(count);

        boolean triggered = false;
        boolean acted = false;
        if (stability.stable() && cooldown.allow(now)) {
            triggered = true;
            acted = trigger(stability.lastCount().getAsInt(), now);
        }

        TickOutcome outcome = new TickOutcome(ticks, now, fingers, handedness, stability,
                triggered, acted, cooldown.remaining(now));
        last = outcome;
        return outcome;
    }

    private boolean trigger(int count, Instant now) {
        Optional<ActionDescriptor> configured = mapping.find(count);
        if (configured.isEmpty()) {
            if (unmappedReported.add(count)) {
                LOG.info("No action mapped for finger count {}; treating as no-op", count);
            } else {
                LOG.debug("No action mapped for finger count {}", count);
            }
        }
        GestureEvent event = new GestureEvent(count, now, configured.orElse(ActionDescriptor.NO_OP));

        LOG.debug("Gesture stable: count={}, action={}", count, event.descriptor().kind());
        metrics.incrementTriggered(count);
        publisher.publishEvent(new GestureTriggeredEvent(count, event.descriptor(), now));

        boolean acted = dispatcher.dispatch(event.descriptor());
        if (acted) {
            cooldown.record(now);
            LOG.info("Gesture {} performed {}", count, event.descriptor().kind());
            publisher.publishEvent(new ActionPerformedEvent(count, event.descriptor(), now));
        } else {
            publisher.publishEvent(new ActionSkippedEvent(count, event.descriptor(), now));
        }
        return acted;
    }

    /** @return the outcome of the most recent tick, empty before the first tick */
    public Optional<TickOutcome> snapshot() {
        return Optional.ofNullable(last);
    }

    public Optional<Instant> lastTrigger() {
        return cooldown.lastTrigger();
    }
}
