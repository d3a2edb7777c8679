package com.phillippitts.gesturelauncher.service.source;

import com.phillippitts.gesturelauncher.exception.ObservationSourceException;
import com.phillippitts.gesturelauncher.service.gesture.GestureEventEmitter;
import com.phillippitts.gesturelauncher.service.source.event.ObservationSourceFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives the gesture pipeline: reads one tick from the {@link ObservationSource} and hands it
 * to the {@link GestureEventEmitter}, on a single background thread.
 *
 * <p>Frame time is always on the injected {@link Clock}'s time line. The first tracker
 * timestamp ({@code "t"}) is anchored to the clock reading at that tick and later timestamps
 * keep their spacing from it; a tick without a timestamp reads the clock. Time never goes
 * backwards: a timestamp earlier than the previous tick re-anchors the tracker time to the
 * previous tick. The current tick number is kept in the log4j {@link ThreadContext} under
 * {@code tick}.
 *
 * <p>A failure inside one tick is logged and the loop moves on. A failing feed stops the loop
 * and publishes {@link ObservationSourceFailedEvent}; end of stream stops it quietly.
 */
@Component
@ConditionalOnProperty(prefix = "source", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickLoop implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(TickLoop.class);

    static final String THREAD_NAME = "gesture-tick";
    static final String MDC_TICK = "tick";
    private static final long JOIN_TIMEOUT_MS = 2000;

    private final ObservationSource source;
    private final GestureEventEmitter emitter;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile boolean running;
    private volatile Thread worker;
    private volatile long ticks;

    // tick thread only
    private Duration trackerOffset;
    private Instant lastFrameTime;

    public TickLoop(ObservationSource source,
                    GestureEventEmitter emitter,
                    ApplicationEventPublisher publisher,
                    Clock clock) {
        this.source = source;
        this.emitter = emitter;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            source.open();
        } catch (ObservationSourceException e) {
            LOG.error("Cannot open tracker feed {}: {}", e.getSource(), e.getMessage());
            publisher.publishEvent(new ObservationSourceFailedEvent(e.getSource(), e.getMessage(), clock.instant()));
            return;
        }
        running = true;
        Thread t = new Thread(this::run, THREAD_NAME);
        t.setDaemon(true);
        worker = t;
        t.start();
        LOG.info("Tick loop started, reading from {}", source.describe());
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            t = worker;
            worker = null;
        }
        source.close();
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try {
                t.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Tick loop stopped after {} ticks", ticks);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void run() {
        try {
            while (running) {
                Optional<Tick> next = source.next();
                if (next.isEmpty()) {
                    LOG.info("Tracker feed {} ended", source.describe());
                    break;
                }
                process(next.get());
            }
        } catch (IOException e) {
            if (running) {
                failed(e);
            }
        } catch (RuntimeException e) {
            failed(e);
        } finally {
            running = false;
            ThreadContext.remove(MDC_TICK);
        }
    }

    private void failed(Exception e) {
        LOG.error("Tracker feed {} failed", source.describe(), e);
        publisher.publishEvent(new ObservationSourceFailedEvent(source.describe(),
                e.getClass().getSimpleName(), clock.instant()));
    }

    void process(Tick tick) {
        ticks++;
        ThreadContext.put(MDC_TICK, Long.toString(ticks));
        try {
            emitter.onTick(tick.observation(), frameTime(tick));
        } catch (RuntimeException e) {
            LOG.error("Tick {} failed; continuing", ticks, e);
        }
    }

    Instant frameTime(Tick tick) {
        Instant now;
        if (tick.timestamp().isPresent()) {
            Instant tracker = tick.timestamp().get();
            if (trackerOffset == null) {
                trackerOffset = Duration.between(tracker, clock.instant());
            }
            now = tracker.plus(trackerOffset);
            if (lastFrameTime != null && now.isBefore(lastFrameTime)) {
                LOG.debug("Tracker time went backwards at tick {}; re-anchoring", ticks);
                trackerOffset = Duration.between(tracker, lastFrameTime);
                now = lastFrameTime;
            }
        } else {
            now = clock.instant();
            if (lastFrameTime != null && now.isBefore(lastFrameTime)) {
                now = lastFrameTime;
            }
        }
        lastFrameTime = now;
        return now;
    }

    long ticksProcessed() {
        return ticks;
    }
}
