package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.exception.ActionDispatchException;
import com.phillippitts.gesturelauncher.exception.ExecutableNotFoundException;
import com.phillippitts.gesturelauncher.service.action.event.ActionFailedEvent;
import com.phillippitts.gesturelauncher.service.metrics.GestureMetrics;
import com.phillippitts.gesturelauncher.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes a descriptor to the handler for its kind and isolates the caller from every
 * capability fault: exceptions are logged, counted, published as {@link ActionFailedEvent}
 * and returned as {@code false}.
 *
 * <p>A failing gesture is retried on every stable tick, so failures are logged here at debug
 * only; the user-facing warning comes from the throttled error listener.
 */
@Service
public class DefaultActionDispatcher implements ActionDispatcher {
    private static final Logger LOG = LogManager.getLogger(DefaultActionDispatcher.class);

    private final Map<ActionKind, ActionHandler> handlers;
    private final ApplicationEventPublisher publisher;
    private final GestureMetrics metrics;

    DefaultActionDispatcher(List<ActionHandler> handlers, ApplicationEventPublisher publisher,
                            GestureMetrics metrics) {
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        Map<ActionKind, ActionHandler> byKind = new EnumMap<>(ActionKind.class);
        for (ActionHandler h : handlers) {
            ActionHandler previous = byKind.put(h.kind(), h);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + h.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }
        this.handlers = byKind;
    }

    @Override
    public boolean dispatch(ActionDescriptor descriptor) {
        if (descriptor == null || descriptor.kind() == ActionKind.NO_OP) {
            LOG.debug("No-op action; nothing to do");
            return false;
        }
        ActionKind kind = descriptor.kind();
        ActionHandler handler = handlers.get(kind);
        if (handler == null) {
            fail(kind, "unsupported", "no handler registered");
            return false;
        }
        long start = System.nanoTime();
        try {
            boolean ok = handler.handle(descriptor);
            if (ok) {
                metrics.incrementPerformed(kind);
            }
            return ok;
        } catch (ExecutableNotFoundException e) {
            fail(kind, "unresolved", e.getReason());
            return false;
        } catch (ActionDispatchException e) {
            fail(kind, "misconfigured", e.getReason());
            return false;
        } catch (Exception e) {
            LOG.debug("Action {} failure detail", kind, e);
            fail(kind, e.getClass().getSimpleName(), e.toString());
            return false;
        } finally {
            metrics.recordDispatchLatency(kind, System.nanoTime() - start);
            LOG.debug("Action {} handled in {} ms", kind, TimeUtils.elapsedMillis(start));
        }
    }

    private void fail(ActionKind kind, String reason, String detail) {
        LOG.debug("Action {} not performed: {}", kind.tag(), detail);
        metrics.incrementFailure(kind, reason);
        publisher.publishEvent(new ActionFailedEvent(kind, reason, Instant.now()));
    }
}
