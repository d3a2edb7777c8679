package com.phillippitts.gesturelauncher.service.events;

import com.phillippitts.gesturelauncher.service.action.event.ActionFailedEvent;
import com.phillippitts.gesturelauncher.service.source.event.ObservationSourceFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Throttled so a gesture held in front of a
 * broken action does not log the same hint every tick.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onActionFailed(ActionFailedEvent e) {
        String key = "action-" + e.kind().tag() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Action failed: kind={}, reason={}. {}", e.kind().tag(), e.reason(), hint(e.reason()));
        }
    }

    @EventListener
    void onSourceFailed(ObservationSourceFailedEvent e) {
        String key = "source-" + e.source();
        if (shouldLog(key)) {
            LOG.warn("Tracker feed unavailable: source={}, reason={}. Gestures will not be detected "
                    + "until the application is restarted with a working source.path.", e.source(), e.reason());
        }
    }

    private static String hint(String reason) {
        return switch (reason) {
            case "unresolved" -> "Install the program or add it to actions.program-lookup.";
            case "misconfigured" -> "Check the actions.mapping entry for this gesture.";
            case "unsupported" -> "No handler is registered for this action kind.";
            default -> "See the debug log for details.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
