package com.phillippitts.gesturelauncher.service.gesture;

import com.phillippitts.gesturelauncher.service.gesture.event.ActionSkippedEvent;
import com.phillippitts.gesturelauncher.service.gesture.event.GestureTriggeredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs gesture events succinctly. Parameters are not logged. */
@Component
class GestureEventsListener {
    private static final Logger LOG = LogManager.getLogger(GestureEventsListener.class);

    @EventListener
    void onTriggered(GestureTriggeredEvent e) {
        LOG.debug("Gesture triggered: count={}, kind={}", e.count(), e.descriptor().kind().tag());
    }

    @EventListener
    void onSkipped(ActionSkippedEvent e) {
        LOG.debug("Gesture {} not performed ({}); cooldown not recorded", e.count(), e.descriptor().kind().tag());
    }
}
