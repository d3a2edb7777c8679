package com.phillippitts.gesturelauncher.service.feedback;

import com.phillippitts.gesturelauncher.config.properties.FeedbackProperties;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapability;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapabilityProvider;
import com.phillippitts.gesturelauncher.service.gesture.event.ActionPerformedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Speaks a short confirmation after an action was performed ("Opening website.").
 *
 * <p>Say-text actions already speak, so they get no confirmation. Feedback is best effort:
 * a missing engine or a failing speak call never affects the gesture pipeline.
 */
@Service
public class SpokenFeedbackListener {

    private static final Logger LOG = LogManager.getLogger(SpokenFeedbackListener.class);

    private final FeedbackProperties props;
    private final SpeechCapabilityProvider speech;

    public SpokenFeedbackListener(FeedbackProperties props, SpeechCapabilityProvider speech) {
        this.props = Objects.requireNonNull(props);
        this.speech = Objects.requireNonNull(speech);
    }

    @EventListener
    public void onActionPerformed(ActionPerformedEvent evt) {
        ActionKind kind = evt.descriptor().kind();
        if (!props.isEnabled() || kind == ActionKind.SAY_TEXT || kind == ActionKind.NO_OP) {
            return;
        }
        Optional<SpeechCapability> engine = speech.get();
        if (engine.isEmpty()) {
            return;
        }
        String message = messageFor(kind);
        try {
            engine.get().speak(message);
        } catch (Exception e) {
            LOG.debug("Spoken confirmation failed ({}): {}", engine.get().name(), e.toString());
        }
    }

    String messageFor(ActionKind kind) {
        return switch (kind) {
            case OPEN_URL -> props.getOpenUrlMessage();
            case OPEN_PROGRAM -> props.getOpenProgramMessage();
            default -> props.getDefaultMessage();
        };
    }
}
