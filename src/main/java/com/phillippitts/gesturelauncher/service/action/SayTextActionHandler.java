package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.exception.ActionDispatchException;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapability;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapabilityProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Speaks the configured text. Without a speech engine the action is not performed; with one,
 * speaking is best-effort and an engine error still counts as performed.
 */
@Component
class SayTextActionHandler implements ActionHandler {
    private static final Logger LOG = LogManager.getLogger(SayTextActionHandler.class);

    private final SpeechCapabilityProvider speech;

    SayTextActionHandler(SpeechCapabilityProvider speech) {
        this.speech = Objects.requireNonNull(speech);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SAY_TEXT;
    }

    @Override
    public boolean handle(ActionDescriptor descriptor) {
        String text = descriptor.parameter()
                .orElseThrow(() -> new ActionDispatchException(ActionKind.SAY_TEXT, "no text configured"));
        SpeechCapability engine = speech.get()
                .orElseThrow(() -> new ActionDispatchException(ActionKind.SAY_TEXT, "speech unavailable"));
        try {
            engine.speak(text);
            LOG.debug("Spoke {} chars via {}", text.length(), engine.name());
        } catch (Exception e) {
            LOG.warn("Speech engine {} failed: {}", engine.name(), e.toString());
        }
        return true;
    }
}
