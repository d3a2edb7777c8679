package com.phillippitts.gesturelauncher.config;

import com.phillippitts.gesturelauncher.config.properties.ActionProperties;
import com.phillippitts.gesturelauncher.config.properties.GestureProperties;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Validates gesture and action properties at startup to fail fast with actionable messages.
 * Problems that only make one gesture useless (a missing URL, an unknown platform key) are
 * logged as warnings instead.
 */
@Component
class GestureConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(GestureConfigurationValidator.class);

    private final GestureProperties gesture;
    private final ActionProperties actions;

    GestureConfigurationValidator(GestureProperties gesture, ActionProperties actions) {
        this.gesture = gesture;
        this.actions = actions;
    }

    @PostConstruct
    void validate() {
        if (gesture.getStableFrames() < 1) {
            throw new IllegalArgumentException("gesture.stable-frames must be at least 1, got: "
                    + gesture.getStableFrames());
        }
        double cooldown = gesture.getCooldownSeconds();
        if (!Double.isFinite(cooldown) || cooldown < 0) {
            throw new IllegalArgumentException("gesture.cooldown-seconds must be a non-negative number, got: "
                    + cooldown);
        }
        validateMapping();
        validateProgramLookup();
    }

    private void validateMapping() {
        for (Map.Entry<Integer, ActionProperties.Entry> e : actions.getMapping().entrySet()) {
            Integer count = e.getKey();
            if (count == null || count < ActionMapping.MIN_COUNT || count > ActionMapping.MAX_COUNT) {
                throw new IllegalArgumentException("Invalid actions.mapping key: " + count
                        + ". Finger counts must be between " + ActionMapping.MIN_COUNT
                        + " and " + ActionMapping.MAX_COUNT + ".");
            }
            ActionProperties.Entry entry = e.getValue();
            if (entry == null || entry.kind() == null) {
                throw new IllegalArgumentException("actions.mapping." + count
                        + ".kind is required. Allowed: " + allowedKinds());
            }
            boolean missingParameter = entry.parameter() == null || entry.parameter().isBlank();
            if (entry.kind() != ActionKind.NO_OP && missingParameter) {
                LOG.warn("actions.mapping.{} is {} without a parameter; that gesture will do nothing",
                        count, entry.kind().tag());
            }
        }
    }

    private void validateProgramLookup() {
        for (Map.Entry<String, Map<String, List<String>>> program : actions.getProgramLookup().entrySet()) {
            if (program.getKey() == null || program.getKey().isBlank()) {
                throw new IllegalArgumentException("actions.program-lookup contains a blank program name");
            }
            Map<String, List<String>> groups = program.getValue() == null ? Map.of() : program.getValue();
            for (String group : groups.keySet()) {
                boolean known = Arrays.stream(Platform.values()).anyMatch(p -> p.matchesGroup(group));
                if (!known) {
                    LOG.warn("actions.program-lookup.{}.{} does not match any platform (win32, darwin, linux)",
                            program.getKey(), group);
                }
            }
        }
    }

    private static List<String> allowedKinds() {
        return Arrays.stream(ActionKind.values()).map(ActionKind::tag).toList();
    }
}
