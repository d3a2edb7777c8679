package com.phillippitts.gesturelauncher.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Static finger-count to action table. Built once at startup and never reloaded.
 */
public final class ActionMapping {

    public static final int MIN_COUNT = 0;
    public static final int MAX_COUNT = 5;

    private final Map<Integer, ActionDescriptor> actions;

    public ActionMapping(Map<Integer, ActionDescriptor> actions) {
        Map<Integer, ActionDescriptor> copy = new TreeMap<>();
        if (actions != null) {
            actions.forEach((count, descriptor) -> {
                if (count == null || count < MIN_COUNT || count > MAX_COUNT) {
                    throw new IllegalArgumentException("Finger count must be " + MIN_COUNT + ".." + MAX_COUNT
                            + ", got: " + count);
                }
                if (descriptor != null) {
                    copy.put(count, descriptor);
                }
            });
        }
        this.actions = Collections.unmodifiableMap(copy);
    }

    public static ActionMapping empty() {
        return new ActionMapping(Map.of());
    }

    /** @return the configured descriptor, or empty on a lookup miss */
    public Optional<ActionDescriptor> find(int count) {
        return Optional.ofNullable(actions.get(count));
    }

    /** @return the configured descriptor, or {@link ActionDescriptor#NO_OP} on a lookup miss */
    public ActionDescriptor descriptorFor(int count) {
        return find(count).orElse(ActionDescriptor.NO_OP);
    }

    public Map<Integer, ActionDescriptor> asMap() {
        return actions;
    }
}
