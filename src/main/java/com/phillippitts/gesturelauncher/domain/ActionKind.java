package com.phillippitts.gesturelauncher.domain;

/**
 * Kinds of actions a gesture can trigger.
 * <p>
 * Spring Boot relaxed binding maps property values like "open-url" and "say-text"
 * to OPEN_URL and SAY_TEXT respectively.
 */
public enum ActionKind {
    NO_OP,
    OPEN_URL,
    OPEN_PROGRAM,
    SAY_TEXT;

    /** Lower-case hyphenated name used in logs and metric tags. */
    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT).replace('_', '-');
    }
}
