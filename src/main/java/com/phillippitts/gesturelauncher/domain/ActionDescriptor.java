package com.phillippitts.gesturelauncher.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of what a finger count does.
 *
 * @param kind      action kind, never null
 * @param parameter URL, program name/path, or text; blank values are normalized to empty
 */
public record ActionDescriptor(ActionKind kind, Optional<String> parameter) {

    public static final ActionDescriptor NO_OP = new ActionDescriptor(ActionKind.NO_OP, Optional.empty());

    public ActionDescriptor {
        Objects.requireNonNull(kind, "kind");
        parameter = parameter == null ? Optional.empty() : parameter.filter(p -> !p.isBlank());
    }

    public static ActionDescriptor of(ActionKind kind, String parameter) {
        return new ActionDescriptor(kind, Optional.ofNullable(parameter));
    }

    public static ActionDescriptor openUrl(String url) {
        return of(ActionKind.OPEN_URL, url);
    }

    public static ActionDescriptor openProgram(String program) {
        return of(ActionKind.OPEN_PROGRAM, program);
    }

    public static ActionDescriptor sayText(String text) {
        return of(ActionKind.SAY_TEXT, text);
    }

    @Override
    public String toString() {
        return kind.tag() + parameter.map(p -> "(" + p + ")").orElse("");
    }
}
