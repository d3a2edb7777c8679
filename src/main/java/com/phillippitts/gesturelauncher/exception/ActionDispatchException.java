package com.phillippitts.gesturelauncher.exception;

import com.phillippitts.gesturelauncher.domain.ActionKind;

/**
 * Thrown by a capability when an action could not be carried out.
 * The dispatcher converts it into a {@code false} dispatch result; it never reaches the tick loop.
 */
public class ActionDispatchException extends GestureLauncherException {

    private final ActionKind kind;
    private final String reason;

    public ActionDispatchException(ActionKind kind, String reason) {
        super("Action " + kind.tag() + " failed: " + reason);
        this.kind = kind;
        this.reason = reason;
    }

    public ActionDispatchException(ActionKind kind, String reason, Throwable cause) {
        super("Action " + kind.tag() + " failed: " + reason, cause);
        this.kind = kind;
        this.reason = reason;
    }

    public ActionKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }
}
