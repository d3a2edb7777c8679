package com.phillippitts.gesturelauncher.exception;

/**
 * Base exception for all gesture-launcher application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class GestureLauncherException extends RuntimeException {

    public GestureLauncherException(String message) {
        super(message);
    }

    public GestureLauncherException(String message, Throwable cause) {
        super(message, cause);
    }

    public GestureLauncherException(Throwable cause) {
        super(cause);
    }
}
