package com.phillippitts.gesturelauncher.exception;

/**
 * Thrown when the observation feed from the external hand tracker cannot be opened or read.
 * This is the only fatal condition for the tick loop.
 */
public class ObservationSourceException extends GestureLauncherException {

    private final String source;

    public ObservationSourceException(String source, String message) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    public ObservationSourceException(String source, String message, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
