package com.phillippitts.gesturelauncher.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties controlling voice feedback.
 *
 * Speech is optional: when disabled, or when no TTS program is found, say-text actions report
 * "not performed" and spoken confirmations are skipped.
 */
@Validated
@ConfigurationProperties(prefix = "feedback")
public class FeedbackProperties {

    /** Speak a confirmation after a performed action. */
    private final boolean enabled;

    /** Initialize a speech engine at startup. */
    private final boolean speechEnabled;

    /** Optional TTS command override, e.g. [espeak, -s, 160]; empty = platform default. */
    @NotNull
    private final List<String> speechCommand;

    private final String openUrlMessage;
    private final String openProgramMessage;
    private final String defaultMessage;

    @ConstructorBinding
    public FeedbackProperties(Boolean enabled,
                              Boolean speechEnabled,
                              List<String> speechCommand,
                              String openUrlMessage,
                              String openProgramMessage,
                              String defaultMessage) {
        this.enabled = enabled == null ? true : enabled;
        this.speechEnabled = speechEnabled == null ? true : speechEnabled;
        this.speechCommand = speechCommand == null ? List.of() : List.copyOf(speechCommand);
        this.openUrlMessage = orDefault(openUrlMessage, "Opening website.");
        this.openProgramMessage = orDefault(openProgramMessage, "Opening program.");
        this.defaultMessage = orDefault(defaultMessage, "Action performed.");
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isSpeechEnabled() {
        return speechEnabled;
    }

    public List<String> getSpeechCommand() {
        return speechCommand;
    }

    public String getOpenUrlMessage() {
        return openUrlMessage;
    }

    public String getOpenProgramMessage() {
        return openProgramMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
