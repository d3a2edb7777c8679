package com.phillippitts.gesturelauncher.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the hand-tracker feed.
 *
 * <ul>
 *   <li>{@code source.enabled} - start the tick loop (default true)</li>
 *   <li>{@code source.path} - JSON-lines file or named pipe; "-" reads standard input (default)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "source")
public class ObservationSourceProperties {

    public static final String STDIN = "-";

    private final boolean enabled;

    @NotBlank
    private final String path;

    @ConstructorBinding
    public ObservationSourceProperties(Boolean enabled, String path) {
        this.enabled = enabled == null ? true : enabled;
        this.path = (path == null || path.isBlank()) ? STDIN : path;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getPath() {
        return path;
    }
}
