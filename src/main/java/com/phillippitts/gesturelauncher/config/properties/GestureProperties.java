package com.phillippitts.gesturelauncher.config.properties;

import com.phillippitts.gesturelauncher.domain.GestureSettings;
import com.phillippitts.gesturelauncher.util.TimeUtils;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for gesture debouncing.
 *
 * <ul>
 *   <li>{@code gesture.stable-frames} - consecutive ticks a finger count must persist (default 6)</li>
 *   <li>{@code gesture.cooldown-seconds} - minimum seconds between two performed actions (default 3.0)</li>
 * </ul>
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "gesture")
public class GestureProperties {

    @Min(1)
    private final int stableFrames;

    @DecimalMin("0.0")
    private final double cooldownSeconds;

    @ConstructorBinding
    public GestureProperties(Integer stableFrames, Double cooldownSeconds) {
        this.stableFrames = stableFrames == null ? GestureSettings.DEFAULT_STABLE_FRAMES : stableFrames;
        this.cooldownSeconds = cooldownSeconds == null
                ? TimeUtils.toSeconds(GestureSettings.DEFAULT_COOLDOWN)
                : cooldownSeconds;
    }

    public int getStableFrames() {
        return stableFrames;
    }

    public double getCooldownSeconds() {
        return cooldownSeconds;
    }

    public GestureSettings toSettings() {
        return new GestureSettings(stableFrames, TimeUtils.secondsToDuration(cooldownSeconds));
    }
}
