package com.phillippitts.gesturelauncher.config;

import com.phillippitts.gesturelauncher.config.properties.ActionProperties;
import com.phillippitts.gesturelauncher.config.properties.GestureProperties;
import com.phillippitts.gesturelauncher.config.properties.ObservationSourceProperties;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.domain.GestureSettings;
import com.phillippitts.gesturelauncher.service.action.resolve.ExecutableResolver;
import com.phillippitts.gesturelauncher.service.action.resolve.ProgramLookupTable;
import com.phillippitts.gesturelauncher.service.gesture.CooldownGate;
import com.phillippitts.gesturelauncher.service.gesture.StabilityTracker;
import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import com.phillippitts.gesturelauncher.service.source.JsonLinesObservationSource;
import com.phillippitts.gesturelauncher.service.source.ObservationJsonParser;
import com.phillippitts.gesturelauncher.service.source.ObservationSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the gesture pipeline from typed properties.
 *
 * <p>The stability tracker and cooldown gate hold mutable per-session state and are created
 * here rather than component-scanned, so each context gets exactly one of each built from the
 * validated {@link GestureSettings}.
 */
@Configuration
public class GestureLauncherConfig {

    private static final Logger LOG = LogManager.getLogger(GestureLauncherConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Platform platform() {
        Platform p = Platform.current();
        LOG.info("Detected platform: {}", p.id());
        return p;
    }

    @Bean
    public PathSearch pathSearch(Platform platform) {
        return PathSearch.fromEnvironment(platform);
    }

    @Bean
    public GestureSettings gestureSettings(GestureProperties props) {
        GestureSettings settings = props.toSettings();
        LOG.info("Gesture debouncing: stableFrames={}, cooldown={}ms",
                settings.stableFrames(), settings.cooldown().toMillis());
        return settings;
    }

    @Bean
    public StabilityTracker stabilityTracker(GestureSettings settings) {
        return new StabilityTracker(settings.stableFrames());
    }

    @Bean
    public CooldownGate cooldownGate(GestureSettings settings) {
        return new CooldownGate(settings.cooldown());
    }

    @Bean
    public ActionMapping actionMapping(ActionProperties props) {
        ActionMapping mapping = props.toActionMapping();
        mapping.asMap().forEach((count, action) -> LOG.info("Gesture {} -> {}", count, action));
        return mapping;
    }

    @Bean
    public ProgramLookupTable programLookupTable(ActionProperties props) {
        return props.toProgramLookupTable();
    }

    @Bean
    public ExecutableResolver executableResolver(PathSearch pathSearch, ProgramLookupTable table, Platform platform) {
        return ExecutableResolver.standard(pathSearch, table, platform);
    }

    /**
     * JSON-lines tracker feed. Only created when the tick loop is enabled.
     */
    @Bean
    @ConditionalOnProperty(prefix = "source", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean(ObservationSource.class)
    public ObservationSource observationSource(ObservationSourceProperties props, ObservationJsonParser parser) {
        return new JsonLinesObservationSource(props.getPath(), parser);
    }
}
