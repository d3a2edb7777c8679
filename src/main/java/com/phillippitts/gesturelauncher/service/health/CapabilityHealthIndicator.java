package com.phillippitts.gesturelauncher.service.health;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.action.resolve.ExecutableResolver;
import com.phillippitts.gesturelauncher.service.capability.BrowserCapability;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapabilityProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the desktop capabilities the configured gestures depend on.
 *
 * <ul>
 *   <li>UP: a browser route exists and every mapped program resolves</li>
 *   <li>DEGRADED: a browser route exists but at least one mapped program cannot be resolved</li>
 *   <li>DOWN: no way to open URLs on this host</li>
 * </ul>
 *
 * <p>Speech availability is reported as a detail only. Exposed via /actuator/health.
 */
@Component
public class CapabilityHealthIndicator implements HealthIndicator {

    private final BrowserCapability browser;
    private final SpeechCapabilityProvider speech;
    private final ActionMapping mapping;
    private final ExecutableResolver resolver;

    public CapabilityHealthIndicator(BrowserCapability browser,
                                     SpeechCapabilityProvider speech,
                                     ActionMapping mapping,
                                     ExecutableResolver resolver) {
        this.browser = browser;
        this.speech = speech;
        this.mapping = mapping;
        this.resolver = resolver;
    }

    @Override
    public Health health() {
        boolean browserReady = browser.isAvailable();
        Map<String, String> programs = programStatus();
        boolean allResolved = !programs.containsValue("missing");

        Health.Builder builder = new Health.Builder();
        if (!browserReady) {
            builder.down().withDetail("status", "No browser route available");
        } else if (!allResolved) {
            builder.status("DEGRADED").withDetail("status", "Some mapped programs cannot be resolved");
        } else {
            builder.up().withDetail("status", "All mapped capabilities available");
        }
        return builder
                .withDetail("browser", browserReady ? browser.name() : "unavailable")
                .withDetail("speech", speech.get().map(s -> s.name()).orElse("unavailable"))
                .withDetail("programs", programs)
                .build();
    }

    private Map<String, String> programStatus() {
        Map<String, String> status = new TreeMap<>();
        for (Map.Entry<Integer, ActionDescriptor> e : mapping.asMap().entrySet()) {
            ActionDescriptor d = e.getValue();
            if (d.kind() != ActionKind.OPEN_PROGRAM) {
                continue;
            }
            String key = "gesture-" + e.getKey();
            status.put(key, d.parameter()
                    .map(p -> resolver.resolve(p).isPresent() ? "resolved" : "missing")
                    .orElse("unset"));
        }
        return status;
    }
}
