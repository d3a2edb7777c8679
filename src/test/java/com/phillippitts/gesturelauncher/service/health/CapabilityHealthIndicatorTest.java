package com.phillippitts.gesturelauncher.service.health;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.action.resolve.ExecutableResolver;
import com.phillippitts.gesturelauncher.service.capability.BrowserCapability;
import com.phillippitts.gesturelauncher.service.capability.SpeechCapabilityProvider;
import com.phillippitts.gesturelauncher.testutil.FakeSpeech;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CapabilityHealthIndicatorTest {

    private BrowserCapability browser;
    private ExecutableResolver resolver;
    private ActionMapping mapping;

    @BeforeEach
    void setUp() {
        browser = mock(BrowserCapability.class);
        when(browser.name()).thenReturn("desktop-browser");
        resolver = mock(ExecutableResolver.class);
        mapping = new ActionMapping(Map.of(
                1, ActionDescriptor.openUrl("https://example.com"),
                2, ActionDescriptor.openProgram("chrome"),
                3, ActionDescriptor.openProgram("code"),
                5, ActionDescriptor.of(ActionKind.OPEN_PROGRAM, null)));
    }

    private CapabilityHealthIndicator indicator(SpeechCapabilityProvider speech) {
        return new CapabilityHealthIndicator(browser, speech, mapping, resolver);
    }

    @Test
    void upWhenBrowserAndAllProgramsAvailable() {
        when(browser.isAvailable()).thenReturn(true);
        when(resolver.resolve("chrome")).thenReturn(Optional.of(Path.of("/usr/bin/chrome")));
        when(resolver.resolve("code")).thenReturn(Optional.of(Path.of("/usr/bin/code")));

        Health h = indicator(SpeechCapabilityProvider.of(new FakeSpeech())).health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails()).containsEntry("speech", "fake-speech");
        assertThat(h.getDetails().get("programs"))
                .isEqualTo(Map.of("gesture-2", "resolved", "gesture-3", "resolved", "gesture-5", "unset"));
    }

    @Test
    void degradedWhenSomeProgramMissing() {
        when(browser.isAvailable()).thenReturn(true);
        when(resolver.resolve("chrome")).thenReturn(Optional.empty());
        when(resolver.resolve("code")).thenReturn(Optional.of(Path.of("/usr/bin/code")));

        Health h = indicator(SpeechCapabilityProvider.none()).health();

        assertThat(h.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(h.getDetails()).containsEntry("speech", "unavailable");
    }

    @Test
    void downWithoutBrowserRoute() {
        when(browser.isAvailable()).thenReturn(false);
        when(resolver.resolve("chrome")).thenReturn(Optional.empty());
        when(resolver.resolve("code")).thenReturn(Optional.empty());

        Health h = indicator(SpeechCapabilityProvider.none()).health();

        assertThat(h.getStatus()).isEqualTo(Status.DOWN);
        assertThat(h.getDetails()).containsEntry("browser", "unavailable");
    }
}
