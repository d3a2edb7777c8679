package com.phillippitts.gesturelauncher.service.capability;

import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import com.phillippitts.gesturelauncher.testutil.Executables;
import com.phillippitts.gesturelauncher.testutil.RecordingProcessLauncher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class DesktopBrowserCapabilityTest {

    @TempDir
    Path bin;

    static class FakeDesktop implements DesktopBrowserCapability.DesktopFacade {
        final boolean supported;
        final List<URI> browsed = new ArrayList<>();

        FakeDesktop(boolean supported) {
            this.supported = supported;
        }

        @Override
        public boolean canBrowse() {
            return supported;
        }

        @Override
        public void browse(URI uri) {
            browsed.add(uri);
        }
    }

    @Test
    void usesDesktopWhenSupported() throws Exception {
        FakeDesktop desktop = new FakeDesktop(true);
        RecordingProcessLauncher launcher = new RecordingProcessLauncher();
        DesktopBrowserCapability b = new DesktopBrowserCapability(desktop, launcher, Platform.LINUX,
                new PathSearch(bin.toString(), Platform.LINUX, null));

        b.open(URI.create("https://example.com"));

        assertThat(desktop.browsed).containsExactly(URI.create("https://example.com"));
        assertThat(launcher.commands).isEmpty();
        assertThat(b.isAvailable()).isTrue();
    }

    @Test
    void fallsBackToXdgOpenOnLinux() throws Exception {
        Path xdg = Executables.create(bin, "xdg-open");
        RecordingProcessLauncher launcher = new RecordingProcessLauncher();
        DesktopBrowserCapability b = new DesktopBrowserCapability(new FakeDesktop(false), launcher, Platform.LINUX,
                new PathSearch(bin.toString(), Platform.LINUX, null));

        assertThat(b.isAvailable()).isTrue();
        b.open(URI.create("https://example.com"));

        assertThat(launcher.commands).containsExactly(List.of(xdg.toAbsolutePath().toString(), "https://example.com"));
    }

    @Test
    void macUsesOpen() throws Exception {
        Path open = Executables.create(bin, "open");
        RecordingProcessLauncher launcher = new RecordingProcessLauncher();
        DesktopBrowserCapability b = new DesktopBrowserCapability(new FakeDesktop(false), launcher, Platform.MACOS,
                new PathSearch(bin.toString(), Platform.MACOS, null));

        b.open(URI.create("https://example.com"));

        assertThat(launcher.commands.get(0)).containsExactly(open.toAbsolutePath().toString(), "https://example.com");
    }

    @Test
    void unavailableWithoutDesktopOrOpener() {
        DesktopBrowserCapability b = new DesktopBrowserCapability(new FakeDesktop(false),
                new RecordingProcessLauncher(), Platform.LINUX, new PathSearch(bin.toString(), Platform.LINUX, null));

        assertThat(b.isAvailable()).isFalse();
        assertThatThrownBy(() -> b.open(URI.create("https://example.com")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no browser opener");
    }
}
