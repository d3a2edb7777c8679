package com.phillippitts.gesturelauncher.service.capability;

import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens URLs through {@link java.awt.Desktop} when the JVM supports browsing, otherwise through
 * the platform opener command ({@code open}, {@code xdg-open}, {@code rundll32}).
 */
@Component
public class DesktopBrowserCapability implements BrowserCapability {

    private static final Logger LOG = LogManager.getLogger(DesktopBrowserCapability.class);

    interface DesktopFacade {
        boolean canBrowse();

        void browse(URI uri) throws IOException;
    }

    static final class AwtDesktopFacade implements DesktopFacade {
        @Override
        public boolean canBrowse() {
            try {
                return Desktop.isDesktopSupported()
                        && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
            } catch (RuntimeException | LinkageError e) {
                // headless JVMs and stripped-down runtimes
                return false;
            }
        }

        @Override
        public void browse(URI uri) throws IOException {
            Desktop.getDesktop().browse(uri);
        }
    }

    private final DesktopFacade desktop;
    private final ProcessLauncher launcher;
    private final Platform platform;
    private final PathSearch pathSearch;

    @Autowired
    public DesktopBrowserCapability(ProcessLauncher launcher, Platform platform, PathSearch pathSearch) {
        this(new AwtDesktopFacade(), launcher, platform, pathSearch);
    }

    // package-private for tests
    DesktopBrowserCapability(DesktopFacade desktop, ProcessLauncher launcher, Platform platform,
                             PathSearch pathSearch) {
        this.desktop = Objects.requireNonNull(desktop);
        this.launcher = Objects.requireNonNull(launcher);
        this.platform = Objects.requireNonNull(platform);
        this.pathSearch = Objects.requireNonNull(pathSearch);
    }

    @Override
    public boolean isAvailable() {
        return desktop.canBrowse() || openerCommand().isPresent();
    }

    @Override
    public void open(URI uri) throws IOException {
        Objects.requireNonNull(uri, "uri");
        if (desktop.canBrowse()) {
            desktop.browse(uri);
            return;
        }
        List<String> opener = openerCommand()
                .orElseThrow(() -> new IOException("no browser opener available on " + platform.id()));
        List<String> command = new ArrayList<>(opener);
        command.add(uri.toString());
        LOG.debug("Desktop browse unsupported; using {}", opener.get(0));
        launcher.launch(command);
    }

    @Override
    public String name() {
        return "desktop-browser";
    }

    private Optional<List<String>> openerCommand() {
        return switch (platform) {
            case MACOS -> pathSearch.which("open").map(p -> List.of(p.toString()));
            case WINDOWS -> pathSearch.which("rundll32")
                    .map(p -> List.of(p.toString(), "url.dll,FileProtocolHandler"));
            case LINUX, OTHER -> pathSearch.which("xdg-open").map(p -> List.of(p.toString()));
        };
    }
}
