package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.exception.ActionDispatchException;
import com.phillippitts.gesturelauncher.service.capability.BrowserCapability;
import com.phillippitts.gesturelauncher.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/** Opens the configured URL in the default browser (fire-and-forget). */
@Component
class OpenUrlActionHandler implements ActionHandler {
    private static final Logger LOG = LogManager.getLogger(OpenUrlActionHandler.class);

    private final BrowserCapability browser;

    OpenUrlActionHandler(BrowserCapability browser) {
        this.browser = Objects.requireNonNull(browser);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.OPEN_URL;
    }

    @Override
    public boolean handle(ActionDescriptor descriptor) throws IOException {
        String url = descriptor.parameter()
                .orElseThrow(() -> new ActionDispatchException(ActionKind.OPEN_URL, "no URL configured"));
        URI uri = parse(url);
        browser.open(uri);
        LOG.info("Opened URL {}", LogSanitizer.urlForLog(url));
        return true;
    }

    private static URI parse(String url) {
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null) {
                throw new ActionDispatchException(ActionKind.OPEN_URL, "URL has no scheme");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ActionDispatchException(ActionKind.OPEN_URL, "malformed URL", e);
        }
    }
}
