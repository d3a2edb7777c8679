package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.exception.ActionDispatchException;
import com.phillippitts.gesturelauncher.exception.ExecutableNotFoundException;
import com.phillippitts.gesturelauncher.service.action.resolve.ExecutableResolver;
import com.phillippitts.gesturelauncher.service.capability.ProcessLauncher;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Launches a program resolved by the {@link ExecutableResolver}. The launched process is not
 * awaited.
 *
 * <p>On macOS a failed launch is retried once through {@code open -a <program>}.
 */
@Component
class OpenProgramActionHandler implements ActionHandler {
    private static final Logger LOG = LogManager.getLogger(OpenProgramActionHandler.class);

    private final ExecutableResolver resolver;
    private final ProcessLauncher launcher;
    private final Platform platform;

    OpenProgramActionHandler(ExecutableResolver resolver, ProcessLauncher launcher, Platform platform) {
        this.resolver = Objects.requireNonNull(resolver);
        this.launcher = Objects.requireNonNull(launcher);
        this.platform = Objects.requireNonNull(platform);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.OPEN_PROGRAM;
    }

    @Override
    public boolean handle(ActionDescriptor descriptor) throws IOException {
        String program = descriptor.parameter()
                .orElseThrow(() -> new ActionDispatchException(ActionKind.OPEN_PROGRAM, "no program specified"));
        Path exe = resolver.resolve(program)
                .orElseThrow(() -> new ExecutableNotFoundException(program));
        try {
            launcher.launch(List.of(exe.toString()));
            LOG.info("Launched {} ({})", program, exe);
            return true;
        } catch (IOException e) {
            if (platform != Platform.MACOS) {
                throw e;
            }
            LOG.debug("Direct launch of {} failed ({}); trying open -a", exe, e.getMessage());
            launcher.launch(List.of("open", "-a", program));
            LOG.info("Launched {} via open -a", program);
            return true;
        }
    }
}
