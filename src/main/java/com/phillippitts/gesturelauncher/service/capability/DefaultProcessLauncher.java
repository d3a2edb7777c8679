package com.phillippitts.gesturelauncher.service.capability;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessLauncher} using {@link ProcessBuilder}.
 * Output of launched programs is discarded so they cannot block on a full pipe.
 */
@Component
public class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IOException("empty command");
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        return pb.start();
    }
}
