package com.phillippitts.gesturelauncher.service.source;

import com.phillippitts.gesturelauncher.config.properties.ObservationSourceProperties;
import com.phillippitts.gesturelauncher.exception.ObservationSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads newline-delimited JSON frames from standard input, a file or a named pipe.
 * Blank lines are skipped; every other line is exactly one tick.
 */
public class JsonLinesObservationSource implements ObservationSource {

    private static final Logger LOG = LogManager.getLogger(JsonLinesObservationSource.class);

    private final String path;
    private final ObservationJsonParser parser;
    private InputStream in;
    private BufferedReader reader;

    public JsonLinesObservationSource(String path, ObservationJsonParser parser) {
        this.path = Objects.requireNonNull(path);
        this.parser = Objects.requireNonNull(parser);
    }

    @Override
    public synchronized void open() {
        if (reader != null) {
            return;
        }
        if (isStdin()) {
            reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return;
        }
        Path p = Path.of(path);
        if (!Files.exists(p)) {
            throw new ObservationSourceException(path, "Tracker feed not found");
        }
        try {
            in = Files.newInputStream(p);
        } catch (IOException e) {
            throw new ObservationSourceException(path, "Cannot open tracker feed", e);
        }
        reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private boolean isStdin() {
        return ObservationSourceProperties.STDIN.equals(path);
    }

    @Override
    public Optional<Tick> next() throws IOException {
        BufferedReader r;
        synchronized (this) {
            r = reader;
        }
        if (r == null) {
            throw new IllegalStateException("Source not open: " + describe());
        }
        String line;
        while ((line = r.readLine()) != null) {
            if (!line.isBlank()) {
                return Optional.of(parser.parse(line));
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return isStdin() ? "stdin" : path;
    }

    /**
     * Closes the underlying stream rather than the reader, so a thread blocked in
     * {@link #next()} is released with an {@link IOException}. Standard input is left open.
     */
    @Override
    public synchronized void close() {
        reader = null;
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Error closing tracker feed {}: {}", describe(), e.toString());
        }
        in = null;
    }
}
