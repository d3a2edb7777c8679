package com.phillippitts.gesturelauncher.service.capability;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Speaks through a command-line TTS program ({@code say}, {@code espeak}, {@code spd-say},
 * PowerShell {@code System.Speech}).
 *
 * <p>The command template is a list of arguments. An argument containing {@code {text}} receives
 * the text in place (single quotes doubled inside {@code '{text}'}); without a placeholder the
 * text is appended as the last argument.
 */
public final class CommandLineSpeechCapability implements SpeechCapability {

    static final String PLACEHOLDER = "{text}";

    private final List<String> template;
    private final ProcessLauncher launcher;
    private final Object lock = new Object();
    private Process current;

    public CommandLineSpeechCapability(List<String> template, ProcessLauncher launcher) {
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("speech command must not be empty");
        }
        this.template = List.copyOf(template);
        this.launcher = Objects.requireNonNull(launcher);
    }

    @Override
    public void speak(String text) throws IOException {
        if (text == null || text.isBlank()) {
            return;
        }
        Process p = launcher.launch(command(text));
        synchronized (lock) {
            current = p;
        }
    }

    List<String> command(String text) {
        List<String> cmd = new ArrayList<>(template.size() + 1);
        boolean substituted = false;
        for (String arg : template) {
            if (arg.contains(PLACEHOLDER)) {
                String quoted = arg.replace("'" + PLACEHOLDER + "'", "'" + text.replace("'", "''") + "'");
                cmd.add(quoted.replace(PLACEHOLDER, text));
                substituted = true;
            } else {
                cmd.add(arg);
            }
        }
        if (!substituted) {
            cmd.add(text);
        }
        return cmd;
    }

    @Override
    public String name() {
        return template.get(0);
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (current != null && current.isAlive()) {
                current.destroy();
            }
            current = null;
        }
    }
}
