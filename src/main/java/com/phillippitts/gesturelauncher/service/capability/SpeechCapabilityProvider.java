package com.phillippitts.gesturelauncher.service.capability;

import com.phillippitts.gesturelauncher.config.properties.FeedbackProperties;
import com.phillippitts.gesturelauncher.service.platform.PathSearch;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds the optional speech engine, chosen once at startup.
 *
 * <p>Resolution order: the configured {@code feedback.speech-command}, otherwise the platform
 * defaults ({@code say} on macOS; {@code espeak} then {@code spd-say} on Linux; PowerShell
 * {@code System.Speech} on Windows). The first program found on the search path wins.
 * When speech is disabled or nothing is found the engine is absent and callers must treat
 * speaking as unavailable.
 */
@Component
public class SpeechCapabilityProvider {

    private static final Logger LOG = LogManager.getLogger(SpeechCapabilityProvider.class);

    private static final String WINDOWS_SPEAK_SCRIPT = "Add-Type -AssemblyName System.Speech; "
            + "(New-Object System.Speech.Synthesis.SpeechSynthesizer).Speak('"
            + CommandLineSpeechCapability.PLACEHOLDER + "')";

    private final Optional<SpeechCapability> speech;

    @Autowired
    public SpeechCapabilityProvider(FeedbackProperties props,
                                    Platform platform,
                                    PathSearch pathSearch,
                                    ProcessLauncher launcher) {
        this(select(props, platform, pathSearch, launcher));
    }

    private SpeechCapabilityProvider(Optional<SpeechCapability> speech) {
        this.speech = speech;
    }

    /** Provider with a fixed engine, for tests and embedding. */
    public static SpeechCapabilityProvider of(SpeechCapability speech) {
        return new SpeechCapabilityProvider(Optional.of(speech));
    }

    /** Provider without an engine. */
    public static SpeechCapabilityProvider none() {
        return new SpeechCapabilityProvider(Optional.empty());
    }

    public Optional<SpeechCapability> get() {
        return speech;
    }

    public boolean isAvailable() {
        return speech.isPresent();
    }

    @PreDestroy
    public void shutdown() {
        speech.ifPresent(SpeechCapability::close);
    }

    static Optional<SpeechCapability> select(FeedbackProperties props, Platform platform,
                                             PathSearch pathSearch, ProcessLauncher launcher) {
        if (!props.isSpeechEnabled()) {
            LOG.info("Voice feedback disabled (feedback.speech-enabled=false)");
            return Optional.empty();
        }
        List<List<String>> candidates = props.getSpeechCommand().isEmpty()
                ? platformDefaults(platform)
                : List.of(props.getSpeechCommand());
        for (List<String> template : candidates) {
            Optional<Path> exe = pathSearch.which(template.get(0));
            if (exe.isPresent()) {
                List<String> resolved = new ArrayList<>(template);
                resolved.set(0, exe.get().toString());
                LOG.info("Voice feedback enabled via {}", exe.get().getFileName());
                return Optional.of(new CommandLineSpeechCapability(resolved, launcher));
            }
        }
        LOG.warn("No text-to-speech program found (tried {}); say-text actions will be skipped",
                candidates.stream().map(c -> c.get(0)).toList());
        return Optional.empty();
    }

    static List<List<String>> platformDefaults(Platform platform) {
        return switch (platform) {
            case MACOS -> List.of(List.of("say"));
            case WINDOWS -> List.of(List.of("powershell", "-NoProfile", "-Command", WINDOWS_SPEAK_SCRIPT));
            case LINUX, OTHER -> List.of(List.of("espeak"), List.of("spd-say"));
        };
    }
}
