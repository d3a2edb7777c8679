package com.phillippitts.gesturelauncher.service.capability;

import com.phillippitts.gesturelauncher.testutil.RecordingProcessLauncher;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandLineSpeechCapabilityTest {

    @Test
    void appendsTextWithoutPlaceholder() {
        CommandLineSpeechCapability s = new CommandLineSpeechCapability(List.of("espeak", "-s", "160"),
                new RecordingProcessLauncher());

        assertThat(s.command("Opening website.")).containsExactly("espeak", "-s", "160", "Opening website.");
    }

    @Test
    void substitutesPlaceholderAndEscapesQuotes() {
        CommandLineSpeechCapability s = new CommandLineSpeechCapability(
                List.of("powershell", "-Command", "Speak('{text}')"), new RecordingProcessLauncher());

        assertThat(s.command("it's here")).containsExactly("powershell", "-Command", "Speak('it''s here')");
    }

    @Test
    void blankTextLaunchesNothing() throws Exception {
        RecordingProcessLauncher launcher = new RecordingProcessLauncher();
        CommandLineSpeechCapability s = new CommandLineSpeechCapability(List.of("say"), launcher);

        s.speak("   ");
        s.speak(null);

        assertThat(launcher.commands).isEmpty();
    }

    @Test
    void closeStopsRunningUtterance() throws Exception {
        Process p = mock(Process.class);
        when(p.isAlive()).thenReturn(true);
        CommandLineSpeechCapability s = new CommandLineSpeechCapability(List.of("say"), cmd -> p);

        s.speak("hello");
        s.close();

        verify(p).destroy();
    }

    @Test
    void rejectsEmptyTemplate() {
        assertThatThrownBy(() -> new CommandLineSpeechCapability(List.of(), new RecordingProcessLauncher()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
