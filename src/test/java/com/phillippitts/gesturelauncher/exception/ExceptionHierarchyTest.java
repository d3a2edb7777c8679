package com.phillippitts.gesturelauncher.exception;

import com.phillippitts.gesturelauncher.domain.ActionKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void gestureLauncherExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        GestureLauncherException ex = new GestureLauncherException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void actionDispatchExceptionShouldCarryKindAndReason() {
        ActionDispatchException ex = new ActionDispatchException(ActionKind.OPEN_URL, "malformed URL");

        assertThat(ex.getKind()).isEqualTo(ActionKind.OPEN_URL);
        assertThat(ex.getReason()).isEqualTo("malformed URL");
        assertThat(ex.getMessage()).contains("open-url").contains("malformed URL");
    }

    @Test
    void executableNotFoundIsAnOpenProgramDispatchFailure() {
        ExecutableNotFoundException ex = new ExecutableNotFoundException("chrome");

        assertThat(ex).isInstanceOf(ActionDispatchException.class);
        assertThat(ex.getKind()).isEqualTo(ActionKind.OPEN_PROGRAM);
        assertThat(ex.getProgramName()).isEqualTo("chrome");
        assertThat(ex.getMessage()).contains("chrome");
    }

    @Test
    void observationSourceExceptionShouldIncludeSource() {
        ObservationSourceException ex = new ObservationSourceException("/tmp/feed", "Tracker feed not found");

        assertThat(ex.getSource()).isEqualTo("/tmp/feed");
        assertThat(ex.getMessage()).contains("/tmp/feed");
        assertThat(ex).isInstanceOf(GestureLauncherException.class);
    }
}
