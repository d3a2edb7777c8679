package com.phillippitts.gesturelauncher.config.properties;

import com.phillippitts.gesturelauncher.domain.GestureSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GesturePropertiesTest {

    @Test
    void nullsMeanDefaults() {
        GestureProperties props = new GestureProperties(null, null);

        assertThat(props.getStableFrames()).isEqualTo(6);
        assertThat(props.getCooldownSeconds()).isEqualTo(3.0);
        assertThat(props.toSettings()).isEqualTo(GestureSettings.defaults());
    }

    @Test
    void fractionalCooldownIsKept() {
        GestureSettings s = new GestureProperties(3, 2.5).toSettings();

        assertThat(s.stableFrames()).isEqualTo(3);
        assertThat(s.cooldown()).isEqualTo(Duration.ofMillis(2500));
    }

    @Test
    void feedbackAndSourceDefaults() {
        FeedbackProperties feedback = new FeedbackProperties(null, null, null, " ", null, null);
        ObservationSourceProperties source = new ObservationSourceProperties(null, "");

        assertThat(feedback.isEnabled()).isTrue();
        assertThat(feedback.isSpeechEnabled()).isTrue();
        assertThat(feedback.getSpeechCommand()).isEmpty();
        assertThat(feedback.getOpenUrlMessage()).isEqualTo("Opening website.");
        assertThat(source.isEnabled()).isTrue();
        assertThat(source.getPath()).isEqualTo(ObservationSourceProperties.STDIN);
    }
}
