package com.phillippitts.gesturelauncher.service.gesture;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StabilityTrackerTest {

    @Test
    void consecutiveTicksCountsRepeats() {
        StabilityTracker t = new StabilityTracker(6);
        StabilityState s = null;
        for (int i = 0; i < 4; i++) {
            s = t.advance(OptionalInt.of(3));
        }
        assertThat(s.lastCount()).hasValue(3);
        assertThat(s.consecutiveTicks()).isEqualTo(4);
    }

    @Test
    void becomesStableOnThresholdTick() {
        StabilityTracker t = new StabilityTracker(6);
        for (int i = 0; i < 5; i++) {
            assertThat(t.advance(OptionalInt.of(2)).stable()).isFalse();
        }
        assertThat(t.advance(OptionalInt.of(2)).stable()).isTrue();
    }

    @Test
    void changedCountRestartsAtOne() {
        StabilityTracker t = new StabilityTracker(3);
        t.advance(OptionalInt.of(1));
        t.advance(OptionalInt.of(1));

        StabilityState s = t.advance(OptionalInt.of(4));

        assertThat(s.lastCount()).hasValue(4);
        assertThat(s.consecutiveTicks()).isEqualTo(1);
        assertThat(s.stable()).isFalse();
    }

    @Test
    void noHandResetsState() {
        StabilityTracker t = new StabilityTracker(3);
        t.advance(OptionalInt.of(5));
        t.advance(OptionalInt.of(5));

        StabilityState s = t.advance(OptionalInt.empty());

        assertThat(s).isEqualTo(StabilityState.INITIAL);
        assertThat(t.advance(OptionalInt.of(5)).consecutiveTicks()).isEqualTo(1);
    }

    @Test
    void flickerNeverBecomesStable() {
        StabilityTracker t = new StabilityTracker(2);
        for (int i = 0; i < 20; i++) {
            assertThat(t.advance(OptionalInt.of(i % 2)).stable()).isFalse();
        }
    }

    @Test
    void staysStableWhileHeld() {
        StabilityTracker t = new StabilityTracker(1);
        for (int i = 0; i < 10; i++) {
            assertThat(t.advance(OptionalInt.of(0)).stable()).isTrue();
        }
        assertThat(t.state().consecutiveTicks()).isEqualTo(10);
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new StabilityTracker(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stableFrames");
    }
}
