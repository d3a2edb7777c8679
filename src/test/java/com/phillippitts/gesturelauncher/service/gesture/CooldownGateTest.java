package com.phillippitts.gesturelauncher.service.gesture;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CooldownGateTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void openBeforeFirstRecord() {
        CooldownGate gate = new CooldownGate(Duration.ofSeconds(3));
        assertThat(gate.allow(T0)).isTrue();
        assertThat(gate.lastTrigger()).isEmpty();
        assertThat(gate.remaining(T0)).isZero();
    }

    @Test
    void closedUntilCooldownElapses() {
        CooldownGate gate = new CooldownGate(Duration.ofSeconds(3));
        gate.record(T0);

        assertThat(gate.allow(T0)).isFalse();
        assertThat(gate.allow(T0.plusMillis(2999))).isFalse();
        assertThat(gate.allow(T0.plusSeconds(3))).isTrue();
        assertThat(gate.allow(T0.plusSeconds(10))).isTrue();
    }

    @Test
    void remainingCountsDown() {
        CooldownGate gate = new CooldownGate(Duration.ofSeconds(2));
        gate.record(T0);

        assertThat(gate.remaining(T0.plusMillis(500))).isEqualTo(Duration.ofMillis(1500));
        assertThat(gate.remaining(T0.plusSeconds(5))).isZero();
    }

    @Test
    void zeroCooldownAlwaysOpen() {
        CooldownGate gate = new CooldownGate(Duration.ZERO);
        gate.record(T0);
        assertThat(gate.allow(T0)).isTrue();
    }

    @Test
    void rejectsNegativeCooldown() {
        assertThatThrownBy(() -> new CooldownGate(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
