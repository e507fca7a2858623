package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import com.ipcsentinel.core.model.EventTypes;
import com.ipcsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AutomatedAttackPattern}.
 */
class AutomatedAttackPatternTest {

    private AutomatedAttackPattern pattern;

    @BeforeEach
    void setUp() {
        pattern = new AutomatedAttackPattern(new PatternSettings.AutomatedAttack());
    }

    @Test
    @DisplayName("Should fire for ten events spaced exactly 100 ms apart")
    void shouldFireForMetronomicTiming() {
        List<SecurityEvent> events = TestEvents.atOffsets(EventTypes.INVALID_INPUT, 10_000,
                0, 100, 200, 300, 400, 500, 600, 700, 800, 900);

        assertThat(pattern.detect(TestEvents.history(events, 10_900))).isTrue();
    }

    @Test
    @DisplayName("Should NOT fire when interval standard deviation exceeds 10 ms")
    void shouldNotFireForIrregularTiming() {
        List<SecurityEvent> events = TestEvents.atOffsets(EventTypes.INVALID_INPUT, 10_000,
                0, 80, 200, 280, 400, 480, 600, 680, 800, 880);

        assertThat(AutomatedAttackPattern.intervalVariance(events)).isGreaterThan(100.0);
        assertThat(pattern.detect(TestEvents.history(events, 10_880))).isFalse();
    }

    @Test
    @DisplayName("Should NOT fire with fewer than ten events in the log")
    void shouldNotFireBelowMinimumEvents() {
        List<SecurityEvent> events = TestEvents.atOffsets(EventTypes.INVALID_INPUT, 10_000,
                0, 100, 200, 300, 400, 500, 600, 700, 800);

        assertThat(pattern.detect(TestEvents.history(events, 10_800))).isFalse();
    }

    @Test
    @DisplayName("Should compute population variance of intervals")
    void shouldComputePopulationVariance() {
        List<SecurityEvent> events = TestEvents.atOffsets(EventTypes.INVALID_INPUT, 0, 0, 10, 30);

        // intervals 10 and 20: mean 15, variance 25
        assertThat(AutomatedAttackPattern.intervalVariance(events)).isCloseTo(25.0, within(1e-9));
    }

    @Test
    @DisplayName("Should expose name, severity and lookback")
    void shouldDescribeItself() {
        assertThat(pattern.getName()).isEqualTo("automated_attack");
        assertThat(pattern.getSeverity().label()).isEqualTo("high");
        assertThat(pattern.getLookback()).isEqualTo(10);
    }
}
