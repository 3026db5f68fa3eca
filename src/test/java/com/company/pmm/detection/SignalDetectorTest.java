package com.company.pmm.detection;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.domain.enums.SignalType;
import com.company.pmm.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.company.pmm.support.TestFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

class SignalDetectorTest {

    private final Clock clock = Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC);

    private SignalDetector detector(SignalRule... extra) {
        var properties = TestFixtures.properties();
        List<SignalRule> rules = new ArrayList<>(List.of(
                new AnomalyRule(properties),
                new TrendChangeRule(properties),
                new DeclinePatternRule(properties),
                new ThresholdBreachRule(),
                new DriftRule()));
        rules.addAll(List.of(extra));
        return new SignalDetector(rules, clock);
    }

    @Test
    @DisplayName("Rules run independently and may all fire on the same window")
    void allRulesFireIndependently() {
        List<Signal> signals = detector().detect("response_accuracy",
                series("response_accuracy", 0.95, 0.94, 0.93, 0.92, 0.815));

        assertThat(signals).extracting(Signal::getSignalType)
                .containsExactly(SignalType.ANOMALY, SignalType.PATTERN_DETECTED);
        assertThat(signals).allSatisfy(signal -> {
            assertThat(signal.getStatus()).isEqualTo(SignalStatus.ACTIVE);
            assertThat(signal.getTimestamp()).isEqualTo(TestFixtures.NOW);
            assertThat(signal.getSignalId()).startsWith("SIG-20250315120000-");
        });
        assertThat(signals.get(0).getSignalId()).isNotEqualTo(signals.get(1).getSignalId());
    }

    @Test
    void emptyWindowProducesNothing() {
        assertThat(detector().detect("m", List.of())).isEmpty();
    }

    @Test
    @DisplayName("A failing rule is skipped without hiding the others")
    void failingRuleIsIsolated() {
        SignalRule broken = new SignalRule() {
            @Override
            public SignalType type() {
                return SignalType.DRIFT_DETECTED;
            }

            @Override
            public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
                throw new IllegalStateException("boom");
            }
        };

        List<Signal> signals = detector(broken).detect("m", series("m", 1.0, 1.0, 2.0, 2.0));

        assertThat(signals).extracting(Signal::getSignalType).containsExactly(SignalType.TREND_CHANGE);
    }
}
