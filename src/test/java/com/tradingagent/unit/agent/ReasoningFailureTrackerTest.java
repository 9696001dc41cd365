package com.tradingagent.unit.agent;

import static com.tradingagent.support.TestFixtures.NOW;
import static com.tradingagent.support.TestFixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.agent.ReasoningFailureTracker;
import com.tradingagent.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReasoningFailureTrackerTest {

    private MutableClock clock;
    private ReasoningFailureTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tracker = new ReasoningFailureTracker(
                settings("BTC-USD").maxReasoningFailures(3).reasoningFailureDecay(Duration.ofMinutes(60)).build(),
                clock);
    }

    @Test
    @DisplayName("Suspends at the failure limit, per pair")
    void suspendsAtLimit() {
        tracker.recordFailure("BTC-USD");
        tracker.recordFailure("BTC-USD");
        assertThat(tracker.isSuspended("BTC-USD")).isFalse();

        tracker.recordFailure("BTC-USD");

        assertThat(tracker.isSuspended("BTC-USD")).isTrue();
        assertThat(tracker.isSuspended("ETH-USD")).isFalse();
    }

    @Test
    @DisplayName("Failures decay after the configured quiet period")
    void decays() {
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure("BTC-USD");
        }

        clock.advance(Duration.ofMinutes(59));
        assertThat(tracker.isSuspended("BTC-USD")).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(tracker.isSuspended("BTC-USD")).isFalse();
        assertThat(tracker.failureCount("BTC-USD")).isZero();
    }

    @Test
    @DisplayName("Reset clears every pair")
    void resetAll() {
        tracker.recordFailure("BTC-USD");
        tracker.recordFailure("ETH-USD");

        tracker.resetAll();

        assertThat(tracker.failureCount("BTC-USD")).isZero();
        assertThat(tracker.failureCount("ETH-USD")).isZero();
    }
}
