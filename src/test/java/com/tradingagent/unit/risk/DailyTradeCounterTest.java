package com.tradingagent.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.risk.DailyTradeCounter;
import com.tradingagent.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DailyTradeCounterTest {

    @Test
    @DisplayName("Resets on the first read of a new day")
    void resetsAtMidnight() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T23:50:00Z"));
        DailyTradeCounter counter = new DailyTradeCounter(clock);
        counter.increment();
        counter.increment();

        assertThat(counter.current()).isEqualTo(2);
        assertThat(counter.resetIfNewDay()).isFalse();

        clock.advance(Duration.ofMinutes(15));

        assertThat(counter.resetIfNewDay()).isTrue();
        assertThat(counter.current()).isZero();
        assertThat(counter.increment()).isEqualTo(1);
    }
}
