package com.tradingagent.unit.marketdata;

import static com.tradingagent.support.TestFixtures.NOW;
import static com.tradingagent.support.TestFixtures.limits;
import static com.tradingagent.support.TestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.marketdata.DataFreshnessValidator;
import com.tradingagent.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for DataFreshnessValidator covering the age threshold and clock skew. */
class DataFreshnessValidatorTest {

    private DataFreshnessValidator validator;

    @BeforeEach
    void setUp() {
        validator = new DataFreshnessValidator(limits().build(), new MutableClock(NOW));
    }

    @Test
    @DisplayName("Data up to the threshold is fresh")
    void freshUpToThreshold() {
        assertThat(validator.isFresh(NOW.minus(Duration.ofMinutes(15)))).isTrue();
        assertThat(validator.isFresh(NOW.minus(Duration.ofMinutes(15)).minusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("Missing timestamps and snapshots are stale")
    void missingIsStale() {
        assertThat(validator.isFresh(snapshot("BTC-USD", "100", null))).isFalse();
        assertThat(validator.isFresh((MarketSnapshot) null)).isFalse();
    }

    @Test
    @DisplayName("A timestamp slightly ahead of the clock is tolerated as skew")
    void smallSkewIsFresh() {
        assertThat(validator.isFresh(NOW.plus(DataFreshnessValidator.MAX_CLOCK_SKEW))).isTrue();
        assertThat(validator.isAhead(NOW.plusSeconds(5))).isFalse();
    }

    @Test
    @DisplayName("A timestamp far in the future is stale")
    void farFutureIsStale() {
        assertThat(validator.isFresh(NOW.plus(Duration.ofHours(2)))).isFalse();
        assertThat(validator.isAhead(NOW.plus(Duration.ofHours(2)))).isTrue();
    }
}
