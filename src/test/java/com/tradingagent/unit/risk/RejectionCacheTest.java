package com.tradingagent.unit.risk;

import static com.tradingagent.support.TestFixtures.limits;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.RejectionRecord;
import com.tradingagent.risk.RejectionCache;
import com.tradingagent.risk.RejectionReason;
import com.tradingagent.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RejectionCacheTest {

    private static final Instant START = Instant.parse("2026-03-02T10:07:30Z");

    private MutableClock clock;
    private RejectionCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new RejectionCache(limits().rejectionCooldown(Duration.ofMinutes(5)).build(), clock);
    }

    @Test
    @DisplayName("Records expire after the cooldown")
    void expiresAfterCooldown() {
        cache.recordRejection("BTC-USD", TradeAction.BUY, RejectionReason.VAR_LIMIT);

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertThat(cache.findActive("BTC-USD", TradeAction.BUY)).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.findActive("BTC-USD", TradeAction.BUY)).isEmpty();
    }

    @Test
    @DisplayName("Keys on pair and action")
    void keyedByPairAndAction() {
        cache.recordRejection("BTC-USD", TradeAction.BUY, RejectionReason.VAR_LIMIT);

        assertThat(cache.findActive("BTC-USD", TradeAction.SELL)).isEmpty();
        assertThat(cache.findActive("ETH-USD", TradeAction.BUY)).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Record carries reason, bucket and fingerprint")
    void recordContents() {
        RejectionRecord record = cache.recordRejection("BTC-USD", TradeAction.SELL, RejectionReason.MARGIN_LIMIT);

        assertThat(record.getReason()).isEqualTo("margin_limit");
        assertThat(record.getRejectedAt()).isEqualTo(START);
        assertThat(record.getExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(record.getTimeBucket()).isEqualTo(Instant.parse("2026-03-02T10:05:00Z"));
        assertThat(record.getFingerprint()).startsWith("BTC-USD|SELL|");
    }

    @Test
    @DisplayName("A newer rejection replaces the older one")
    void latestRejectionWins() {
        cache.recordRejection("BTC-USD", TradeAction.BUY, RejectionReason.VAR_LIMIT);
        clock.advance(Duration.ofMinutes(3));
        cache.recordRejection("BTC-USD", TradeAction.BUY, RejectionReason.LOW_CONFIDENCE);

        clock.advance(Duration.ofMinutes(3));

        assertThat(cache.findActive("BTC-USD", TradeAction.BUY))
                .get()
                .extracting(RejectionRecord::getReason)
                .isEqualTo("low_confidence");
    }

    @Test
    void clearRemovesEverything() {
        cache.recordRejection("BTC-USD", TradeAction.BUY, RejectionReason.VAR_LIMIT);
        cache.clear();

        assertThat(cache.size()).isZero();
    }
}
