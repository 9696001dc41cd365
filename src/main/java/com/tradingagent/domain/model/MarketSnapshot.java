package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time market observation for one asset pair. Consumed once per cycle.
 *
 * <p>Technical fields may be null when the provider lacks enough history to compute them.
 */
@Value
@Builder
public class MarketSnapshot {

    String assetPair;
    BigDecimal price;

    /** Simple moving average over the provider's lookback window. */
    BigDecimal sma;

    Double rsi;

    /** Standard deviation of recent returns. */
    Double volatility;

    /** -1 (bearish) .. +1 (bullish); null when no sentiment source is wired. */
    Double sentimentScore;

    Instant collectedAt;

    public Duration ageAt(Instant now) {
        return Duration.between(collectedAt, now);
    }
}
