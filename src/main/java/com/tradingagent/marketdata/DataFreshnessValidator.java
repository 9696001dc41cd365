package com.tradingagent.marketdata;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.risk.RiskLimits;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Single definition of "stale" shared by Perception and the gatekeeper, so a snapshot
 * that passed Perception can still be caught if the cycle itself ran long.
 */
@Component
public class DataFreshnessValidator {

    /** How far ahead of the local clock a source timestamp may be before it is distrusted. */
    public static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(30);

    private final RiskLimits riskLimits;
    private final Clock clock;

    public DataFreshnessValidator(RiskLimits riskLimits, Clock clock) {
        this.riskLimits = riskLimits;
        this.clock = clock;
    }

    public boolean isFresh(MarketSnapshot snapshot) {
        return snapshot != null && isFresh(snapshot.getCollectedAt());
    }

    /**
     * A missing timestamp is stale. A timestamp ahead of the local clock is fresh only within
     * {@link #MAX_CLOCK_SKEW}; anything further ahead cannot be aged and counts as stale.
     */
    public boolean isFresh(Instant collectedAt) {
        if (collectedAt == null) {
            return false;
        }
        Duration age = ageOf(collectedAt);
        if (age.isNegative()) {
            return age.negated().compareTo(MAX_CLOCK_SKEW) <= 0;
        }
        return age.compareTo(riskLimits.getStaleDataThreshold()) <= 0;
    }

    public boolean isAhead(Instant collectedAt) {
        return collectedAt != null && ageOf(collectedAt).negated().compareTo(MAX_CLOCK_SKEW) > 0;
    }

    public Duration ageOf(Instant collectedAt) {
        if (collectedAt == null) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        return Duration.between(collectedAt, clock.instant());
    }

    public Duration getThreshold() {
        return riskLimits.getStaleDataThreshold();
    }
}
