package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeAction;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Cooldown entry written when the gatekeeper rejects a decision. While active, the same
 * (asset pair, action) is rejected without re-running the expensive checks.
 */
@Value
@Builder
public class RejectionRecord {

    String assetPair;
    TradeAction action;

    /** Start of the cooldown-sized time bucket the rejection fell into. */
    Instant timeBucket;

    String reason;
    Instant rejectedAt;
    Instant expiresAt;

    public String getFingerprint() {
        return assetPair + "|" + action + "|" + timeBucket.getEpochSecond();
    }

    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
