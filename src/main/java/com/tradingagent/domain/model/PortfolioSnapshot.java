package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the gatekeeper needs to judge one decision: the cycle's market snapshot,
 * live positions, the account balance and close-price history per asset pair.
 *
 * <p>A null balance means the venue could not be read and the agent runs signal-only.
 */
@Value
@Builder
public class PortfolioSnapshot {

    MarketSnapshot marketSnapshot;

    @Singular
    List<Position> positions;

    AccountBalance balance;

    /** Daily closes, oldest first. */
    @Builder.Default
    Map<String, List<Double>> priceHistory = Map.of();

    Instant capturedAt;

    public boolean isSignalOnly() {
        return balance == null;
    }

    public BigDecimal getTotalUnrealizedPnl() {
        return positions.stream().map(Position::getUnrealizedPnlOrZero).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
