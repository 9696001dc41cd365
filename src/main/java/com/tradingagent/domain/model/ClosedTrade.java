package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** A position the trade monitor saw disappear from the venue, attributed to its originating decision. */
@Value
@Builder
public class ClosedTrade {

    String decisionId;
    String assetPair;
    List<String> providers;
    BigDecimal realizedPnl;
    Instant closedAt;

    public boolean isWin() {
        return realizedPnl != null && realizedPnl.signum() > 0;
    }
}
