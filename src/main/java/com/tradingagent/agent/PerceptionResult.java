package com.tradingagent.agent;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.PortfolioSnapshot;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerceptionResult {

    public enum Status {
        FRESH,
        STALE,
        UNAVAILABLE
    }

    Status status;
    MarketSnapshot snapshot;

    /** Only captured for FRESH snapshots. */
    PortfolioSnapshot portfolio;

    Duration dataAge;
    String error;
}
