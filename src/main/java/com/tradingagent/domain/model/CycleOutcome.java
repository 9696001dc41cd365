package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.CycleOutcomeType;
import com.tradingagent.domain.enums.TradeAction;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One record per completed cycle, whatever path it took back to IDLE. */
@Value
@Builder
public class CycleOutcome {

    long cycleNumber;
    String assetPair;
    String decisionId;
    TradeAction action;
    Double confidence;
    CycleOutcomeType outcome;
    String reason;
    String tradeId;
    Instant startedAt;
    Instant finishedAt;

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }
}
