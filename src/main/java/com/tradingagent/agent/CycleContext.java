package com.tradingagent.agent;

import com.tradingagent.domain.enums.CycleOutcomeType;
import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.execution.ExecutionResult;
import com.tradingagent.risk.RiskVerdict;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

/** Working state of the cycle in progress. Confined to the thread holding the cycle lock. */
@Getter
@Setter
class CycleContext {

    private final long cycleNumber;
    private final String assetPair;
    private final Instant startedAt;

    private PerceptionResult perception;
    private Decision decision;
    private RiskVerdict verdict;
    private ExecutionResult execution;

    private CycleOutcomeType outcomeType;
    private String reason;

    CycleContext(long cycleNumber, String assetPair, Instant startedAt) {
        this.cycleNumber = cycleNumber;
        this.assetPair = assetPair;
        this.startedAt = startedAt;
    }

    void finish(CycleOutcomeType outcomeType, String reason) {
        this.outcomeType = outcomeType;
        this.reason = reason;
    }

    boolean isFinished() {
        return outcomeType != null;
    }

    CycleOutcome toOutcome(Instant finishedAt) {
        return CycleOutcome.builder()
                .cycleNumber(cycleNumber)
                .assetPair(assetPair)
                .decisionId(decision != null ? decision.getId() : null)
                .action(decision != null ? decision.getAction() : null)
                .confidence(decision != null ? decision.getConfidence() : null)
                .outcome(outcomeType)
                .reason(reason)
                .tradeId(execution != null ? execution.getTradeId() : null)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }
}
