package com.tradingagent.agent;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Loop-level settings for {@link TradingLoopAgent}. Risk limits live in {@code RiskLimits}. */
@Data
@Builder
public class AgentSettings {

    /** Traded in round-robin order, one pair per cycle. */
    private List<String> assetPairs;

    /** Recovery closes the excess when more positions than this are open at startup. */
    private int maxConcurrentTrades;

    /** Fraction of equity; null disables the kill switch. */
    private BigDecimal killSwitchLossPct;

    private int maxReasoningFailures;
    private Duration reasoningFailureDecay;

    /** HELD reservations older than this are released by the sweeper. */
    private Duration reservationMaxAge;

    /** When false every approved decision is logged as a signal and never executed. */
    private boolean autonomousExecution;

    private boolean autoStart;
}
