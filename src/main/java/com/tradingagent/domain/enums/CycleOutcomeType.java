package com.tradingagent.domain.enums;

/** Terminal result of one agent cycle. */
public enum CycleOutcomeType {
    FILLED,
    FAILED,
    REJECTED,
    HELD,
    SIGNAL_ONLY,
    STALE_DATA,
    NO_MARKET_DATA,
    NO_DECISION,
    HALTED
}
