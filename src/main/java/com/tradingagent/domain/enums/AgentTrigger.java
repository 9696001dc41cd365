package com.tradingagent.domain.enums;

/** Outcome of a stage handler that drives the next state transition. */
public enum AgentTrigger {
    RECOVERY_FINISHED,
    CYCLE_REQUESTED,
    SNAPSHOT_FRESH,
    SNAPSHOT_STALE,
    SNAPSHOT_UNAVAILABLE,
    KILL_SWITCH_TRIGGERED,
    DECISION_PRODUCED,
    DECISION_UNAVAILABLE,
    RISK_APPROVED,
    RISK_REJECTED,
    HOLD_DECIDED,
    SIGNAL_ONLY,
    EXECUTION_FINISHED,
    LEARNING_FINISHED
}
