package com.tradingagent.domain.enums;

/**
 * Lifecycle state of the trading loop. Exactly one value is current per agent,
 * and it changes only through {@code AgentStateMachine.next}.
 */
public enum AgentState {
    IDLE,
    RECOVERING,
    PERCEPTION,
    REASONING,
    RISK_CHECK,
    EXECUTION,
    LEARNING
}
