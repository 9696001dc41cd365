package com.tradingagent.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Lifecycle events published by the trading loop. {@code code} is the external event name. */
@Getter
@RequiredArgsConstructor
public enum AgentEventType {
    RECOVERY_COMPLETE("recovery_complete"),
    RECOVERY_FAILED("recovery_failed"),
    DATA_FRESHNESS_FAILED("data_freshness_failed"),
    RISK_REJECTED("risk_rejected"),
    TRADE_EXECUTED("trade_executed"),
    TRADE_FAILED("trade_failed"),
    KILL_SWITCH_TRIGGERED("kill_switch_triggered"),
    RESERVATION_EXPIRED("reservation_expired");

    private final String code;
}
