package com.tradingagent.risk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Reasons the gatekeeper can reject a decision, in evaluation order. */
@Getter
@RequiredArgsConstructor
public enum RejectionReason {
    COOLDOWN_ACTIVE("cooldown_active"),
    STALE_DATA("stale_data"),
    CORRELATION_LIMIT("correlation_limit"),
    SIZING_FAILED("sizing_failed"),
    VAR_LIMIT("var_limit"),
    MARGIN_LIMIT("margin_limit"),
    DAILY_TRADE_LIMIT("daily_trade_limit"),
    LOW_CONFIDENCE("low_confidence"),
    MAX_DRAWDOWN("max_drawdown"),
    VOLATILITY_CONFIDENCE("volatility_confidence");

    private final String code;
}
