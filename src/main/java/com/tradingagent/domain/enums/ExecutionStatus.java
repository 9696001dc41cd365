package com.tradingagent.domain.enums;

public enum ExecutionStatus {
    FILLED,
    FAILED
}
