package com.tradingagent.domain.enums;

public enum PositionSide {
    LONG,
    SHORT
}
