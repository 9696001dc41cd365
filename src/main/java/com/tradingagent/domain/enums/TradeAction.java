package com.tradingagent.domain.enums;

public enum TradeAction {
    BUY,
    SELL,
    HOLD;

    /** +1 for BUY, -1 for SELL, 0 for HOLD. */
    public int direction() {
        return switch (this) {
            case BUY -> 1;
            case SELL -> -1;
            case HOLD -> 0;
        };
    }
}
