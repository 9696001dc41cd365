package com.tradingagent.domain.enums;

/**
 * HELD while an order submission is in flight or unreconciled.
 * COMMITTED and RELEASED are terminal.
 */
public enum ReservationStatus {
    HELD,
    COMMITTED,
    RELEASED
}
