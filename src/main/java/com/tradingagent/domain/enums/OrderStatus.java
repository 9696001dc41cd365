package com.tradingagent.domain.enums;

/**
 * Venue-reported status of a submitted order.
 * ACCEPTED means the venue took the order but has not confirmed a fill.
 */
public enum OrderStatus {
    FILLED,
    ACCEPTED,
    REJECTED
}
