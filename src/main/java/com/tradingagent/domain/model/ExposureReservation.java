package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.ReservationStatus;
import com.tradingagent.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Capital held against an order submission that has not been reconciled yet.
 *
 * <p>Immutable; the {@code ExposureLedger} swaps in a new instance on every status change.
 */
@Value
@Builder(toBuilder = true)
public class ExposureReservation {

    String reservationId;
    String decisionId;
    String assetPair;
    TradeAction action;
    BigDecimal quantity;
    BigDecimal notional;
    BigDecimal margin;
    ReservationStatus status;
    Instant createdAt;
    Instant resolvedAt;
    String releaseReason;

    public boolean isHeld() {
        return status == ReservationStatus.HELD;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    public ExposureReservation committed(Instant at) {
        return toBuilder().status(ReservationStatus.COMMITTED).resolvedAt(at).build();
    }

    public ExposureReservation released(Instant at, String reason) {
        return toBuilder()
                .status(ReservationStatus.RELEASED)
                .resolvedAt(at)
                .releaseReason(reason)
                .build();
    }
}
