package com.tradingagent.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class DoubleReservationException extends InvariantViolationException {

    private final String assetPair;
    private final String existingReservationId;

    public DoubleReservationException(String assetPair, String existingReservationId) {
        super(
                "Asset pair " + assetPair + " already holds reservation " + existingReservationId,
                Map.of("assetPair", assetPair, "existingReservationId", existingReservationId));
        this.assetPair = assetPair;
        this.existingReservationId = existingReservationId;
    }
}
