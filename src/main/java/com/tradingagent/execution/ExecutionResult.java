package com.tradingagent.execution;

import com.tradingagent.domain.enums.ExecutionStatus;
import java.math.BigDecimal;
import lombok.Getter;

@Getter
public class ExecutionResult {

    private final ExecutionStatus status;
    private final String reservationId;
    private final String tradeId;
    private final BigDecimal filledQuantity;
    private final BigDecimal fillPrice;
    private final String error;

    private ExecutionResult(
            ExecutionStatus status,
            String reservationId,
            String tradeId,
            BigDecimal filledQuantity,
            BigDecimal fillPrice,
            String error) {
        this.status = status;
        this.reservationId = reservationId;
        this.tradeId = tradeId;
        this.filledQuantity = filledQuantity;
        this.fillPrice = fillPrice;
        this.error = error;
    }

    public static ExecutionResult filled(
            String reservationId, String tradeId, BigDecimal filledQuantity, BigDecimal fillPrice) {
        return new ExecutionResult(ExecutionStatus.FILLED, reservationId, tradeId, filledQuantity, fillPrice, null);
    }

    /** Only ever built after the reservation has been released. */
    public static ExecutionResult failed(String reservationId, String error) {
        return new ExecutionResult(ExecutionStatus.FAILED, reservationId, null, null, null, error);
    }

    public boolean isFilled() {
        return status == ExecutionStatus.FILLED;
    }
}
