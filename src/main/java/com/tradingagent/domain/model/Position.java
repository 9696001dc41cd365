package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open position as reported by the venue. The agent mirrors it read-only.
 *
 * <p>Quantity is signed: positive = LONG, negative = SHORT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String positionId;
    private String assetPair;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal unrealizedPnl;
    private Instant openedAt;

    public PositionSide getSide() {
        return quantity == null || quantity.signum() >= 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    public boolean isFlat() {
        return quantity == null || quantity.signum() == 0;
    }

    /** Signed market value; falls back to entry price when no mark is available. */
    public BigDecimal getSignedNotional() {
        BigDecimal mark = currentPrice != null ? currentPrice : entryPrice;
        if (quantity == null || mark == null) {
            return BigDecimal.ZERO;
        }
        return quantity.multiply(mark);
    }

    public BigDecimal getUnrealizedPnlOrZero() {
        return unrealizedPnl != null ? unrealizedPnl : BigDecimal.ZERO;
    }
}
