package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderResult {

    String clientOrderId;
    String venueOrderId;
    OrderStatus status;
    BigDecimal filledQuantity;
    BigDecimal fillPrice;
    String message;

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }
}
