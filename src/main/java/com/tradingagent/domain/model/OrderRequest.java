package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeAction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Market order handed to the venue. {@code clientOrderId} is the decision id, so a venue
 * that de-duplicates on it never fills the same decision twice.
 */
@Value
@Builder
public class OrderRequest {

    String clientOrderId;
    String assetPair;
    TradeAction action;
    BigDecimal quantity;
    BigDecimal referencePrice;
    BigDecimal stopLossPrice;
}
