package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountBalance {

    BigDecimal equity;
    BigDecimal freeMargin;
    BigDecimal usedMargin;
    String currency;
}
