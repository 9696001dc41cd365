package com.tradingagent.simulator;

import java.math.BigDecimal;

/** Last traded price per asset pair, as the paper venue marks and fills against it. */
@FunctionalInterface
public interface QuoteSource {

    BigDecimal currentPrice(String assetPair);
}
