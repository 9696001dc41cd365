package com.tradingagent.marketdata;

import com.tradingagent.domain.model.MarketSnapshot;
import java.util.List;

public interface MarketDataProvider {

    /** Latest snapshot for the pair; {@code collectedAt} is when the provider observed it. */
    MarketSnapshot fetchSnapshot(String assetPair);

    /** Daily closes, oldest first, at most {@code days} entries. */
    List<Double> fetchPriceHistory(String assetPair, int days);
}
