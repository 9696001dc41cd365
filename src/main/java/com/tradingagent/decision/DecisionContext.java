package com.tradingagent.decision;

import com.tradingagent.domain.model.PortfolioSnapshot;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** What the decision provider sees besides the market snapshot. */
@Value
@Builder
public class DecisionContext {

    PortfolioSnapshot portfolio;

    /** Learned weight per provider name, 0..1. Empty until the first closed trade. */
    Map<String, Double> providerWeights;

    int tradesToday;
}
