package com.tradingagent.decision;

import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.MarketSnapshot;
import java.util.Optional;

/**
 * Source of trading decisions. How it reasons is its own business; the agent only
 * validates the shape of what comes back.
 */
public interface DecisionProvider {

    /**
     * @return a decision for {@code snapshot.getAssetPair()}, or empty when the provider has
     *     nothing to say this cycle
     */
    Optional<Decision> proposeDecision(MarketSnapshot snapshot, DecisionContext context);
}
