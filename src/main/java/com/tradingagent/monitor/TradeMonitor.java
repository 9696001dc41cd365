package com.tradingagent.monitor;

import com.tradingagent.domain.model.ClosedTrade;
import java.util.List;

/** Tracks open trades back to the decision that opened them so Learning can attribute outcomes. */
public interface TradeMonitor {

    void associateDecision(String decisionId, String assetPair, List<String> providers);

    /** Trades closed since the previous drain. Each closed trade is returned once. */
    List<ClosedTrade> drainClosedTrades();

    /** Pairs currently associated with a decision. */
    List<String> trackedPairs();
}
