package com.tradingagent.learning;

import com.tradingagent.domain.model.ClosedTrade;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.monitor.TradeMonitor;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Feeds closed trades back into the adaptive context: every provider that contributed to a
 * closed trade's decision is credited with a win or a loss and the weights are recomputed.
 */
@Component
public class LearningStage {

    private static final Logger log = LoggerFactory.getLogger(LearningStage.class);

    private final TradeMonitor tradeMonitor;
    private final Clock clock;

    public LearningStage(TradeMonitor tradeMonitor, Clock clock) {
        this.tradeMonitor = tradeMonitor;
        this.clock = clock;
    }

    /**
     * @return number of closed trades applied; 0 when the monitor could not reach the venue
     */
    public int learn(AdaptiveContext context) {
        List<ClosedTrade> closedTrades;
        try {
            closedTrades = tradeMonitor.drainClosedTrades();
        } catch (CollaboratorUnavailableException e) {
            log.warn("Skipping learning this cycle, closed trades unavailable: {}", e.getMessage());
            return 0;
        }
        if (closedTrades.isEmpty()) {
            return 0;
        }

        for (ClosedTrade trade : closedTrades) {
            List<String> providers = trade.getProviders() != null ? trade.getProviders() : List.of();
            providers.forEach(provider -> context.recordTrade(provider, trade.isWin()));
            log.info(
                    "Learned from {} on {}: {} (providers={})",
                    trade.getDecisionId(),
                    trade.getAssetPair(),
                    trade.isWin() ? "win" : "loss",
                    providers);
        }
        context.setTradesRecorded(context.getTradesRecorded() + closedTrades.size());
        context.recalculateWeights();
        context.setUpdatedAt(clock.instant());
        return closedTrades.size();
    }
}
