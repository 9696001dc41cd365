package com.tradingagent.agent;

import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.PortfolioSnapshot;
import com.tradingagent.domain.model.Position;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.marketdata.MarketDataProvider;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.ExternalCallExecutor;
import com.tradingagent.risk.RiskLimits;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Assembles the {@link PortfolioSnapshot} for a cycle: venue positions and balance, plus
 * close history for the cycle's pair and every pair with an open position.
 *
 * <p>If the venue cannot be read the snapshot has no balance and the cycle runs
 * signal-only. Missing price history for a pair only weakens the VaR and correlation
 * checks for that pair.
 */
@Component
public class PortfolioSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(PortfolioSnapshotProvider.class);

    private final TradingPlatformGateway tradingPlatformGateway;
    private final MarketDataProvider marketDataProvider;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final RiskLimits riskLimits;
    private final Clock clock;

    public PortfolioSnapshotProvider(
            TradingPlatformGateway tradingPlatformGateway,
            MarketDataProvider marketDataProvider,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            RiskLimits riskLimits,
            Clock clock) {
        this.tradingPlatformGateway = tradingPlatformGateway;
        this.marketDataProvider = marketDataProvider;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.riskLimits = riskLimits;
        this.clock = clock;
    }

    public PortfolioSnapshot capture(MarketSnapshot marketSnapshot) {
        PortfolioSnapshot.PortfolioSnapshotBuilder builder =
                PortfolioSnapshot.builder().marketSnapshot(marketSnapshot).capturedAt(clock.instant());

        List<Position> positions = List.of();
        try {
            positions = externalCallExecutor.call(callPolicies.getVenueQuery(), tradingPlatformGateway::getPositions)
                    .stream()
                    .filter(position -> !position.isFlat())
                    .toList();
            AccountBalance balance =
                    externalCallExecutor.call(callPolicies.getVenueQuery(), tradingPlatformGateway::getBalance);
            builder.balance(balance);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Venue unavailable, cycle for {} runs signal-only: {}", marketSnapshot.getAssetPair(), e.getMessage());
        }
        builder.positions(positions);

        Set<String> pairs = new LinkedHashSet<>();
        pairs.add(marketSnapshot.getAssetPair());
        positions.forEach(position -> pairs.add(position.getAssetPair()));
        Map<String, List<Double>> history = new LinkedHashMap<>();
        for (String pair : pairs) {
            try {
                List<Double> closes = externalCallExecutor.call(
                        callPolicies.getMarketData(),
                        () -> marketDataProvider.fetchPriceHistory(pair, riskLimits.getPriceHistoryDays()));
                if (closes != null && !closes.isEmpty()) {
                    history.put(pair, List.copyOf(closes));
                }
            } catch (CollaboratorUnavailableException e) {
                log.warn("No price history for {}: {}", pair, e.getMessage());
            }
        }
        builder.priceHistory(history);
        return builder.build();
    }
}
