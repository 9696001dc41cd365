package com.tradingagent.agent;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.marketdata.DataFreshnessValidator;
import com.tradingagent.marketdata.MarketDataProvider;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.ExternalCallExecutor;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches the cycle's market snapshot and validates its freshness. A stale snapshot
 * publishes data_freshness_failed and ends the cycle; the portfolio is only captured for a
 * fresh one.
 */
@Component
public class PerceptionStage {

    private static final Logger log = LoggerFactory.getLogger(PerceptionStage.class);

    private final MarketDataProvider marketDataProvider;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final DataFreshnessValidator dataFreshnessValidator;
    private final PortfolioSnapshotProvider portfolioSnapshotProvider;
    private final EventPublisherHelper eventPublisherHelper;

    public PerceptionStage(
            MarketDataProvider marketDataProvider,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            DataFreshnessValidator dataFreshnessValidator,
            PortfolioSnapshotProvider portfolioSnapshotProvider,
            EventPublisherHelper eventPublisherHelper) {
        this.marketDataProvider = marketDataProvider;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.dataFreshnessValidator = dataFreshnessValidator;
        this.portfolioSnapshotProvider = portfolioSnapshotProvider;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public PerceptionResult perceive(String assetPair) {
        MarketSnapshot snapshot;
        try {
            snapshot = externalCallExecutor.call(
                    callPolicies.getMarketData(), () -> marketDataProvider.fetchSnapshot(assetPair));
        } catch (CollaboratorUnavailableException e) {
            log.warn("No market snapshot for {}: {}", assetPair, e.getMessage());
            return PerceptionResult.builder()
                    .status(PerceptionResult.Status.UNAVAILABLE)
                    .error(e.getMessage())
                    .build();
        }
        if (snapshot == null || snapshot.getPrice() == null || snapshot.getPrice().signum() <= 0) {
            log.warn("Market snapshot for {} has no usable price", assetPair);
            return PerceptionResult.builder()
                    .status(PerceptionResult.Status.UNAVAILABLE)
                    .snapshot(snapshot)
                    .error("snapshot without price")
                    .build();
        }

        Duration age = dataFreshnessValidator.ageOf(snapshot.getCollectedAt());
        if (!dataFreshnessValidator.isFresh(snapshot)) {
            log.warn(
                    "Stale market data for {}: {}s old, limit {}s",
                    assetPair,
                    age.toSeconds(),
                    dataFreshnessValidator.getThreshold().toSeconds());
            eventPublisherHelper.publishDataFreshnessFailed(this, snapshot, age, dataFreshnessValidator.getThreshold());
            return PerceptionResult.builder()
                    .status(PerceptionResult.Status.STALE)
                    .snapshot(snapshot)
                    .dataAge(age)
                    .build();
        }

        return PerceptionResult.builder()
                .status(PerceptionResult.Status.FRESH)
                .snapshot(snapshot)
                .portfolio(portfolioSnapshotProvider.capture(snapshot))
                .dataAge(age)
                .build();
    }
}
