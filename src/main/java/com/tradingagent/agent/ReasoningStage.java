package com.tradingagent.agent;

import com.tradingagent.decision.DecisionContext;
import com.tradingagent.decision.DecisionProvider;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.PortfolioSnapshot;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.learning.AdaptiveContext;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.ExternalCallExecutor;
import com.tradingagent.risk.DailyTradeCounter;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the decision provider for a decision and checks its shape before the gatekeeper sees
 * it. A provider failure counts toward the pair's reasoning back-off; a malformed decision is
 * dropped but does not count as a failure.
 *
 * <p>The decision's {@code marketDataCollectedAt} is always overwritten with the snapshot's
 * {@code collectedAt}, so freshness cannot be laundered through the provider.
 */
@Component
public class ReasoningStage {

    private static final Logger log = LoggerFactory.getLogger(ReasoningStage.class);

    private final DecisionProvider decisionProvider;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final ReasoningFailureTracker reasoningFailureTracker;
    private final DailyTradeCounter dailyTradeCounter;
    private final Clock clock;

    public ReasoningStage(
            DecisionProvider decisionProvider,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            ReasoningFailureTracker reasoningFailureTracker,
            DailyTradeCounter dailyTradeCounter,
            Clock clock) {
        this.decisionProvider = decisionProvider;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.reasoningFailureTracker = reasoningFailureTracker;
        this.dailyTradeCounter = dailyTradeCounter;
        this.clock = clock;
    }

    public Optional<Decision> reason(MarketSnapshot snapshot, PortfolioSnapshot portfolio, AdaptiveContext adaptive) {
        String assetPair = snapshot.getAssetPair();
        if (reasoningFailureTracker.isSuspended(assetPair)) {
            log.warn(
                    "Skipping reasoning for {} after {} consecutive failures",
                    assetPair,
                    reasoningFailureTracker.failureCount(assetPair));
            return Optional.empty();
        }

        DecisionContext context = DecisionContext.builder()
                .portfolio(portfolio)
                .providerWeights(Map.copyOf(adaptive.getProviderWeights()))
                .tradesToday(dailyTradeCounter.current())
                .build();

        Optional<Decision> proposed;
        try {
            proposed = externalCallExecutor.call(
                    callPolicies.getDecisionProvider(), () -> decisionProvider.proposeDecision(snapshot, context));
        } catch (CollaboratorUnavailableException e) {
            int failures = reasoningFailureTracker.recordFailure(assetPair);
            log.warn("Decision provider failed for {} ({} in a row): {}", assetPair, failures, e.getMessage());
            return Optional.empty();
        }
        reasoningFailureTracker.recordSuccess(assetPair);

        if (proposed == null || proposed.isEmpty()) {
            log.info("No decision for {} this cycle", assetPair);
            return Optional.empty();
        }

        Decision decision = proposed.get();
        Optional<String> problem = validate(decision, snapshot);
        if (problem.isPresent()) {
            log.warn("Discarding malformed decision for {}: {}", assetPair, problem.get());
            return Optional.empty();
        }
        return Optional.of(normalise(decision, snapshot));
    }

    private Optional<String> validate(Decision decision, MarketSnapshot snapshot) {
        if (decision.getAction() == null) {
            return Optional.of("missing action");
        }
        if (!snapshot.getAssetPair().equals(decision.getAssetPair())) {
            return Optional.of("asset pair " + decision.getAssetPair() + " does not match " + snapshot.getAssetPair());
        }
        if (Double.isNaN(decision.getConfidence()) || decision.getConfidence() < 0.0 || decision.getConfidence() > 1.0) {
            return Optional.of("confidence " + decision.getConfidence() + " outside 0..1");
        }
        if (decision.getRecommendedSize() != null && decision.getRecommendedSize().signum() < 0) {
            return Optional.of("negative recommended size");
        }
        if (decision.getEntryPrice() != null && decision.getEntryPrice().signum() <= 0) {
            return Optional.of("non-positive entry price");
        }
        return Optional.empty();
    }

    private Decision normalise(Decision decision, MarketSnapshot snapshot) {
        BigDecimal entryPrice = decision.getEntryPrice() != null ? decision.getEntryPrice() : snapshot.getPrice();
        return decision.toBuilder()
                .id(decision.getId() != null ? decision.getId() : UUID.randomUUID().toString())
                .entryPrice(entryPrice)
                .providers(decision.getProviders() != null ? List.copyOf(decision.getProviders()) : List.of())
                .marketDataCollectedAt(snapshot.getCollectedAt())
                .createdAt(decision.getCreatedAt() != null ? decision.getCreatedAt() : clock.instant())
                .build();
    }
}
