package com.tradingagent.recovery;

import com.tradingagent.agent.AgentSettings;
import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.domain.model.Position;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.monitor.TradeMonitor;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.CallPolicy;
import com.tradingagent.resilience.ExternalCallExecutor;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles the agent with the venue before the first cycle.
 *
 * <p>Sequence:
 * <ol>
 *   <li>Release any HELD reservation left in the ledger; nothing can be in flight yet.</li>
 *   <li>Fetch live positions, retrying exactly once. If both attempts fail recovery continues
 *       degraded with no known positions.</li>
 *   <li>Close the positions over {@code maxConcurrentTrades}, chosen by
 *       {@link PositionCloseOrdering#CLOSE_PRIORITY}. Each close gets one retry; any close
 *       that still fails makes the whole recovery fail.</li>
 *   <li>Associate every surviving position with the trade monitor under a synthetic
 *       decision id.</li>
 * </ol>
 *
 * <p>Publishes recovery_complete or recovery_failed with the {@link RecoveryResult}.
 */
@Service
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    static final int RECOVERY_ATTEMPTS = 2;
    static final String RECOVERED_PROVIDER = "recovered";

    private final TradingPlatformGateway tradingPlatformGateway;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final ExposureLedger exposureLedger;
    private final TradeMonitor tradeMonitor;
    private final AgentSettings agentSettings;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public RecoveryManager(
            TradingPlatformGateway tradingPlatformGateway,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            ExposureLedger exposureLedger,
            TradeMonitor tradeMonitor,
            AgentSettings agentSettings,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.tradingPlatformGateway = tradingPlatformGateway;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.exposureLedger = exposureLedger;
        this.tradeMonitor = tradeMonitor;
        this.agentSettings = agentSettings;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");
        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(clock.millis()).build();

        try {
            releaseLeftoverReservations(recoveryResult);
            List<Position> positions = fetchPositions(recoveryResult);
            List<Position> survivors = closeExcessPositions(positions, recoveryResult);
            if (recoveryResult.getFailedClosePairs().isEmpty()) {
                associateSurvivors(survivors, recoveryResult);
                recoveryResult.setSuccess(true);
            } else {
                recoveryResult.setSuccess(false);
                recoveryResult.setError("Failed to close " + recoveryResult.getFailedClosePairs());
            }
        } catch (RuntimeException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
        }

        recoveryResult.setDurationMs(clock.millis() - recoveryResult.getStartedAt());

        if (recoveryResult.isSuccess()) {
            log.info(
                    "Recovery complete in {}ms: positionsFound={}, closed={}, degraded={}",
                    recoveryResult.getDurationMs(),
                    recoveryResult.getPositionsFound(),
                    recoveryResult.getClosedPairs(),
                    recoveryResult.isDegraded());
            eventPublisherHelper.publishRecoveryComplete(this, recoveryResult);
        } else {
            log.error("Recovery failed, agent will not trade: {}", recoveryResult.getError());
            eventPublisherHelper.publishRecoveryFailed(this, recoveryResult);
        }
        return recoveryResult;
    }

    void releaseLeftoverReservations(RecoveryResult recoveryResult) {
        List<ExposureReservation> released = exposureLedger.releaseAll("released during startup recovery");
        recoveryResult.setReleasedReservations(released.size());
        if (!released.isEmpty()) {
            log.warn("Released {} reservation(s) left over from before recovery", released.size());
        }
    }

    List<Position> fetchPositions(RecoveryResult recoveryResult) {
        try {
            List<Position> positions =
                    externalCallExecutor.call(recoveryPolicy(), tradingPlatformGateway::getPositions);
            List<Position> open =
                    positions.stream().filter(position -> !position.isFlat()).toList();
            recoveryResult.setPositionsFound(open.size());
            log.info("Found {} open position(s) at the venue", open.size());
            return open;
        } catch (CollaboratorUnavailableException e) {
            recoveryResult.setDegraded(true);
            log.warn("Position fetch failed after retry, continuing with no known positions: {}", e.getMessage());
            return List.of();
        }
    }

    List<Position> closeExcessPositions(List<Position> positions, RecoveryResult recoveryResult) {
        int excess = positions.size() - agentSettings.getMaxConcurrentTrades();
        if (excess <= 0) {
            return positions;
        }

        List<Position> ordered = new ArrayList<>(positions);
        ordered.sort(PositionCloseOrdering.CLOSE_PRIORITY);
        List<Position> toClose = ordered.subList(0, excess);
        List<Position> survivors = new ArrayList<>(ordered.subList(excess, ordered.size()));
        log.warn(
                "{} open positions exceed the limit of {}, closing {}",
                positions.size(),
                agentSettings.getMaxConcurrentTrades(),
                toClose.stream().map(Position::getAssetPair).toList());

        for (Position position : toClose) {
            try {
                OrderResult result = externalCallExecutor.call(
                        callPolicies.getVenueOrder().withMaxAttempts(RECOVERY_ATTEMPTS),
                        () -> tradingPlatformGateway.closePosition(position));
                if (result.isFilled()) {
                    recoveryResult.getClosedPairs().add(position.getAssetPair());
                    recoveryResult.setActionsTaken(recoveryResult.getActionsTaken() + 1);
                    log.info("Closed {} (unrealised pnl {})", position.getAssetPair(), position.getUnrealizedPnl());
                } else {
                    recoveryResult.getFailedClosePairs().add(position.getAssetPair());
                    log.error("Close of {} not filled: {}", position.getAssetPair(), result.getMessage());
                }
            } catch (CollaboratorUnavailableException e) {
                recoveryResult.getFailedClosePairs().add(position.getAssetPair());
                log.error("Close of {} failed after retry: {}", position.getAssetPair(), e.getMessage());
            }
        }
        return survivors;
    }

    void associateSurvivors(List<Position> survivors, RecoveryResult recoveryResult) {
        for (Position position : survivors) {
            String decisionId = syntheticDecisionId(position);
            tradeMonitor.associateDecision(decisionId, position.getAssetPair(), List.of(RECOVERED_PROVIDER));
            recoveryResult.getRecoveredDecisionIds().add(decisionId);
        }
    }

    /** {@code RECOVERED_<pair>_<epochSeconds>_<first 8 hex of sha-256(pair|positionId|epochSeconds)>} */
    String syntheticDecisionId(Position position) {
        long epochSeconds = clock.instant().getEpochSecond();
        String seed = position.getAssetPair() + "|" + position.getPositionId() + "|" + epochSeconds;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            String hash = HexFormat.of().formatHex(digest).substring(0, 8);
            return "RECOVERED_" + position.getAssetPair() + "_" + epochSeconds + "_" + hash;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private CallPolicy recoveryPolicy() {
        return callPolicies.getVenueQuery().withMaxAttempts(RECOVERY_ATTEMPTS);
    }
}
