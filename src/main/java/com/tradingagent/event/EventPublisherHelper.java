package com.tradingagent.event;

import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.execution.ExecutionResult;
import com.tradingagent.recovery.RecoveryResult;
import com.tradingagent.risk.RiskVerdict;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods for every agent lifecycle event, so call sites read as
 * {@code eventPublisherHelper.publishTradeExecuted(this, decision, result)}.
 *
 * <p>Delivery is synchronous; listeners run on the publishing thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Recovery ----

    public void publishRecoveryComplete(Object source, RecoveryResult result) {
        publish(source, AgentEventType.RECOVERY_COMPLETE, null, null, null, recoveryDetails(result));
    }

    public void publishRecoveryFailed(Object source, RecoveryResult result) {
        publish(source, AgentEventType.RECOVERY_FAILED, null, null, result.getError(), recoveryDetails(result));
    }

    // ---- Perception ----

    public void publishDataFreshnessFailed(Object source, MarketSnapshot snapshot, Duration age, Duration threshold) {
        Map<String, Object> details = new HashMap<>();
        details.put("collectedAt", String.valueOf(snapshot.getCollectedAt()));
        details.put("ageSeconds", age.toSeconds());
        details.put("thresholdSeconds", threshold.toSeconds());
        publish(
                source,
                AgentEventType.DATA_FRESHNESS_FAILED,
                snapshot.getAssetPair(),
                null,
                "snapshot older than " + threshold,
                details);
    }

    public void publishKillSwitchTriggered(Object source, BigDecimal unrealizedPnlPct, BigDecimal threshold) {
        publish(
                source,
                AgentEventType.KILL_SWITCH_TRIGGERED,
                null,
                null,
                "portfolio loss limit breached",
                Map.of("unrealizedPnlPct", unrealizedPnlPct, "threshold", threshold));
    }

    // ---- Risk ----

    public void publishRiskRejected(Object source, Decision decision, RiskVerdict verdict) {
        Map<String, Object> details = new HashMap<>(verdict.getTelemetry());
        details.put("action", decision.getAction().name());
        details.put("message", verdict.getMessage());
        publish(
                source,
                AgentEventType.RISK_REJECTED,
                decision.getAssetPair(),
                decision.getId(),
                verdict.getReasonCode(),
                details);
    }

    // ---- Execution ----

    public void publishTradeExecuted(Object source, Decision decision, ExecutionResult result) {
        Map<String, Object> details = new HashMap<>();
        details.put("action", decision.getAction().name());
        details.put("tradeId", result.getTradeId());
        details.put("reservationId", result.getReservationId());
        details.put("filledQuantity", result.getFilledQuantity());
        details.put("fillPrice", result.getFillPrice());
        publish(source, AgentEventType.TRADE_EXECUTED, decision.getAssetPair(), decision.getId(), null, details);
    }

    public void publishTradeFailed(Object source, Decision decision, ExecutionResult result) {
        Map<String, Object> details = new HashMap<>();
        details.put("action", decision.getAction().name());
        details.put("reservationId", result.getReservationId());
        publish(
                source,
                AgentEventType.TRADE_FAILED,
                decision.getAssetPair(),
                decision.getId(),
                result.getError(),
                details);
    }

    public void publishReservationExpired(Object source, ExposureReservation reservation) {
        Map<String, Object> details = new HashMap<>();
        details.put("reservationId", reservation.getReservationId());
        details.put("createdAt", String.valueOf(reservation.getCreatedAt()));
        details.put("margin", reservation.getMargin());
        publish(
                source,
                AgentEventType.RESERVATION_EXPIRED,
                reservation.getAssetPair(),
                reservation.getDecisionId(),
                reservation.getReleaseReason(),
                details);
    }

    // ---- Cycle ----

    public void publishCycleCompleted(Object source, CycleOutcome outcome) {
        applicationEventPublisher.publishEvent(new CycleCompletedEvent(source, outcome));
    }

    private void publish(
            Object source,
            AgentEventType eventType,
            String assetPair,
            String decisionId,
            String reason,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new AgentEvent(source, eventType, assetPair, decisionId, reason, details));
    }

    private Map<String, Object> recoveryDetails(RecoveryResult result) {
        Map<String, Object> details = new HashMap<>();
        details.put("positionsFound", result.getPositionsFound());
        details.put("actionsTaken", result.getActionsTaken());
        details.put("closedPairs", result.getClosedPairs());
        details.put("failedClosePairs", result.getFailedClosePairs());
        details.put("releasedReservations", result.getReleasedReservations());
        details.put("degraded", result.isDegraded());
        details.put("durationMs", result.getDurationMs());
        return details;
    }
}
