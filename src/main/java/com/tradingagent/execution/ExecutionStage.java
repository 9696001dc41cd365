package com.tradingagent.execution;

import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.monitor.TradeMonitor;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.ExternalCallExecutor;
import com.tradingagent.risk.DailyTradeCounter;
import com.tradingagent.risk.PositionSizer;
import com.tradingagent.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an approved decision into a venue order.
 *
 * <p>Sequence: reserve exposure, submit with the decision id as client order id, then either
 * commit the reservation on a confirmed fill or release it. A reservation never outlives this
 * method in HELD state: every exit path that is not a commit releases it.
 *
 * <p>A submission that times out is not abandoned. The reservation stays HELD while the
 * submission is awaited for the settle window, and a late fill is committed like any other.
 * Only when it is still unresolved is the order cancelled and looked up by client order id;
 * the reservation is released only if the venue has no fill for it.
 */
@Service
public class ExecutionStage {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStage.class);

    private final ExposureLedger exposureLedger;
    private final TradingPlatformGateway tradingPlatformGateway;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final TradeMonitor tradeMonitor;
    private final DailyTradeCounter dailyTradeCounter;
    private final PositionSizer positionSizer;
    private final RiskLimits riskLimits;
    private final EventPublisherHelper eventPublisherHelper;

    public ExecutionStage(
            ExposureLedger exposureLedger,
            TradingPlatformGateway tradingPlatformGateway,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            TradeMonitor tradeMonitor,
            DailyTradeCounter dailyTradeCounter,
            PositionSizer positionSizer,
            RiskLimits riskLimits,
            EventPublisherHelper eventPublisherHelper) {
        this.exposureLedger = exposureLedger;
        this.tradingPlatformGateway = tradingPlatformGateway;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.tradeMonitor = tradeMonitor;
        this.dailyTradeCounter = dailyTradeCounter;
        this.positionSizer = positionSizer;
        this.riskLimits = riskLimits;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * @param quantity the quantity the gatekeeper approved
     * @throws com.tradingagent.exception.DoubleReservationException if the pair already has a
     *     HELD reservation; nothing is submitted in that case
     */
    public ExecutionResult execute(Decision decision, BigDecimal quantity) {
        BigDecimal notional = quantity.multiply(decision.getEntryPrice());
        BigDecimal margin = notional.divide(riskLimits.getLeverage(), MathContext.DECIMAL64);

        ExposureReservation reservation = exposureLedger.reserve(
                decision.getId(), decision.getAssetPair(), decision.getAction(), quantity, notional, margin);

        OrderRequest request = OrderRequest.builder()
                .clientOrderId(decision.getId())
                .assetPair(decision.getAssetPair())
                .action(decision.getAction())
                .quantity(quantity)
                .referencePrice(decision.getEntryPrice())
                .stopLossPrice(stopLossPrice(decision))
                .build();

        boolean resolved = false;
        try {
            CompletableFuture<OrderResult> submission =
                    externalCallExecutor.start(() -> tradingPlatformGateway.submitOrder(request));
            OrderResult orderResult;
            try {
                orderResult = externalCallExecutor.await(callPolicies.getVenueOrder(), submission);
            } catch (CollaboratorUnavailableException e) {
                Optional<OrderResult> settled = e.isTimedOut()
                        ? settle(request.getClientOrderId(), submission)
                        : Optional.empty();
                if (settled.isEmpty()) {
                    ExecutionResult failed = rollback(decision, reservation, "submission failed: " + e.getMessage());
                    resolved = true;
                    return failed;
                }
                orderResult = settled.get();
            }

            if (!orderResult.isFilled()) {
                if (orderResult.getStatus() == OrderStatus.ACCEPTED) {
                    cancel(request.getClientOrderId());
                }
                String reason = "order " + orderResult.getStatus()
                        + (orderResult.getMessage() != null ? ": " + orderResult.getMessage() : "");
                ExecutionResult failed = rollback(decision, reservation, reason);
                resolved = true;
                return failed;
            }

            exposureLedger.commit(reservation.getReservationId());
            resolved = true;
            dailyTradeCounter.increment();
            tradeMonitor.associateDecision(decision.getId(), decision.getAssetPair(), decision.getProviders());

            ExecutionResult filled = ExecutionResult.filled(
                    reservation.getReservationId(),
                    orderResult.getVenueOrderId(),
                    orderResult.getFilledQuantity() != null ? orderResult.getFilledQuantity() : quantity,
                    orderResult.getFillPrice());
            log.info(
                    "Executed {} {} {} @ {} (trade {})",
                    decision.getAction(),
                    filled.getFilledQuantity(),
                    decision.getAssetPair(),
                    filled.getFillPrice(),
                    filled.getTradeId());
            eventPublisherHelper.publishTradeExecuted(this, decision, filled);
            return filled;
        } finally {
            if (!resolved) {
                exposureLedger.release(reservation.getReservationId(), "execution aborted");
            }
        }
    }

    private ExecutionResult rollback(Decision decision, ExposureReservation reservation, String reason) {
        exposureLedger.release(reservation.getReservationId(), reason);
        ExecutionResult failed = ExecutionResult.failed(reservation.getReservationId(), reason);
        log.warn("Execution of {} on {} failed: {}", decision.getId(), decision.getAssetPair(), reason);
        eventPublisherHelper.publishTradeFailed(this, decision, failed);
        return failed;
    }

    /**
     * Follows a submission that outlived the venue-order timeout while its reservation stays
     * HELD. The submission is awaited under the settle policy first; if it still has not
     * finished, the order is cancelled and then looked up by client order id.
     *
     * @return the order as the venue knows it, or empty if the venue never received it
     */
    private Optional<OrderResult> settle(String clientOrderId, CompletableFuture<OrderResult> submission) {
        try {
            OrderResult late = externalCallExecutor.await(callPolicies.getVenueOrderSettle(), submission);
            log.info("Submission {} settled late as {}", clientOrderId, late.getStatus());
            return Optional.of(late);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Submission {} still unresolved, cancelling: {}", clientOrderId, e.getMessage());
        }

        cancel(clientOrderId);
        Optional<OrderResult> found;
        try {
            found = externalCallExecutor.call(
                    callPolicies.getVenueQuery(), () -> tradingPlatformGateway.findOrder(clientOrderId));
        } catch (CollaboratorUnavailableException e) {
            log.error("Lookup of order {} failed, state unknown until the next position read: {}", clientOrderId, e.getMessage());
            return Optional.empty();
        }
        if (found.isEmpty()) {
            submission.thenAccept(result -> {
                if (result.isFilled()) {
                    log.error("Order {} filled after it was cancelled and released", clientOrderId);
                }
            });
        }
        return found;
    }

    private void cancel(String clientOrderId) {
        try {
            boolean cancelled = externalCallExecutor.call(
                    callPolicies.getVenueOrder(), () -> tradingPlatformGateway.cancelOrder(clientOrderId));
            log.info("Cancel request for {} {}", clientOrderId, cancelled ? "cancelled an open order" : "found nothing open");
        } catch (CollaboratorUnavailableException e) {
            log.error("Cancel request for {} failed, order state unknown: {}", clientOrderId, e.getMessage());
        }
    }

    private BigDecimal stopLossPrice(Decision decision) {
        BigDecimal distance = decision.getEntryPrice().multiply(positionSizer.stopLossPct(decision));
        BigDecimal stop = decision.getAction().direction() > 0
                ? decision.getEntryPrice().subtract(distance)
                : decision.getEntryPrice().add(distance);
        return stop.setScale(8, RoundingMode.HALF_UP);
    }
}
