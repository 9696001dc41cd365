package com.tradingagent.risk;

import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.PortfolioSnapshot;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.RejectionRecord;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.marketdata.DataFreshnessValidator;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a proposed decision may be executed.
 *
 * <p>Checks run in a fixed order and the first failure short-circuits:
 * <ol>
 *   <li>cooldown: the same (pair, action) was rejected recently</li>
 *   <li>stale data: the decision's snapshot is older than the freshness threshold</li>
 *   <li>correlation: too many open positions already move with the candidate</li>
 *   <li>sizing: no positive quantity can be derived for the candidate</li>
 *   <li>VaR: portfolio VaR including the candidate exceeds its share of equity</li>
 *   <li>margin: required margin does not fit in free margin less reservations and buffer</li>
 *   <li>daily trade limit</li>
 *   <li>minimum confidence</li>
 *   <li>drawdown: open positions have lost more than the allowed share of equity</li>
 *   <li>volatility: a volatile market demands a higher confidence</li>
 * </ol>
 *
 * <p>Every rejection other than an active cooldown writes a cooldown record and publishes
 * risk_rejected with the specific reason. HOLD decisions are never evaluated here.
 */
@Service
public class RiskGatekeeper {

    private static final Logger log = LoggerFactory.getLogger(RiskGatekeeper.class);

    private final RiskLimits riskLimits;
    private final RejectionCache rejectionCache;
    private final DataFreshnessValidator dataFreshnessValidator;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final VarCalculator varCalculator;
    private final PositionSizer positionSizer;
    private final ExposureLedger exposureLedger;
    private final DailyTradeCounter dailyTradeCounter;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskGatekeeper(
            RiskLimits riskLimits,
            RejectionCache rejectionCache,
            DataFreshnessValidator dataFreshnessValidator,
            CorrelationAnalyzer correlationAnalyzer,
            VarCalculator varCalculator,
            PositionSizer positionSizer,
            ExposureLedger exposureLedger,
            DailyTradeCounter dailyTradeCounter,
            EventPublisherHelper eventPublisherHelper) {
        this.riskLimits = riskLimits;
        this.rejectionCache = rejectionCache;
        this.dataFreshnessValidator = dataFreshnessValidator;
        this.correlationAnalyzer = correlationAnalyzer;
        this.varCalculator = varCalculator;
        this.positionSizer = positionSizer;
        this.exposureLedger = exposureLedger;
        this.dailyTradeCounter = dailyTradeCounter;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * @param portfolio must carry a balance; signal-only cycles never reach the gatekeeper
     * @throws IllegalArgumentException for a HOLD decision or a portfolio without balance
     */
    public RiskVerdict evaluate(Decision decision, PortfolioSnapshot portfolio) {
        if (decision.isHold()) {
            throw new IllegalArgumentException("HOLD decisions are not risk-evaluated: " + decision.getId());
        }
        AccountBalance balance = portfolio.getBalance();
        if (balance == null) {
            throw new IllegalArgumentException("Portfolio balance is required for risk evaluation");
        }

        Map<String, Object> telemetry = new LinkedHashMap<>();
        telemetry.put("assetPair", decision.getAssetPair());
        telemetry.put("action", decision.getAction().name());

        // 1. Cooldown
        Optional<RejectionRecord> cooldown = rejectionCache.findActive(decision.getAssetPair(), decision.getAction());
        if (cooldown.isPresent()) {
            telemetry.put("cooldownReason", cooldown.get().getReason());
            telemetry.put("cooldownExpiresAt", cooldown.get().getExpiresAt().toString());
            return reject(
                    decision,
                    RejectionReason.COOLDOWN_ACTIVE,
                    "Recently rejected for " + cooldown.get().getReason() + ", cooling down until "
                            + cooldown.get().getExpiresAt(),
                    telemetry);
        }

        // 2. Data freshness
        Duration age = dataFreshnessValidator.ageOf(decision.getMarketDataCollectedAt());
        telemetry.put("dataAgeSeconds", age.toSeconds());
        if (!dataFreshnessValidator.isFresh(decision.getMarketDataCollectedAt())) {
            String message = dataFreshnessValidator.isAhead(decision.getMarketDataCollectedAt())
                    ? "Market data is stamped " + age.negated().toSeconds() + "s in the future"
                    : "Market data is " + age.toSeconds() + "s old, limit "
                            + dataFreshnessValidator.getThreshold().toSeconds() + "s";
            return reject(decision, RejectionReason.STALE_DATA, message, telemetry);
        }

        // 3. Correlation
        List<String> openPairs = portfolio.getPositions().stream()
                .filter(position -> !position.isFlat())
                .map(Position::getAssetPair)
                .distinct()
                .toList();
        List<String> correlated = correlationAnalyzer.correlatedPairs(
                decision.getAssetPair(), openPairs, portfolio.getPriceHistory(), riskLimits.getCorrelationThreshold());
        telemetry.put("correlatedPairs", correlated);
        if (correlated.size() >= riskLimits.getMaxCorrelatedAssets()) {
            return reject(
                    decision,
                    RejectionReason.CORRELATION_LIMIT,
                    correlated.size() + " open positions correlated above " + riskLimits.getCorrelationThreshold()
                            + " (max " + riskLimits.getMaxCorrelatedAssets() + ")",
                    telemetry);
        }

        // 4. Sizing
        Optional<BigDecimal> sized = positionSizer.size(decision, balance);
        if (sized.isEmpty()) {
            return reject(decision, RejectionReason.SIZING_FAILED, "Position size could not be determined", telemetry);
        }
        BigDecimal quantity = sized.get();
        BigDecimal candidateNotional = quantity.multiply(decision.getEntryPrice());
        telemetry.put("quantity", quantity);

        // 5. Value at Risk
        Map<String, BigDecimal> exposures = signedExposures(portfolio.getPositions());
        exposures.merge(
                decision.getAssetPair(),
                candidateNotional.multiply(BigDecimal.valueOf(decision.getAction().direction())),
                BigDecimal::add);
        VarEstimate var = varCalculator.portfolioVar(exposures, portfolio.getPriceHistory(), riskLimits.getVarConfidence());
        telemetry.put("varObservations", var.observations());
        if (!var.sufficientHistory()) {
            telemetry.put("varNote", "insufficient_history");
        }
        BigDecimal equity = balance.getEquity();
        BigDecimal varPct = equity.signum() > 0
                ? BigDecimal.valueOf(var.varAmount()).divide(equity, MathContext.DECIMAL64)
                : BigDecimal.ONE;
        telemetry.put("varPct", varPct.setScale(6, RoundingMode.HALF_UP));
        if (varPct.compareTo(riskLimits.getMaxVarPct()) > 0) {
            return reject(
                    decision,
                    RejectionReason.VAR_LIMIT,
                    "Portfolio VaR " + varPct.setScale(4, RoundingMode.HALF_UP) + " of equity exceeds "
                            + riskLimits.getMaxVarPct(),
                    telemetry);
        }

        // 6. Margin headroom
        BigDecimal requiredMargin = candidateNotional.divide(riskLimits.getLeverage(), MathContext.DECIMAL64);
        BigDecimal buffer = equity.multiply(riskLimits.getMarginSafetyBufferPct());
        BigDecimal availableMargin =
                balance.getFreeMargin().subtract(exposureLedger.reservedMargin()).subtract(buffer);
        telemetry.put("requiredMargin", requiredMargin);
        telemetry.put("availableMargin", availableMargin);
        if (requiredMargin.compareTo(availableMargin) > 0) {
            return reject(
                    decision,
                    RejectionReason.MARGIN_LIMIT,
                    "Required margin " + requiredMargin + " exceeds available " + availableMargin,
                    telemetry);
        }

        // 7. Daily trade limit
        int tradesToday = dailyTradeCounter.current();
        telemetry.put("tradesToday", tradesToday);
        if (riskLimits.getMaxDailyTrades() > 0 && tradesToday >= riskLimits.getMaxDailyTrades()) {
            return reject(
                    decision,
                    RejectionReason.DAILY_TRADE_LIMIT,
                    "Daily trade limit reached (" + tradesToday + "/" + riskLimits.getMaxDailyTrades() + ")",
                    telemetry);
        }

        // 8. Minimum confidence
        telemetry.put("confidence", decision.getConfidence());
        if (decision.getConfidence() < riskLimits.getMinConfidence()) {
            return reject(
                    decision,
                    RejectionReason.LOW_CONFIDENCE,
                    "Confidence " + decision.getConfidence() + " below " + riskLimits.getMinConfidence(),
                    telemetry);
        }

        // 9. Drawdown
        if (riskLimits.getMaxDrawdownPct() != null && equity.signum() > 0) {
            BigDecimal drawdownPct = portfolio.getTotalUnrealizedPnl().divide(equity, MathContext.DECIMAL64);
            telemetry.put("openPnlPct", drawdownPct.setScale(6, RoundingMode.HALF_UP));
            if (drawdownPct.compareTo(riskLimits.getMaxDrawdownPct().negate()) < 0) {
                return reject(
                        decision,
                        RejectionReason.MAX_DRAWDOWN,
                        "Open positions are down " + drawdownPct.negate().setScale(4, RoundingMode.HALF_UP)
                                + " of equity, limit " + riskLimits.getMaxDrawdownPct(),
                        telemetry);
            }
        }

        // 10. Volatility against confidence
        Double volatility = volatilityFor(decision.getAssetPair(), portfolio.getMarketSnapshot());
        if (volatility != null) {
            telemetry.put("volatility", volatility);
            if (volatility > riskLimits.getVolatilityThreshold()
                    && decision.getConfidence() < riskLimits.getHighVolatilityMinConfidence()) {
                return reject(
                        decision,
                        RejectionReason.VOLATILITY_CONFIDENCE,
                        "Volatility " + volatility + " above " + riskLimits.getVolatilityThreshold()
                                + " needs confidence " + riskLimits.getHighVolatilityMinConfidence()
                                + ", got " + decision.getConfidence(),
                        telemetry);
            }
        }

        log.info(
                "Approved {} {} {} (quantity={}, varPct={}, requiredMargin={})",
                decision.getId(),
                decision.getAction(),
                decision.getAssetPair(),
                quantity,
                telemetry.get("varPct"),
                requiredMargin);
        return RiskVerdict.approved(quantity, telemetry);
    }

    private RiskVerdict reject(
            Decision decision, RejectionReason reason, String message, Map<String, Object> telemetry) {
        RiskVerdict verdict = RiskVerdict.rejected(reason, message, telemetry);
        if (reason != RejectionReason.COOLDOWN_ACTIVE) {
            rejectionCache.recordRejection(decision.getAssetPair(), decision.getAction(), reason);
        }
        log.warn(
                "Rejected {} {} {}: {} ({})",
                decision.getId(),
                decision.getAction(),
                decision.getAssetPair(),
                reason.getCode(),
                message);
        eventPublisherHelper.publishRiskRejected(this, decision, verdict);
        return verdict;
    }

    private static Double volatilityFor(String assetPair, MarketSnapshot snapshot) {
        if (snapshot == null || !assetPair.equals(snapshot.getAssetPair())) {
            return null;
        }
        return snapshot.getVolatility();
    }

    private static Map<String, BigDecimal> signedExposures(List<Position> positions) {
        Map<String, BigDecimal> exposures = new LinkedHashMap<>();
        for (Position position : positions) {
            if (!position.isFlat()) {
                exposures.merge(position.getAssetPair(), position.getSignedNotional(), BigDecimal::add);
            }
        }
        return exposures;
    }
}
