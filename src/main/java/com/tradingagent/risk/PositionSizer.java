package com.tradingagent.risk;

import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.Decision;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Order quantity for a decision. A provider-recommended size wins; otherwise the quantity
 * risks {@code riskPerTrade} of equity if the stop-loss is hit:
 * {@code equity * riskPerTrade / (price * stopLossPct)}.
 */
@Component
public class PositionSizer {

    static final int QUANTITY_SCALE = 8;

    private final RiskLimits riskLimits;

    public PositionSizer(RiskLimits riskLimits) {
        this.riskLimits = riskLimits;
    }

    /** Empty when no positive quantity can be derived (no balance, no price). */
    public Optional<BigDecimal> size(Decision decision, AccountBalance balance) {
        if (decision.getRecommendedSize() != null && decision.getRecommendedSize().signum() > 0) {
            return Optional.of(decision.getRecommendedSize());
        }
        if (balance == null || balance.getEquity() == null || balance.getEquity().signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal price = decision.getEntryPrice();
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal stopLoss = stopLossPct(decision);
        BigDecimal riskAmount = balance.getEquity().multiply(riskLimits.getRiskPerTrade());
        BigDecimal quantity = riskAmount.divide(price.multiply(stopLoss), QUANTITY_SCALE, RoundingMode.DOWN);
        return quantity.signum() > 0 ? Optional.of(quantity) : Optional.empty();
    }

    public BigDecimal stopLossPct(Decision decision) {
        BigDecimal stopLoss = decision.getStopLossPct();
        if (stopLoss == null || stopLoss.signum() <= 0 || stopLoss.compareTo(BigDecimal.ONE) >= 0) {
            return riskLimits.getDefaultStopLossPct();
        }
        return stopLoss;
    }
}
