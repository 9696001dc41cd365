package com.tradingagent.simulator;

import com.tradingagent.decision.DecisionContext;
import com.tradingagent.decision.DecisionProvider;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.MarketSnapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-mode decision provider. Buys when price is above its moving average by more than the
 * band and RSI is not overbought; sells on the mirror condition; holds otherwise.
 *
 * <p>Confidence grows with the distance from the average and is scaled by the provider's
 * learned weight once one exists.
 */
@Component
@ConditionalOnProperty(name = "tradingagent.mode", havingValue = "PAPER", matchIfMissing = true)
public class TrendFollowingDecisionProvider implements DecisionProvider {

    public static final String PROVIDER_NAME = "trend_following";

    static final double RSI_OVERBOUGHT = 70.0;
    static final double RSI_OVERSOLD = 30.0;
    static final double MAX_CONFIDENCE = 0.95;
    static final BigDecimal MIN_STOP_LOSS = new BigDecimal("0.01");

    private final double bandPct;

    public TrendFollowingDecisionProvider(@Value("${tradingagent.simulator.trend-band-pct:0.01}") double bandPct) {
        this.bandPct = bandPct;
    }

    @Override
    public Optional<Decision> proposeDecision(MarketSnapshot snapshot, DecisionContext context) {
        if (snapshot.getSma() == null || snapshot.getRsi() == null || snapshot.getSma().signum() <= 0) {
            return Optional.empty();
        }

        double deviation = snapshot.getPrice()
                .subtract(snapshot.getSma())
                .divide(snapshot.getSma(), MathContext.DECIMAL64)
                .doubleValue();
        double rsi = snapshot.getRsi();

        TradeAction action = TradeAction.HOLD;
        if (deviation > bandPct && rsi < RSI_OVERBOUGHT) {
            action = TradeAction.BUY;
        } else if (deviation < -bandPct && rsi > RSI_OVERSOLD) {
            action = TradeAction.SELL;
        }

        double confidence = action == TradeAction.HOLD ? 0.5 : Math.min(MAX_CONFIDENCE, 0.5 + Math.abs(deviation) * 10);
        Double weight = context.getProviderWeights() != null ? context.getProviderWeights().get(PROVIDER_NAME) : null;
        if (weight != null) {
            confidence = Math.min(MAX_CONFIDENCE, confidence * (0.5 + 0.5 * weight));
        }

        return Optional.of(Decision.builder()
                .assetPair(snapshot.getAssetPair())
                .action(action)
                .confidence(confidence)
                .stopLossPct(stopLossFor(snapshot))
                .entryPrice(snapshot.getPrice())
                .providers(List.of(PROVIDER_NAME))
                .reasoning(String.format(
                        "price %s vs sma %s (%.2f%%), rsi %.1f",
                        snapshot.getPrice(), snapshot.getSma(), deviation * 100, rsi))
                .build());
    }

    /** Twice the recent volatility, at least 1%. Null leaves the default stop to the sizer. */
    private static BigDecimal stopLossFor(MarketSnapshot snapshot) {
        if (snapshot.getVolatility() == null) {
            return null;
        }
        BigDecimal stop = BigDecimal.valueOf(snapshot.getVolatility() * 2).setScale(4, RoundingMode.HALF_UP);
        return stop.max(MIN_STOP_LOSS);
    }
}
