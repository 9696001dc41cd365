package com.tradingagent.config;

import com.tradingagent.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.properties.
 *
 * <p>Properties prefix: {@code tradingagent.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradingagent.risk.rejection-cooldown-seconds:300}") long rejectionCooldownSeconds,
            @Value("${tradingagent.risk.stale-data-threshold-seconds:900}") long staleDataThresholdSeconds,
            @Value("${tradingagent.risk.correlation-threshold:0.7}") double correlationThreshold,
            @Value("${tradingagent.risk.max-correlated-assets:2}") int maxCorrelatedAssets,
            @Value("${tradingagent.risk.var-confidence:0.95}") double varConfidence,
            @Value("${tradingagent.risk.max-var-pct:0.05}") BigDecimal maxVarPct,
            @Value("${tradingagent.risk.margin-safety-buffer-pct:0.10}") BigDecimal marginSafetyBufferPct,
            @Value("${tradingagent.risk.max-daily-trades:5}") int maxDailyTrades,
            @Value("${tradingagent.risk.min-confidence:0.7}") double minConfidence,
            @Value("${tradingagent.risk.max-drawdown-pct:0.05}") BigDecimal maxDrawdownPct,
            @Value("${tradingagent.risk.volatility-threshold:0.05}") double volatilityThreshold,
            @Value("${tradingagent.risk.high-volatility-min-confidence:0.8}") double highVolatilityMinConfidence,
            @Value("${tradingagent.risk.risk-per-trade:0.01}") BigDecimal riskPerTrade,
            @Value("${tradingagent.risk.default-stop-loss-pct:0.02}") BigDecimal defaultStopLossPct,
            @Value("${tradingagent.risk.leverage:1}") BigDecimal leverage,
            @Value("${tradingagent.risk.price-history-days:60}") int priceHistoryDays) {
        return RiskLimits.builder()
                .rejectionCooldown(Duration.ofSeconds(rejectionCooldownSeconds))
                .staleDataThreshold(Duration.ofSeconds(staleDataThresholdSeconds))
                .correlationThreshold(correlationThreshold)
                .maxCorrelatedAssets(maxCorrelatedAssets)
                .varConfidence(PercentNormalizer.toFraction(varConfidence))
                .maxVarPct(PercentNormalizer.toFraction(maxVarPct))
                .marginSafetyBufferPct(PercentNormalizer.toFraction(marginSafetyBufferPct))
                .maxDailyTrades(maxDailyTrades)
                .minConfidence(PercentNormalizer.toFraction(minConfidence))
                .maxDrawdownPct(PercentNormalizer.toFraction(maxDrawdownPct))
                .volatilityThreshold(volatilityThreshold)
                .highVolatilityMinConfidence(PercentNormalizer.toFraction(highVolatilityMinConfidence))
                .riskPerTrade(PercentNormalizer.toFraction(riskPerTrade))
                .defaultStopLossPct(PercentNormalizer.toFraction(defaultStopLossPct))
                .leverage(leverage)
                .priceHistoryDays(priceHistoryDays)
                .build();
    }
}
