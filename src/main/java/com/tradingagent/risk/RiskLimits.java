package com.tradingagent.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Limits applied by the {@link RiskGatekeeper}. All fractions are of account equity
 * unless stated otherwise (0.05 = 5%).
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Gate ====================

    /** How long a rejected (asset pair, action) stays blocked. */
    private Duration rejectionCooldown;

    /** Maximum age of the snapshot a decision was derived from. */
    private Duration staleDataThreshold;

    /** |Pearson correlation| of daily returns above which two pairs count as correlated. */
    private double correlationThreshold;

    /** Rejected once this many open positions on other pairs are already correlated. */
    private int maxCorrelatedAssets;

    /** Historical VaR confidence level, e.g. 0.95. */
    private double varConfidence;

    private BigDecimal maxVarPct;

    /** Share of equity kept free on top of the required margin. */
    private BigDecimal marginSafetyBufferPct;

    /** 0 disables the limit. */
    private int maxDailyTrades;

    private double minConfidence;

    /** Open-position loss, as a share of equity, beyond which new trades are refused. */
    private BigDecimal maxDrawdownPct;

    /** Snapshot volatility above which {@link #highVolatilityMinConfidence} applies. */
    private double volatilityThreshold;

    private double highVolatilityMinConfidence;

    // ==================== Sizing ====================

    private BigDecimal riskPerTrade;

    /** Used when the decision carries no stop-loss of its own. */
    private BigDecimal defaultStopLossPct;

    /** Notional / leverage = required margin. */
    private BigDecimal leverage;

    /** Days of closes fetched per pair for VaR and correlation. */
    private int priceHistoryDays;
}
