package com.tradingagent.risk;

/**
 * Historical VaR of a portfolio.
 *
 * @param varFraction loss at the confidence level as a fraction of gross exposure
 * @param varAmount   the same loss in account currency
 * @param observations number of common daily returns the estimate used
 * @param sufficientHistory false when fewer than the minimum observations were available
 *     and the estimate was forced to zero
 */
public record VarEstimate(double varFraction, double varAmount, int observations, boolean sufficientHistory) {

    public static VarEstimate insufficient(int observations) {
        return new VarEstimate(0.0, 0.0, observations, false);
    }
}
