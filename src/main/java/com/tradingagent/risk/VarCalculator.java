package com.tradingagent.risk;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Historical-simulation Value-at-Risk.
 *
 * <p>Portfolio daily returns are the exposure-weighted sum of each pair's returns over the
 * common tail of their histories. VaR is the loss at the {@code (1 - confidence)} percentile,
 * index {@code round(n * (1 - confidence))} clamped to the sample.
 */
@Component
public class VarCalculator {

    public static final int MIN_OBSERVATIONS = 30;

    /** Simple daily returns of a close series, oldest first. */
    public static List<Double> toReturns(List<Double> closes) {
        List<Double> returns = new ArrayList<>();
        if (closes == null) {
            return returns;
        }
        for (int i = 1; i < closes.size(); i++) {
            double previous = closes.get(i - 1);
            if (previous != 0.0) {
                returns.add((closes.get(i) - previous) / previous);
            }
        }
        return returns;
    }

    /**
     * @return loss as a positive fraction, 0 when the percentile return is a gain or there are
     *     fewer than {@link #MIN_OBSERVATIONS} returns
     */
    public double historicalVar(List<Double> returns, double confidence) {
        if (returns == null || returns.size() < MIN_OBSERVATIONS) {
            return 0.0;
        }
        double[] sorted = returns.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int index = (int) Math.round(sorted.length * (1.0 - confidence));
        index = Math.max(0, Math.min(sorted.length - 1, index));
        return Math.max(0.0, -sorted[index]);
    }

    /**
     * VaR of a set of signed exposures (positive long, negative short) per asset pair.
     * Pairs without price history are left out of the return series but still count toward
     * gross exposure.
     */
    public VarEstimate portfolioVar(
            Map<String, BigDecimal> signedExposureByPair, Map<String, List<Double>> priceHistory, double confidence) {
        double grossExposure = signedExposureByPair.values().stream()
                .mapToDouble(exposure -> Math.abs(exposure.doubleValue()))
                .sum();
        if (grossExposure == 0.0) {
            return new VarEstimate(0.0, 0.0, 0, true);
        }

        Map<String, List<Double>> returnsByPair = new LinkedHashMap<>();
        for (String pair : signedExposureByPair.keySet()) {
            List<Double> returns = toReturns(priceHistory.get(pair));
            if (!returns.isEmpty()) {
                returnsByPair.put(pair, returns);
            }
        }
        int common = returnsByPair.values().stream().mapToInt(List::size).min().orElse(0);
        if (common < MIN_OBSERVATIONS) {
            return VarEstimate.insufficient(common);
        }

        List<Double> portfolioReturns = new ArrayList<>(common);
        for (int t = 0; t < common; t++) {
            double weighted = 0.0;
            for (Map.Entry<String, List<Double>> entry : returnsByPair.entrySet()) {
                List<Double> returns = entry.getValue();
                double weight = signedExposureByPair.get(entry.getKey()).doubleValue() / grossExposure;
                weighted += weight * returns.get(returns.size() - common + t);
            }
            portfolioReturns.add(weighted);
        }

        double varFraction = historicalVar(portfolioReturns, confidence);
        return new VarEstimate(varFraction, varFraction * grossExposure, common, true);
    }
}
