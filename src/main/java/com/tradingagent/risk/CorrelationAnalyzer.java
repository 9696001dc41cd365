package com.tradingagent.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

/** Pearson correlation of daily returns between asset pairs, over their common history. */
@Component
public class CorrelationAnalyzer {

    static final int MIN_OBSERVATIONS = 10;

    /**
     * @return empty when either series is too short or has zero variance
     */
    public OptionalDouble correlation(List<Double> closesA, List<Double> closesB) {
        List<Double> returnsA = VarCalculator.toReturns(closesA);
        List<Double> returnsB = VarCalculator.toReturns(closesB);
        int common = Math.min(returnsA.size(), returnsB.size());
        if (common < MIN_OBSERVATIONS) {
            return OptionalDouble.empty();
        }
        double[] a = tail(returnsA, common);
        double[] b = tail(returnsB, common);
        double value = new PearsonsCorrelation().correlation(a, b);
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Open pairs whose |correlation| with the candidate exceeds {@code threshold}. The
     * candidate itself is never counted, nor are pairs without usable history.
     */
    public List<String> correlatedPairs(
            String candidatePair, List<String> openPairs, Map<String, List<Double>> priceHistory, double threshold) {
        List<Double> candidateHistory = priceHistory.get(candidatePair);
        List<String> correlated = new ArrayList<>();
        if (candidateHistory == null) {
            return correlated;
        }
        for (String pair : openPairs) {
            if (pair.equals(candidatePair) || correlated.contains(pair)) {
                continue;
            }
            OptionalDouble value = correlation(candidateHistory, priceHistory.get(pair));
            if (value.isPresent() && Math.abs(value.getAsDouble()) > threshold) {
                correlated.add(pair);
            }
        }
        return correlated;
    }

    private static double[] tail(List<Double> values, int count) {
        return values.subList(values.size() - count, values.size()).stream()
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
