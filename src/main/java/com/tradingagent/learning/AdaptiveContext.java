package com.tradingagent.learning;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Learned state owned by one agent instance: win/loss record and derived weight per
 * decision provider. Threaded through Reasoning and Learning; persisted only between cycles.
 */
@Data
@NoArgsConstructor
public class AdaptiveContext {

    private Map<String, ProviderStats> providerStats = new LinkedHashMap<>();
    private Map<String, Double> providerWeights = new LinkedHashMap<>();
    private long tradesRecorded;
    private Instant updatedAt;

    public void recordTrade(String provider, boolean win) {
        ProviderStats stats = providerStats.computeIfAbsent(provider, name -> new ProviderStats(0, 0));
        if (win) {
            stats.setWins(stats.getWins() + 1);
        } else {
            stats.setLosses(stats.getLosses() + 1);
        }
    }

    /**
     * Laplace-smoothed win rate per provider, normalised so the weights sum to 1.
     * A provider with no history starts at 0.5 before normalisation.
     */
    public void recalculateWeights() {
        Map<String, Double> raw = new LinkedHashMap<>();
        providerStats.forEach((provider, stats) ->
                raw.put(provider, (stats.getWins() + 1.0) / (stats.getWins() + stats.getLosses() + 2.0)));
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> normalised = new LinkedHashMap<>();
        raw.forEach((provider, weight) -> normalised.put(provider, total > 0 ? weight / total : 0.0));
        providerWeights = normalised;
    }

    public AdaptiveContext copy() {
        AdaptiveContext copy = new AdaptiveContext();
        providerStats.forEach((provider, stats) ->
                copy.providerStats.put(provider, new ProviderStats(stats.getWins(), stats.getLosses())));
        copy.providerWeights = new LinkedHashMap<>(providerWeights);
        copy.tradesRecorded = tradesRecorded;
        copy.updatedAt = updatedAt;
        return copy;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderStats {
        private long wins;
        private long losses;
    }
}
