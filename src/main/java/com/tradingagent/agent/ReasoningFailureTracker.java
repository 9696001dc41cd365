package com.tradingagent.agent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Consecutive decision-provider failures per asset pair. After {@code maxReasoningFailures}
 * the pair is skipped until {@code reasoningFailureDecay} has passed since the last failure,
 * or until {@link #resetAll()} at the start of a new day.
 */
@Component
public class ReasoningFailureTracker {

    private static final Logger log = LoggerFactory.getLogger(ReasoningFailureTracker.class);

    private final AgentSettings agentSettings;
    private final Clock clock;
    private final Map<String, FailureRecord> failures = new ConcurrentHashMap<>();

    public ReasoningFailureTracker(AgentSettings agentSettings, Clock clock) {
        this.agentSettings = agentSettings;
        this.clock = clock;
    }

    public boolean isSuspended(String assetPair) {
        FailureRecord record = failures.get(assetPair);
        if (record == null) {
            return false;
        }
        Duration sinceLast = Duration.between(record.lastFailureAt(), clock.instant());
        if (sinceLast.compareTo(agentSettings.getReasoningFailureDecay()) >= 0) {
            failures.remove(assetPair, record);
            log.info("Reasoning failures for {} decayed after {}", assetPair, sinceLast);
            return false;
        }
        return record.count() >= agentSettings.getMaxReasoningFailures();
    }

    public int recordFailure(String assetPair) {
        FailureRecord updated = failures.merge(
                assetPair,
                new FailureRecord(1, clock.instant()),
                (previous, ignored) -> new FailureRecord(previous.count() + 1, clock.instant()));
        if (updated.count() == agentSettings.getMaxReasoningFailures()) {
            log.warn(
                    "{} consecutive reasoning failures for {}, skipping it for {}",
                    updated.count(),
                    assetPair,
                    agentSettings.getReasoningFailureDecay());
        }
        return updated.count();
    }

    public void recordSuccess(String assetPair) {
        failures.remove(assetPair);
    }

    public int failureCount(String assetPair) {
        FailureRecord record = failures.get(assetPair);
        return record != null ? record.count() : 0;
    }

    public void resetAll() {
        failures.clear();
    }

    private record FailureRecord(int count, Instant lastFailureAt) {}
}
