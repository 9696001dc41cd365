package com.tradingagent.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers a cycle every analysis interval while the agent is running.
 *
 * <p>Uses a fixed delay so the next cycle is measured from the end of the previous one. A
 * cycle that aborts leaves the agent faulted; later triggers are skipped by the agent until
 * the fault is cleared.
 */
@Component
public class AgentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AgentScheduler.class);

    private final TradingLoopAgent tradingLoopAgent;

    public AgentScheduler(TradingLoopAgent tradingLoopAgent) {
        this.tradingLoopAgent = tradingLoopAgent;
    }

    @Scheduled(
            fixedDelayString = "${tradingagent.agent.analysis-interval-ms:300000}",
            initialDelayString = "${tradingagent.agent.initial-delay-ms:10000}")
    public void trigger() {
        if (!tradingLoopAgent.isRunning() || tradingLoopAgent.isFaulted()) {
            return;
        }
        try {
            tradingLoopAgent
                    .runCycle()
                    .ifPresent(outcome -> log.info(
                            "Cycle #{} {} finished: {}",
                            outcome.getCycleNumber(),
                            outcome.getAssetPair(),
                            outcome.getOutcome()));
        } catch (RuntimeException e) {
            log.error("Scheduled cycle aborted in state {}: {}", tradingLoopAgent.getState(), e.getMessage());
        }
    }
}
