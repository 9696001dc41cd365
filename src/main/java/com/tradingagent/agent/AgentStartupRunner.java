package com.tradingagent.agent;

import com.tradingagent.recovery.RecoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Starts the agent once the application is ready when {@code tradingagent.agent.auto-start}
 * is set. Otherwise the agent waits for {@code POST /api/agent/start}.
 */
@Component
public class AgentStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(AgentStartupRunner.class);

    private final TradingLoopAgent tradingLoopAgent;
    private final AgentSettings agentSettings;

    public AgentStartupRunner(TradingLoopAgent tradingLoopAgent, AgentSettings agentSettings) {
        this.tradingLoopAgent = tradingLoopAgent;
        this.agentSettings = agentSettings;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!agentSettings.isAutoStart()) {
            log.info("Auto-start disabled; agent waiting in {}", tradingLoopAgent.getState());
            return;
        }
        RecoveryResult result = tradingLoopAgent.start();
        if (result != null && !result.isSuccess()) {
            log.error("Auto-start failed, recovery error: {}", result.getError());
        }
    }
}
