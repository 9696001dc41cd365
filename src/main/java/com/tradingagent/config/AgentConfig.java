package com.tradingagent.config;

import com.tradingagent.agent.AgentSettings;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides {@link AgentSettings} and the agent {@link Clock}.
 *
 * <p>Properties prefix: {@code tradingagent.agent.*}
 */
@Configuration
public class AgentConfig {

    @Bean
    public AgentSettings agentSettings(
            @Value("${tradingagent.agent.asset-pairs:BTC-USD}") String assetPairs,
            @Value("${tradingagent.agent.max-concurrent-trades:2}") int maxConcurrentTrades,
            @Value("${tradingagent.agent.kill-switch-loss-pct:#{null}}") BigDecimal killSwitchLossPct,
            @Value("${tradingagent.agent.max-reasoning-failures:3}") int maxReasoningFailures,
            @Value("${tradingagent.agent.reasoning-failure-decay-minutes:60}") long reasoningFailureDecayMinutes,
            @Value("${tradingagent.agent.reservation-max-age-seconds:300}") long reservationMaxAgeSeconds,
            @Value("${tradingagent.agent.autonomous-execution:true}") boolean autonomousExecution,
            @Value("${tradingagent.agent.auto-start:false}") boolean autoStart) {
        return AgentSettings.builder()
                .assetPairs(parsePairs(assetPairs))
                .maxConcurrentTrades(maxConcurrentTrades)
                .killSwitchLossPct(PercentNormalizer.toFraction(killSwitchLossPct))
                .maxReasoningFailures(maxReasoningFailures)
                .reasoningFailureDecay(Duration.ofMinutes(reasoningFailureDecayMinutes))
                .reservationMaxAge(Duration.ofSeconds(reservationMaxAgeSeconds))
                .autonomousExecution(autonomousExecution)
                .autoStart(autoStart)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static List<String> parsePairs(String assetPairs) {
        List<String> pairs = Arrays.stream(assetPairs.split(","))
                .map(String::trim)
                .filter(pair -> !pair.isEmpty())
                .map(String::toUpperCase)
                .distinct()
                .toList();
        if (pairs.isEmpty()) {
            throw new IllegalStateException("tradingagent.agent.asset-pairs must name at least one asset pair");
        }
        return pairs;
    }
}
