package com.tradingagent.config;

import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.CallPolicy;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Call policies for external collaborators and the executor their calls run on.
 *
 * <p>Properties prefix: {@code tradingagent.calls.*}. Attempts default to 1; only recovery
 * widens a policy to one retry.
 */
@Configuration
public class ResilienceConfig {

    @Value("${tradingagent.calls.pool-size:8}")
    private int poolSize;

    @Value("${tradingagent.calls.queue-capacity:100}")
    private int queueCapacity;

    @Bean("collaboratorExecutor")
    public ThreadPoolTaskExecutor collaboratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("collab-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public CallPolicies callPolicies(
            @Value("${tradingagent.calls.market-data.timeout-ms:5000}") long marketDataTimeoutMs,
            @Value("${tradingagent.calls.market-data.max-attempts:1}") int marketDataAttempts,
            @Value("${tradingagent.calls.decision.timeout-ms:30000}") long decisionTimeoutMs,
            @Value("${tradingagent.calls.decision.max-attempts:1}") int decisionAttempts,
            @Value("${tradingagent.calls.venue-query.timeout-ms:5000}") long venueQueryTimeoutMs,
            @Value("${tradingagent.calls.venue-query.max-attempts:1}") int venueQueryAttempts,
            @Value("${tradingagent.calls.venue-order.timeout-ms:10000}") long venueOrderTimeoutMs,
            @Value("${tradingagent.calls.venue-order.settle-ms:30000}") long venueOrderSettleMs,
            @Value("${tradingagent.calls.retry-wait-ms:500}") long retryWaitMs) {
        Duration wait = Duration.ofMillis(retryWaitMs);
        return CallPolicies.builder()
                .marketData(policy("market-data", marketDataTimeoutMs, marketDataAttempts, wait))
                .decisionProvider(policy("decision-provider", decisionTimeoutMs, decisionAttempts, wait))
                .venueQuery(policy("venue-query", venueQueryTimeoutMs, venueQueryAttempts, wait))
                .venueOrder(policy("venue-order", venueOrderTimeoutMs, 1, wait))
                .venueOrderSettle(policy("venue-order-settle", venueOrderSettleMs, 1, wait))
                .build();
    }

    private static CallPolicy policy(String name, long timeoutMs, int maxAttempts, Duration wait) {
        return CallPolicy.builder()
                .name(name)
                .timeout(Duration.ofMillis(timeoutMs))
                .maxAttempts(maxAttempts)
                .waitDuration(wait)
                .build();
    }
}
