package com.tradingagent.observability;

import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.event.AgentEvent;
import com.tradingagent.event.CycleCompletedEvent;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.risk.DailyTradeCounter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the agent loop.
 * <ul>
 *   <li><b>agent.events</b> (counter, tag {@code type}): one per lifecycle event</li>
 *   <li><b>agent.cycles</b> (counter, tag {@code outcome}): one per completed cycle</li>
 *   <li><b>agent.cycle.duration</b> (timer): IDLE to IDLE</li>
 *   <li><b>agent.reservations.held</b> (gauge)</li>
 *   <li><b>agent.trades.today</b> (gauge)</li>
 * </ul>
 */
@Service
public class AgentMetricsService {

    private final MeterRegistry meterRegistry;
    private final Timer cycleDurationTimer;

    public AgentMetricsService(
            MeterRegistry meterRegistry, ExposureLedger exposureLedger, DailyTradeCounter dailyTradeCounter) {
        this.meterRegistry = meterRegistry;

        this.cycleDurationTimer = Timer.builder("agent.cycle.duration")
                .description("Wall time of one agent cycle")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        meterRegistry.gauge("agent.reservations.held", exposureLedger, ExposureLedger::heldCount);
        meterRegistry.gauge("agent.trades.today", dailyTradeCounter, DailyTradeCounter::current);
    }

    @EventListener
    @Order(20)
    public void onAgentEvent(AgentEvent event) {
        Counter.builder("agent.events")
                .description("Agent lifecycle events by type")
                .tag("type", event.getEventType().getCode())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onCycleCompleted(CycleCompletedEvent event) {
        CycleOutcome outcome = event.getOutcome();
        Counter.builder("agent.cycles")
                .description("Completed agent cycles by outcome")
                .tag("outcome", outcome.getOutcome().name())
                .register(meterRegistry)
                .increment();
        Duration duration = outcome.getDuration();
        if (duration != null && !duration.isNegative()) {
            cycleDurationTimer.record(duration);
        }
    }
}
