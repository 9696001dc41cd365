package com.tradingagent.event;

import com.tradingagent.domain.model.CycleOutcome;
import org.springframework.context.ApplicationEvent;

/** Published each time the agent returns to IDLE. */
public class CycleCompletedEvent extends ApplicationEvent {

    private final CycleOutcome outcome;

    public CycleCompletedEvent(Object source, CycleOutcome outcome) {
        super(source);
        this.outcome = outcome;
    }

    public CycleOutcome getOutcome() {
        return outcome;
    }
}
