package com.tradingagent.exception;

import com.tradingagent.domain.enums.AgentState;
import com.tradingagent.domain.enums.AgentTrigger;
import java.util.Map;
import lombok.Getter;

@Getter
public class IllegalTransitionException extends InvariantViolationException {

    private final AgentState from;
    private final AgentTrigger trigger;

    public IllegalTransitionException(AgentState from, AgentTrigger trigger) {
        super(
                "Illegal transition from " + from + " on " + trigger,
                Map.of("from", String.valueOf(from), "trigger", String.valueOf(trigger)));
        this.from = from;
        this.trigger = trigger;
    }
}
