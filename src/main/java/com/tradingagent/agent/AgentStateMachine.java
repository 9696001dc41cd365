package com.tradingagent.agent;

import static com.tradingagent.domain.enums.AgentState.IDLE;
import static com.tradingagent.domain.enums.AgentState.LEARNING;
import static com.tradingagent.domain.enums.AgentState.PERCEPTION;
import static com.tradingagent.domain.enums.AgentState.REASONING;
import static com.tradingagent.domain.enums.AgentState.RISK_CHECK;

import com.tradingagent.domain.enums.AgentState;
import com.tradingagent.domain.enums.AgentTrigger;
import com.tradingagent.exception.IllegalTransitionException;
import java.util.EnumSet;
import java.util.Set;

/**
 * The agent's transition table. {@link #next} is the only way a state changes; any
 * (state, trigger) pair not listed is a programming error and throws.
 *
 * <pre>
 * RECOVERING --RECOVERY_FINISHED--------------------------------------> PERCEPTION
 * IDLE       --CYCLE_REQUESTED----------------------------------------> PERCEPTION
 * PERCEPTION --SNAPSHOT_FRESH-----------------------------------------> REASONING
 * PERCEPTION --SNAPSHOT_STALE | SNAPSHOT_UNAVAILABLE | KILL_SWITCH----> IDLE
 * REASONING  --DECISION_PRODUCED--------------------------------------> RISK_CHECK
 * REASONING  --DECISION_UNAVAILABLE-----------------------------------> IDLE
 * RISK_CHECK --RISK_APPROVED------------------------------------------> EXECUTION
 * RISK_CHECK --RISK_REJECTED | HOLD_DECIDED | SIGNAL_ONLY-------------> LEARNING
 * EXECUTION  --EXECUTION_FINISHED-------------------------------------> LEARNING
 * LEARNING   --LEARNING_FINISHED--------------------------------------> IDLE
 * </pre>
 */
public final class AgentStateMachine {

    private AgentStateMachine() {}

    /**
     * @throws IllegalTransitionException if {@code trigger} is not valid in {@code from}
     */
    public static AgentState next(AgentState from, AgentTrigger trigger) {
        AgentState to = target(from, trigger);
        if (to == null) {
            throw new IllegalTransitionException(from, trigger);
        }
        return to;
    }

    /** States reachable from {@code from} in one transition. */
    public static Set<AgentState> successorsOf(AgentState from) {
        Set<AgentState> successors = EnumSet.noneOf(AgentState.class);
        for (AgentTrigger trigger : AgentTrigger.values()) {
            AgentState to = target(from, trigger);
            if (to != null) {
                successors.add(to);
            }
        }
        return successors;
    }

    public static boolean isValid(AgentState from, AgentTrigger trigger) {
        return target(from, trigger) != null;
    }

    // No default branch: adding an AgentState fails compilation here until it is mapped.
    private static AgentState target(AgentState from, AgentTrigger trigger) {
        return switch (from) {
            case RECOVERING -> trigger == AgentTrigger.RECOVERY_FINISHED ? PERCEPTION : null;
            case IDLE -> trigger == AgentTrigger.CYCLE_REQUESTED ? PERCEPTION : null;
            case PERCEPTION -> switch (trigger) {
                case SNAPSHOT_FRESH -> REASONING;
                case SNAPSHOT_STALE, SNAPSHOT_UNAVAILABLE, KILL_SWITCH_TRIGGERED -> IDLE;
                default -> null;
            };
            case REASONING -> switch (trigger) {
                case DECISION_PRODUCED -> RISK_CHECK;
                case DECISION_UNAVAILABLE -> IDLE;
                default -> null;
            };
            case RISK_CHECK -> switch (trigger) {
                case RISK_APPROVED -> AgentState.EXECUTION;
                case RISK_REJECTED, HOLD_DECIDED, SIGNAL_ONLY -> LEARNING;
                default -> null;
            };
            case EXECUTION -> trigger == AgentTrigger.EXECUTION_FINISHED ? LEARNING : null;
            case LEARNING -> trigger == AgentTrigger.LEARNING_FINISHED ? IDLE : null;
        };
    }
}
