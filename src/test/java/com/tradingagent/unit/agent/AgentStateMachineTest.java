package com.tradingagent.unit.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.tradingagent.agent.AgentStateMachine;
import com.tradingagent.domain.enums.AgentState;
import com.tradingagent.domain.enums.AgentTrigger;
import com.tradingagent.exception.IllegalTransitionException;
import com.tradingagent.exception.InvariantViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class AgentStateMachineTest {

    @Nested
    @DisplayName("Valid transitions")
    class ValidTransitions {

        @ParameterizedTest(name = "{0} --{1}--> {2}")
        @CsvSource({
            "RECOVERING, RECOVERY_FINISHED, PERCEPTION",
            "IDLE, CYCLE_REQUESTED, PERCEPTION",
            "PERCEPTION, SNAPSHOT_FRESH, REASONING",
            "PERCEPTION, SNAPSHOT_STALE, IDLE",
            "PERCEPTION, SNAPSHOT_UNAVAILABLE, IDLE",
            "PERCEPTION, KILL_SWITCH_TRIGGERED, IDLE",
            "REASONING, DECISION_PRODUCED, RISK_CHECK",
            "REASONING, DECISION_UNAVAILABLE, IDLE",
            "RISK_CHECK, RISK_APPROVED, EXECUTION",
            "RISK_CHECK, RISK_REJECTED, LEARNING",
            "RISK_CHECK, HOLD_DECIDED, LEARNING",
            "RISK_CHECK, SIGNAL_ONLY, LEARNING",
            "EXECUTION, EXECUTION_FINISHED, LEARNING",
            "LEARNING, LEARNING_FINISHED, IDLE"
        })
        void transitionsFollowTable(AgentState from, AgentTrigger trigger, AgentState expected) {
            assertThat(AgentStateMachine.next(from, trigger)).isEqualTo(expected);
            assertThat(AgentStateMachine.isValid(from, trigger)).isTrue();
        }
    }

    @Nested
    @DisplayName("Illegal transitions")
    class IllegalTransitions {

        @Test
        @DisplayName("Approval cannot skip from REASONING to EXECUTION")
        void reasoningCannotApprove() {
            assertThatThrownBy(() -> AgentStateMachine.next(AgentState.REASONING, AgentTrigger.RISK_APPROVED))
                    .isInstanceOf(IllegalTransitionException.class)
                    .isInstanceOf(InvariantViolationException.class)
                    .hasMessageContaining("REASONING")
                    .hasMessageContaining("RISK_APPROVED");
        }

        @Test
        @DisplayName("Exception carries the offending state and trigger")
        void exceptionCarriesContext() {
            IllegalTransitionException ex = assertThrows(
                    IllegalTransitionException.class,
                    () -> AgentStateMachine.next(AgentState.IDLE, AgentTrigger.EXECUTION_FINISHED));

            assertThat(ex.getFrom()).isEqualTo(AgentState.IDLE);
            assertThat(ex.getTrigger()).isEqualTo(AgentTrigger.EXECUTION_FINISHED);
        }

        @ParameterizedTest
        @EnumSource(
                value = AgentTrigger.class,
                names = {"RECOVERY_FINISHED"},
                mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("RECOVERING only leaves on RECOVERY_FINISHED")
        void recoveringIsGated(AgentTrigger trigger) {
            assertThat(AgentStateMachine.isValid(AgentState.RECOVERING, trigger)).isFalse();
        }
    }

    @Nested
    @DisplayName("Reachability")
    class Reachability {

        @Test
        @DisplayName("EXECUTION is only reachable from RISK_CHECK")
        void executionOnlyAfterRiskCheck() {
            for (AgentState state : AgentState.values()) {
                boolean reachesExecution = AgentStateMachine.successorsOf(state).contains(AgentState.EXECUTION);
                assertThat(reachesExecution).as("from %s", state).isEqualTo(state == AgentState.RISK_CHECK);
            }
        }

        @Test
        @DisplayName("Nothing leads back into RECOVERING")
        void recoveringIsEntryOnly() {
            for (AgentState state : AgentState.values()) {
                assertThat(AgentStateMachine.successorsOf(state)).doesNotContain(AgentState.RECOVERING);
            }
        }

        @Test
        @DisplayName("Every state has at least one successor")
        void noDeadEnds() {
            for (AgentState state : AgentState.values()) {
                assertThat(AgentStateMachine.successorsOf(state)).as("from %s", state).isNotEmpty();
            }
        }
    }
}
