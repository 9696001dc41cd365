package com.tradingagent.agent;

import com.tradingagent.domain.enums.AgentState;
import com.tradingagent.domain.enums.AgentTrigger;
import com.tradingagent.domain.enums.CycleOutcomeType;
import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.domain.model.Decision;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.domain.model.PortfolioSnapshot;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.exception.AgentStateConflictException;
import com.tradingagent.exception.InvariantViolationException;
import com.tradingagent.exception.PersistenceException;
import com.tradingagent.execution.ExecutionResult;
import com.tradingagent.execution.ExecutionStage;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.execution.ReservationSweeper;
import com.tradingagent.learning.AdaptiveContext;
import com.tradingagent.learning.AdaptiveContextStore;
import com.tradingagent.learning.LearningStage;
import com.tradingagent.learning.OutcomeRecorder;
import com.tradingagent.recovery.RecoveryManager;
import com.tradingagent.recovery.RecoveryResult;
import com.tradingagent.risk.DailyTradeCounter;
import com.tradingagent.risk.RiskGatekeeper;
import com.tradingagent.risk.RiskVerdict;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The autonomous observe, decide, act, learn loop.
 *
 * <p>The agent starts in RECOVERING. {@link #tick()} runs the handler for the current state
 * and applies the trigger it returns through {@link AgentStateMachine#next}; nothing else
 * changes the state. {@link #runCycle()} ticks until the agent is back in IDLE and is what
 * the scheduler calls.
 *
 * <p>Only one cycle runs at a time: {@code runCycle()} takes the cycle lock with
 * {@code tryLock}, so a second trigger arriving mid-cycle is skipped rather than queued.
 *
 * <p>A handler that throws (an invariant violation or an unexpected bug) aborts the cycle
 * and leaves the agent faulted in the state where it failed. The exception propagates to
 * the caller. {@link #recoverFromFault()} releases every held reservation and puts the agent
 * back in IDLE; until then no cycle runs.
 */
@Service
public class TradingLoopAgent {

    private static final Logger log = LoggerFactory.getLogger(TradingLoopAgent.class);

    /**
     * The longest cycle (IDLE through EXECUTION and LEARNING back to IDLE) is six transitions.
     * Past this cap the loop is not converging.
     */
    static final int MAX_TICKS_PER_CYCLE = 8;

    private final AgentSettings agentSettings;
    private final RecoveryManager recoveryManager;
    private final PerceptionStage perceptionStage;
    private final ReasoningStage reasoningStage;
    private final RiskGatekeeper riskGatekeeper;
    private final ExecutionStage executionStage;
    private final LearningStage learningStage;
    private final ExposureLedger exposureLedger;
    private final ReservationSweeper reservationSweeper;
    private final ReasoningFailureTracker reasoningFailureTracker;
    private final DailyTradeCounter dailyTradeCounter;
    private final AdaptiveContextStore adaptiveContextStore;
    private final OutcomeRecorder outcomeRecorder;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong cycleCounter = new AtomicLong();

    private volatile AgentState state = AgentState.RECOVERING;
    private volatile boolean running;
    private volatile boolean recovered;
    private volatile boolean faulted;
    private volatile RecoveryResult lastRecovery;
    private volatile CycleOutcome lastOutcome;

    private CycleContext cycle;
    private AdaptiveContext adaptiveContext = new AdaptiveContext();
    private int nextPairIndex;

    public TradingLoopAgent(
            AgentSettings agentSettings,
            RecoveryManager recoveryManager,
            PerceptionStage perceptionStage,
            ReasoningStage reasoningStage,
            RiskGatekeeper riskGatekeeper,
            ExecutionStage executionStage,
            LearningStage learningStage,
            ExposureLedger exposureLedger,
            ReservationSweeper reservationSweeper,
            ReasoningFailureTracker reasoningFailureTracker,
            DailyTradeCounter dailyTradeCounter,
            AdaptiveContextStore adaptiveContextStore,
            OutcomeRecorder outcomeRecorder,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.agentSettings = agentSettings;
        this.recoveryManager = recoveryManager;
        this.perceptionStage = perceptionStage;
        this.reasoningStage = reasoningStage;
        this.riskGatekeeper = riskGatekeeper;
        this.executionStage = executionStage;
        this.learningStage = learningStage;
        this.exposureLedger = exposureLedger;
        this.reservationSweeper = reservationSweeper;
        this.reasoningFailureTracker = reasoningFailureTracker;
        this.dailyTradeCounter = dailyTradeCounter;
        this.adaptiveContextStore = adaptiveContextStore;
        this.outcomeRecorder = outcomeRecorder;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // CONTROL
    // ========================

    /**
     * Runs recovery if it has not succeeded yet, then enables scheduled cycles. If recovery
     * fails the agent stays in RECOVERING and is not started.
     *
     * <p>A successful recovery moves straight to PERCEPTION; the next {@link #runCycle()}
     * completes that first cycle.
     */
    public RecoveryResult start() {
        cycleLock.lock();
        try {
            if (faulted) {
                recoverFromFault();
            }
            if (!recovered) {
                tick();
                if (!recovered) {
                    log.error("Agent not started: recovery failed");
                    return lastRecovery;
                }
            }
            running = true;
            log.info("Agent started, trading {} in state {}", agentSettings.getAssetPairs(), state);
            return lastRecovery;
        } finally {
            cycleLock.unlock();
        }
    }

    /** Disables scheduled cycles. A cycle already in progress runs to IDLE. */
    public void stop() {
        running = false;
        log.info("Agent stopped in state {}", state);
    }

    /**
     * Clears a fault: releases every HELD reservation, records the aborted cycle and resets
     * the state to IDLE (or RECOVERING if recovery never succeeded).
     */
    public void recoverFromFault() {
        cycleLock.lock();
        try {
            if (!faulted) {
                return;
            }
            List<ExposureReservation> released = exposureLedger.releaseAll("released after agent fault");
            if (cycle != null) {
                cycle.finish(CycleOutcomeType.FAILED, "cycle aborted in " + state);
                recordOutcome(cycle.toOutcome(clock.instant()));
                cycle = null;
            }
            AgentState resetTo = recovered ? AgentState.IDLE : AgentState.RECOVERING;
            log.warn("Recovering from fault in {}: released {} reservation(s), reset to {}", state, released.size(), resetTo);
            state = resetTo;
            faulted = false;
        } finally {
            cycleLock.unlock();
        }
    }

    // ========================
    // LOOP
    // ========================

    /**
     * Runs one full cycle: from IDLE (or a pending recovery) back to IDLE.
     *
     * @return the cycle's outcome; empty if the cycle was skipped because another one is in
     *     progress, the agent is faulted, or recovery failed
     */
    public Optional<CycleOutcome> runCycle() {
        if (!cycleLock.tryLock()) {
            log.warn("Cycle already in progress, skipping trigger");
            return Optional.empty();
        }
        try {
            if (faulted) {
                log.warn("Agent is faulted in {}, skipping cycle", state);
                return Optional.empty();
            }
            tick();
            if (state == AgentState.RECOVERING) {
                return Optional.empty();
            }
            int ticks = 1;
            while (state != AgentState.IDLE) {
                if (++ticks > MAX_TICKS_PER_CYCLE) {
                    faulted = true;
                    throw new InvariantViolationException(
                            "Cycle did not return to IDLE within " + MAX_TICKS_PER_CYCLE + " transitions",
                            Map.of("state", state.name()));
                }
                tick();
            }
            return Optional.ofNullable(lastOutcome);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Advances the agent by exactly one transition.
     *
     * @return the state after the transition
     * @throws AgentStateConflictException if the agent is faulted
     */
    public AgentState tick() {
        cycleLock.lock();
        try {
            if (faulted) {
                throw new AgentStateConflictException(
                        "Agent is faulted; recoverFromFault() must be called first", Map.of("state", state.name()));
            }
            try {
                AgentTrigger trigger =
                        switch (state) {
                            case RECOVERING -> handleRecovering();
                            case IDLE -> handleIdle();
                            case PERCEPTION -> handlePerception();
                            case REASONING -> handleReasoning();
                            case RISK_CHECK -> handleRiskCheck();
                            case EXECUTION -> handleExecution();
                            case LEARNING -> handleLearning();
                        };
                if (trigger != null) {
                    transition(trigger);
                }
                return state;
            } catch (RuntimeException e) {
                faulted = true;
                log.error("Cycle aborted in {}, agent faulted: {}", state, e.getMessage(), e);
                throw e;
            }
        } finally {
            cycleLock.unlock();
        }
    }

    // ========================
    // STATE HANDLERS
    // ========================

    /** @return null when recovery failed; the agent stays in RECOVERING */
    private AgentTrigger handleRecovering() {
        RecoveryResult result = recoveryManager.recover();
        lastRecovery = result;
        if (!result.isSuccess()) {
            return null;
        }
        adaptiveContext = loadAdaptiveContext();
        recovered = true;
        beginCycle();
        return AgentTrigger.RECOVERY_FINISHED;
    }

    private AgentTrigger handleIdle() {
        beginCycle();
        return AgentTrigger.CYCLE_REQUESTED;
    }

    private AgentTrigger handlePerception() {
        if (dailyTradeCounter.resetIfNewDay()) {
            reasoningFailureTracker.resetAll();
        }

        PerceptionResult perception = perceptionStage.perceive(cycle.getAssetPair());
        cycle.setPerception(perception);
        return switch (perception.getStatus()) {
            case UNAVAILABLE -> {
                cycle.finish(CycleOutcomeType.NO_MARKET_DATA, perception.getError());
                yield AgentTrigger.SNAPSHOT_UNAVAILABLE;
            }
            case STALE -> {
                cycle.finish(
                        CycleOutcomeType.STALE_DATA,
                        "snapshot " + perception.getDataAge().toSeconds() + "s old");
                yield AgentTrigger.SNAPSHOT_STALE;
            }
            case FRESH -> {
                if (killSwitchBreached(perception.getPortfolio())) {
                    yield AgentTrigger.KILL_SWITCH_TRIGGERED;
                }
                yield AgentTrigger.SNAPSHOT_FRESH;
            }
        };
    }

    private AgentTrigger handleReasoning() {
        PerceptionResult perception = cycle.getPerception();
        Optional<Decision> decision =
                reasoningStage.reason(perception.getSnapshot(), perception.getPortfolio(), adaptiveContext);
        if (decision.isEmpty()) {
            cycle.finish(CycleOutcomeType.NO_DECISION, "decision unavailable");
            return AgentTrigger.DECISION_UNAVAILABLE;
        }
        cycle.setDecision(decision.get());
        log.info(
                "Decision {} for {}: {} (confidence {})",
                decision.get().getId(),
                cycle.getAssetPair(),
                decision.get().getAction(),
                decision.get().getConfidence());
        return AgentTrigger.DECISION_PRODUCED;
    }

    private AgentTrigger handleRiskCheck() {
        Decision decision = cycle.getDecision();
        PortfolioSnapshot portfolio = cycle.getPerception().getPortfolio();

        if (decision.isHold()) {
            cycle.finish(CycleOutcomeType.HELD, null);
            return AgentTrigger.HOLD_DECIDED;
        }
        if (portfolio.isSignalOnly()) {
            log.info("Signal only (no account balance): {} {}", decision.getAction(), decision.getAssetPair());
            cycle.finish(CycleOutcomeType.SIGNAL_ONLY, "account balance unavailable");
            return AgentTrigger.SIGNAL_ONLY;
        }
        if (!agentSettings.isAutonomousExecution()) {
            log.info("Signal only (autonomous execution off): {} {}", decision.getAction(), decision.getAssetPair());
            cycle.finish(CycleOutcomeType.SIGNAL_ONLY, "autonomous execution disabled");
            return AgentTrigger.SIGNAL_ONLY;
        }

        RiskVerdict verdict = riskGatekeeper.evaluate(decision, portfolio);
        cycle.setVerdict(verdict);
        if (verdict.isApproved()) {
            return AgentTrigger.RISK_APPROVED;
        }
        cycle.finish(CycleOutcomeType.REJECTED, verdict.getReasonCode());
        return AgentTrigger.RISK_REJECTED;
    }

    private AgentTrigger handleExecution() {
        Decision decision = cycle.getDecision();
        RiskVerdict verdict = cycle.getVerdict();
        if (verdict == null || !verdict.isApproved() || decision.isHold()) {
            throw new InvariantViolationException(
                    "Decision " + decision.getId() + " reached EXECUTION without an approved verdict",
                    Map.of("decisionId", decision.getId()));
        }

        ExecutionResult result = executionStage.execute(decision, verdict.getQuantity());
        cycle.setExecution(result);
        if (result.isFilled()) {
            cycle.finish(CycleOutcomeType.FILLED, null);
        } else {
            cycle.finish(CycleOutcomeType.FAILED, result.getError());
        }
        return AgentTrigger.EXECUTION_FINISHED;
    }

    private AgentTrigger handleLearning() {
        learningStage.learn(adaptiveContext);
        return AgentTrigger.LEARNING_FINISHED;
    }

    // ========================
    // INTERNALS
    // ========================

    private void transition(AgentTrigger trigger) {
        AgentState from = state;
        AgentState to = AgentStateMachine.next(from, trigger);
        state = to;
        log.debug("{} -> {} on {}", from, to, trigger);
        if (to == AgentState.IDLE) {
            completeCycle();
        }
    }

    private void beginCycle() {
        List<String> pairs = agentSettings.getAssetPairs();
        String assetPair = pairs.get(nextPairIndex % pairs.size());
        nextPairIndex = (nextPairIndex + 1) % pairs.size();
        cycle = new CycleContext(cycleCounter.incrementAndGet(), assetPair, clock.instant());
        log.debug("Cycle #{} starting for {}", cycle.getCycleNumber(), assetPair);
    }

    private void completeCycle() {
        if (!cycle.isFinished()) {
            throw new InvariantViolationException(
                    "Cycle #" + cycle.getCycleNumber() + " reached IDLE without an outcome",
                    Map.of("cycle", cycle.getCycleNumber()));
        }
        recordOutcome(cycle.toOutcome(clock.instant()));
        cycle = null;
        reservationSweeper.sweep();
        saveAdaptiveContext();
    }

    private void recordOutcome(CycleOutcome outcome) {
        lastOutcome = outcome;
        outcomeRecorder.record(outcome);
        eventPublisherHelper.publishCycleCompleted(this, outcome);
    }

    private boolean killSwitchBreached(PortfolioSnapshot portfolio) {
        BigDecimal limit = agentSettings.getKillSwitchLossPct();
        if (limit == null || portfolio.isSignalOnly()) {
            return false;
        }
        BigDecimal equity = portfolio.getBalance().getEquity();
        if (equity == null || equity.signum() <= 0) {
            return false;
        }
        BigDecimal pnlPct = portfolio.getTotalUnrealizedPnl().divide(equity, MathContext.DECIMAL64);
        if (pnlPct.compareTo(limit.negate()) >= 0) {
            return false;
        }
        running = false;
        BigDecimal rounded = pnlPct.setScale(4, RoundingMode.HALF_UP);
        log.error("Kill switch: unrealised P&L {} of equity breaches -{}, agent stopped", rounded, limit);
        eventPublisherHelper.publishKillSwitchTriggered(this, rounded, limit);
        cycle.finish(CycleOutcomeType.HALTED, "kill switch: unrealised pnl " + rounded + " of equity");
        return true;
    }

    private AdaptiveContext loadAdaptiveContext() {
        try {
            return adaptiveContextStore.load();
        } catch (PersistenceException e) {
            log.error("Could not load adaptive context, starting fresh", e);
            return new AdaptiveContext();
        }
    }

    private void saveAdaptiveContext() {
        try {
            adaptiveContextStore.save(adaptiveContext);
        } catch (PersistenceException e) {
            log.error("Could not save adaptive context, keeping it in memory", e);
        }
    }

    // ========================
    // STATUS
    // ========================

    public AgentState getState() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isRecovered() {
        return recovered;
    }

    public boolean isFaulted() {
        return faulted;
    }

    public long getCyclesStarted() {
        return cycleCounter.get();
    }

    public Optional<RecoveryResult> getLastRecovery() {
        return Optional.ofNullable(lastRecovery);
    }

    public Optional<CycleOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    /** Snapshot copy; the live context is only touched under the cycle lock. */
    public AdaptiveContext getAdaptiveContext() {
        cycleLock.lock();
        try {
            return adaptiveContext.copy();
        } finally {
            cycleLock.unlock();
        }
    }
}
