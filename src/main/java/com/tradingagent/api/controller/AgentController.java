package com.tradingagent.api.controller;

import com.tradingagent.agent.AgentSettings;
import com.tradingagent.agent.TradingLoopAgent;
import com.tradingagent.api.dto.response.AgentStatusResponse;
import com.tradingagent.api.dto.response.ApiResponse;
import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.exception.AgentStateConflictException;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.observability.CycleOutcomeLog;
import com.tradingagent.recovery.RecoveryResult;
import com.tradingagent.risk.DailyTradeCounter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Control endpoints for the trading loop.
 *
 * <ul>
 *   <li>GET /api/agent/status -- state, flags, counters, last outcome</li>
 *   <li>POST /api/agent/start -- run recovery if needed and enable scheduled cycles</li>
 *   <li>POST /api/agent/stop -- disable scheduled cycles</li>
 *   <li>POST /api/agent/reset -- clear a fault, releasing held reservations</li>
 *   <li>GET /api/agent/reservations -- HELD exposure reservations</li>
 *   <li>GET /api/agent/outcomes?limit=N -- recent cycle outcomes, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/agent")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    static final int MAX_OUTCOMES = 200;

    private final TradingLoopAgent tradingLoopAgent;
    private final AgentSettings agentSettings;
    private final ExposureLedger exposureLedger;
    private final DailyTradeCounter dailyTradeCounter;
    private final CycleOutcomeLog cycleOutcomeLog;

    public AgentController(
            TradingLoopAgent tradingLoopAgent,
            AgentSettings agentSettings,
            ExposureLedger exposureLedger,
            DailyTradeCounter dailyTradeCounter,
            CycleOutcomeLog cycleOutcomeLog) {
        this.tradingLoopAgent = tradingLoopAgent;
        this.agentSettings = agentSettings;
        this.exposureLedger = exposureLedger;
        this.dailyTradeCounter = dailyTradeCounter;
        this.cycleOutcomeLog = cycleOutcomeLog;
    }

    @GetMapping("/status")
    public ResponseEntity<AgentStatusResponse> getStatus() {
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/start")
    public ResponseEntity<ApiResponse<AgentStatusResponse>> start() {
        log.info("Agent start requested");
        RecoveryResult result = tradingLoopAgent.start();
        if (!tradingLoopAgent.isRunning()) {
            String error = result != null ? result.getError() : "recovery did not run";
            throw new AgentStateConflictException(
                    "Agent not started: recovery failed", Map.of("recoveryError", String.valueOf(error)));
        }
        return ResponseEntity.ok(ApiResponse.of(buildStatus(), "Agent started"));
    }

    @PostMapping("/stop")
    public ResponseEntity<ApiResponse<AgentStatusResponse>> stop() {
        log.info("Agent stop requested");
        tradingLoopAgent.stop();
        return ResponseEntity.ok(ApiResponse.of(buildStatus(), "Agent stopped"));
    }

    @PostMapping("/reset")
    public ResponseEntity<ApiResponse<AgentStatusResponse>> reset() {
        if (!tradingLoopAgent.isFaulted()) {
            throw new AgentStateConflictException(
                    "Agent is not faulted", Map.of("state", tradingLoopAgent.getState().name()));
        }
        tradingLoopAgent.recoverFromFault();
        return ResponseEntity.ok(ApiResponse.of(buildStatus(), "Fault cleared"));
    }

    @GetMapping("/reservations")
    public ResponseEntity<List<ExposureReservation>> getReservations() {
        return ResponseEntity.ok(exposureLedger.getHeld());
    }

    @GetMapping("/outcomes")
    public ResponseEntity<List<CycleOutcome>> getOutcomes(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(cycleOutcomeLog.getRecent(Math.min(limit, MAX_OUTCOMES)));
    }

    private AgentStatusResponse buildStatus() {
        return AgentStatusResponse.builder()
                .state(tradingLoopAgent.getState())
                .running(tradingLoopAgent.isRunning())
                .recovered(tradingLoopAgent.isRecovered())
                .faulted(tradingLoopAgent.isFaulted())
                .assetPairs(agentSettings.getAssetPairs())
                .cycleCount(tradingLoopAgent.getCyclesStarted())
                .dailyTradeCount(dailyTradeCounter.current())
                .heldReservations(exposureLedger.heldCount())
                .lastOutcome(tradingLoopAgent.getLastOutcome().orElse(null))
                .recoveryError(tradingLoopAgent
                        .getLastRecovery()
                        .map(RecoveryResult::getError)
                        .orElse(null))
                .build();
    }
}
