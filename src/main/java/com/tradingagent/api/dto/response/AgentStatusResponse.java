package com.tradingagent.api.dto.response;

import com.tradingagent.domain.enums.AgentState;
import com.tradingagent.domain.model.CycleOutcome;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Response DTO for {@code GET /api/agent/status}. */
@Getter
@Builder
public class AgentStatusResponse {

    private final AgentState state;
    private final boolean running;
    private final boolean recovered;
    private final boolean faulted;
    private final List<String> assetPairs;
    private final long cycleCount;
    private final int dailyTradeCount;
    private final int heldReservations;
    private final CycleOutcome lastOutcome;

    /** Error from the last recovery attempt; null when it succeeded or has not run. */
    private final String recoveryError;
}
