package com.tradingagent.recovery;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence. Carried in the recovery_complete or
 * recovery_failed event.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    /** Position fetch failed twice; recovery continued with no venue positions. */
    private boolean degraded;

    private int releasedReservations;
    private int positionsFound;

    /** Number of positions closed to bring the book under the concurrent-trade limit. */
    private int actionsTaken;

    @Builder.Default
    private List<String> closedPairs = new ArrayList<>();

    @Builder.Default
    private List<String> failedClosePairs = new ArrayList<>();

    @Builder.Default
    private List<String> recoveredDecisionIds = new ArrayList<>();
}
