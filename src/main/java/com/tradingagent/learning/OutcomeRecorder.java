package com.tradingagent.learning;

import com.tradingagent.domain.model.CycleOutcome;

/** Sink for the outcome of every completed cycle. */
public interface OutcomeRecorder {

    void record(CycleOutcome outcome);
}
