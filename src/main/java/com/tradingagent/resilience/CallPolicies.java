package com.tradingagent.resilience;

import lombok.Builder;
import lombok.Value;

/** The configured {@link CallPolicy} for each collaborator the agent talks to. */
@Value
@Builder(toBuilder = true)
public class CallPolicies {

    CallPolicy marketData;
    CallPolicy decisionProvider;

    /** Positions and balance reads. */
    CallPolicy venueQuery;

    /** Order submission, cancel and close. Never retried outside recovery. */
    CallPolicy venueOrder;

    /** How long a timed-out submission is still awaited before it is cancelled and looked up. */
    CallPolicy venueOrderSettle;
}
