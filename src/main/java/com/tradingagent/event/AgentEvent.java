package com.tradingagent.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every externally observable lifecycle step of the agent.
 *
 * <p>{@code assetPair} and {@code decisionId} are null for events that are not tied to one
 * decision (recovery, kill switch). {@code reason} carries the rejection or failure reason.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AgentMetricsService: counts events per type</li>
 * </ul>
 */
public class AgentEvent extends ApplicationEvent {

    private final AgentEventType eventType;
    private final String assetPair;
    private final String decisionId;
    private final String reason;
    private final Map<String, Object> details;

    public AgentEvent(
            Object source,
            AgentEventType eventType,
            String assetPair,
            String decisionId,
            String reason,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.assetPair = assetPair;
        this.decisionId = decisionId;
        this.reason = reason;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public AgentEventType getEventType() {
        return eventType;
    }

    public String getAssetPair() {
        return assetPair;
    }

    public String getDecisionId() {
        return decisionId;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Event-specific data. For example:
     * <ul>
     *   <li>recovery_complete: {"positionsFound": 4, "actionsTaken": 1, "degraded": false}</li>
     *   <li>data_freshness_failed: {"ageSeconds": 900, "thresholdSeconds": 600}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "AgentEvent{" + eventType.getCode() + ", assetPair=" + assetPair + ", decisionId=" + decisionId
                + ", reason=" + reason + "}";
    }
}
