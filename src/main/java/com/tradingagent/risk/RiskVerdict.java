package com.tradingagent.risk;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Result of {@link RiskGatekeeper#evaluate}. Either APPROVED with the order quantity the
 * checks were run against, or REJECTED with the first failing reason.
 *
 * <p>Telemetry holds the measured values of every check that ran (VaR, correlated count,
 * margin headroom) so a rejection can be explained after the fact.
 */
@Getter
public class RiskVerdict {

    private final boolean approved;
    private final RejectionReason reason;
    private final String message;
    private final BigDecimal quantity;
    private final Map<String, Object> telemetry;

    private RiskVerdict(
            boolean approved, RejectionReason reason, String message, BigDecimal quantity, Map<String, Object> telemetry) {
        this.approved = approved;
        this.reason = reason;
        this.message = message;
        this.quantity = quantity;
        this.telemetry = Collections.unmodifiableMap(new LinkedHashMap<>(telemetry));
    }

    public static RiskVerdict approved(BigDecimal quantity, Map<String, Object> telemetry) {
        return new RiskVerdict(true, null, "approved", quantity, telemetry);
    }

    public static RiskVerdict rejected(RejectionReason reason, String message, Map<String, Object> telemetry) {
        return new RiskVerdict(false, reason, message, null, telemetry);
    }

    public boolean isRejected() {
        return !approved;
    }

    public String getReasonCode() {
        return reason != null ? reason.getCode() : null;
    }
}
