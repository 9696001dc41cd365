package com.tradingagent.execution;

import com.tradingagent.agent.AgentSettings;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.event.EventPublisherHelper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases HELD reservations older than {@code reservationMaxAge}. Runs on a fixed delay
 * and at the end of every agent cycle, so a reservation orphaned by a crash inside
 * execution cannot pin margin for longer than the maximum age plus one sweep interval.
 */
@Component
public class ReservationSweeper {

    private static final Logger log = LoggerFactory.getLogger(ReservationSweeper.class);

    static final String EXPIRED_REASON = "expired";

    private final ExposureLedger exposureLedger;
    private final AgentSettings agentSettings;
    private final EventPublisherHelper eventPublisherHelper;

    public ReservationSweeper(
            ExposureLedger exposureLedger, AgentSettings agentSettings, EventPublisherHelper eventPublisherHelper) {
        this.exposureLedger = exposureLedger;
        this.agentSettings = agentSettings;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Scheduled(fixedDelayString = "${tradingagent.execution.sweep-interval-ms:30000}")
    public void scheduledSweep() {
        sweep();
    }

    /** @return the reservations released by this sweep */
    public List<ExposureReservation> sweep() {
        List<ExposureReservation> expired =
                exposureLedger.releaseOlderThan(agentSettings.getReservationMaxAge(), EXPIRED_REASON);
        if (!expired.isEmpty()) {
            log.warn("Sweep released {} expired reservation(s)", expired.size());
            expired.forEach(reservation -> eventPublisherHelper.publishReservationExpired(this, reservation));
        }
        return expired;
    }
}
