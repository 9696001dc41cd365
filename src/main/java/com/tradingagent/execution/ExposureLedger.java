package com.tradingagent.execution;

import com.tradingagent.domain.enums.ReservationStatus;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.exception.DoubleReservationException;
import com.tradingagent.exception.InvariantViolationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns every {@link ExposureReservation}. At most one HELD reservation exists per asset
 * pair; the existence check and the insert happen under one lock.
 *
 * <p>Resolved reservations (COMMITTED or RELEASED) move to a bounded history, newest first.
 * Release is idempotent so rollback paths can release unconditionally.
 */
@Component
public class ExposureLedger {

    private static final Logger log = LoggerFactory.getLogger(ExposureLedger.class);

    static final int MAX_HISTORY = 200;

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ExposureReservation> heldByPair = new LinkedHashMap<>();
    private final Deque<ExposureReservation> history = new ArrayDeque<>();

    public ExposureLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws DoubleReservationException if the pair already has a HELD reservation
     */
    public ExposureReservation reserve(
            String decisionId,
            String assetPair,
            TradeAction action,
            BigDecimal quantity,
            BigDecimal notional,
            BigDecimal margin) {
        lock.lock();
        try {
            ExposureReservation existing = heldByPair.get(assetPair);
            if (existing != null) {
                log.error(
                        "Refusing second reservation for {}: {} still HELD by decision {}",
                        assetPair,
                        existing.getReservationId(),
                        existing.getDecisionId());
                throw new DoubleReservationException(assetPair, existing.getReservationId());
            }
            ExposureReservation reservation = ExposureReservation.builder()
                    .reservationId(UUID.randomUUID().toString())
                    .decisionId(decisionId)
                    .assetPair(assetPair)
                    .action(action)
                    .quantity(quantity)
                    .notional(notional)
                    .margin(margin)
                    .status(ReservationStatus.HELD)
                    .createdAt(clock.instant())
                    .build();
            heldByPair.put(assetPair, reservation);
            log.info(
                    "Reserved {} margin for {} {} {} (reservation {})",
                    margin,
                    action,
                    quantity,
                    assetPair,
                    reservation.getReservationId());
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws InvariantViolationException if the reservation is not currently HELD
     */
    public ExposureReservation commit(String reservationId) {
        lock.lock();
        try {
            ExposureReservation held = findHeldById(reservationId)
                    .orElseThrow(() -> new InvariantViolationException(
                            "Cannot commit reservation " + reservationId + ": not HELD",
                            Map.of("reservationId", reservationId)));
            ExposureReservation committed = held.committed(clock.instant());
            resolve(committed);
            log.info("Committed reservation {} for {}", reservationId, committed.getAssetPair());
            return committed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a HELD reservation. Releasing one that is already resolved returns its
     * resolved state unchanged.
     */
    public Optional<ExposureReservation> release(String reservationId, String reason) {
        lock.lock();
        try {
            Optional<ExposureReservation> held = findHeldById(reservationId);
            if (held.isEmpty()) {
                return history.stream()
                        .filter(r -> r.getReservationId().equals(reservationId))
                        .findFirst();
            }
            ExposureReservation released = held.get().released(clock.instant(), reason);
            resolve(released);
            log.info("Released reservation {} for {}: {}", reservationId, released.getAssetPair(), reason);
            return Optional.of(released);
        } finally {
            lock.unlock();
        }
    }

    /** Releases every HELD reservation created more than {@code maxAge} ago. */
    public List<ExposureReservation> releaseOlderThan(Duration maxAge, String reason) {
        return releaseWhere(r -> r.ageAt(clock.instant()).compareTo(maxAge) > 0, reason);
    }

    public List<ExposureReservation> releaseAll(String reason) {
        return releaseWhere(r -> true, reason);
    }

    public Optional<ExposureReservation> findHeld(String assetPair) {
        lock.lock();
        try {
            return Optional.ofNullable(heldByPair.get(assetPair));
        } finally {
            lock.unlock();
        }
    }

    public List<ExposureReservation> getHeld() {
        lock.lock();
        try {
            return List.copyOf(heldByPair.values());
        } finally {
            lock.unlock();
        }
    }

    public int heldCount() {
        lock.lock();
        try {
            return heldByPair.size();
        } finally {
            lock.unlock();
        }
    }

    /** Margin tied up in HELD reservations; the gatekeeper subtracts it from free margin. */
    public BigDecimal reservedMargin() {
        lock.lock();
        try {
            return heldByPair.values().stream()
                    .map(ExposureReservation::getMargin)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
        } finally {
            lock.unlock();
        }
    }

    public List<ExposureReservation> getRecentlyResolved(int count) {
        lock.lock();
        try {
            return history.stream().limit(Math.max(0, count)).toList();
        } finally {
            lock.unlock();
        }
    }

    private Optional<ExposureReservation> findHeldById(String reservationId) {
        return heldByPair.values().stream()
                .filter(r -> r.getReservationId().equals(reservationId))
                .findFirst();
    }

    private List<ExposureReservation> releaseWhere(Predicate<ExposureReservation> filter, String reason) {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ExposureReservation> matching =
                    heldByPair.values().stream().filter(filter).toList();
            List<ExposureReservation> released = new ArrayList<>();
            for (ExposureReservation reservation : matching) {
                ExposureReservation resolved = reservation.released(now, reason);
                resolve(resolved);
                released.add(resolved);
                log.warn(
                        "Released reservation {} for {} (age {}s): {}",
                        reservation.getReservationId(),
                        reservation.getAssetPair(),
                        reservation.ageAt(now).toSeconds(),
                        reason);
            }
            return released;
        } finally {
            lock.unlock();
        }
    }

    private void resolve(ExposureReservation resolved) {
        heldByPair.remove(resolved.getAssetPair());
        history.addFirst(resolved);
        while (history.size() > MAX_HISTORY) {
            history.removeLast();
        }
    }
}
