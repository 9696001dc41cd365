package com.tradingagent.risk;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.RejectionRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Cooldown cache of recent gatekeeper rejections keyed by (asset pair, action).
 *
 * <p>Expiry is judged against the injected {@link Clock}; Caffeine's own write expiry is
 * only a memory bound set slightly past the cooldown. Reads and writes are serialised so
 * a lookup never observes a half-replaced record.
 */
@Component
public class RejectionCache {

    private static final int MAX_ENTRIES = 10_000;

    private final RiskLimits riskLimits;
    private final Clock clock;
    private final Cache<String, RejectionRecord> cache;
    private final ReentrantLock lock = new ReentrantLock();

    public RejectionCache(RiskLimits riskLimits, Clock clock) {
        this.riskLimits = riskLimits;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .expireAfterWrite(riskLimits.getRejectionCooldown().toMillis() * 2 + 1_000, TimeUnit.MILLISECONDS)
                .build();
    }

    public Optional<RejectionRecord> findActive(String assetPair, TradeAction action) {
        String key = key(assetPair, action);
        lock.lock();
        try {
            RejectionRecord record = cache.getIfPresent(key);
            if (record == null) {
                return Optional.empty();
            }
            if (!record.isActiveAt(clock.instant())) {
                cache.invalidate(key);
                return Optional.empty();
            }
            return Optional.of(record);
        } finally {
            lock.unlock();
        }
    }

    public RejectionRecord recordRejection(String assetPair, TradeAction action, RejectionReason reason) {
        Instant now = clock.instant();
        Duration cooldown = riskLimits.getRejectionCooldown();
        RejectionRecord record = RejectionRecord.builder()
                .assetPair(assetPair)
                .action(action)
                .timeBucket(bucketOf(now, cooldown))
                .reason(reason.getCode())
                .rejectedAt(now)
                .expiresAt(now.plus(cooldown))
                .build();
        lock.lock();
        try {
            cache.put(key(assetPair, action), record);
        } finally {
            lock.unlock();
        }
        return record;
    }

    public long size() {
        lock.lock();
        try {
            cache.cleanUp();
            return cache.estimatedSize();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            cache.invalidateAll();
        } finally {
            lock.unlock();
        }
    }

    static Instant bucketOf(Instant at, Duration bucketSize) {
        long sizeSeconds = Math.max(1, bucketSize.toSeconds());
        long epochSeconds = at.getEpochSecond();
        return Instant.ofEpochSecond(epochSeconds - Math.floorMod(epochSeconds, sizeSeconds));
    }

    private static String key(String assetPair, TradeAction action) {
        return assetPair + "|" + action;
    }
}
