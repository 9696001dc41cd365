package com.tradingagent.risk;

import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trades committed today, by the agent clock's calendar date. Incremented once per
 * committed reservation and reset the first time it is read on a new date.
 */
@Component
public class DailyTradeCounter {

    private static final Logger log = LoggerFactory.getLogger(DailyTradeCounter.class);

    private final Clock clock;
    private LocalDate date;
    private int count;

    public DailyTradeCounter(Clock clock) {
        this.clock = clock;
        this.date = LocalDate.now(clock);
    }

    /** @return true if the date rolled over and the count was reset */
    public synchronized boolean resetIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(date)) {
            return false;
        }
        log.info("New trading day {}: resetting daily trade count (was {} on {})", today, count, date);
        date = today;
        count = 0;
        return true;
    }

    public synchronized int current() {
        resetIfNewDay();
        return count;
    }

    public synchronized int increment() {
        resetIfNewDay();
        return ++count;
    }
}
