package com.tradingagent.observability;

import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.learning.OutcomeRecorder;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory ring buffer of the most recent cycle outcomes, newest first.
 * Backs {@code GET /api/agent/outcomes}.
 */
@Component
public class CycleOutcomeLog implements OutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(CycleOutcomeLog.class);

    static final int MAX_BUFFER_SIZE = 500;

    private final ConcurrentLinkedDeque<CycleOutcome> ringBuffer = new ConcurrentLinkedDeque<>();

    @Override
    public void record(CycleOutcome outcome) {
        ringBuffer.addFirst(outcome);
        while (ringBuffer.size() > MAX_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }
        log.info(
                "Cycle #{} {} -> {}{}",
                outcome.getCycleNumber(),
                outcome.getAssetPair(),
                outcome.getOutcome(),
                outcome.getReason() != null ? " (" + outcome.getReason() + ")" : "");
    }

    public List<CycleOutcome> getRecent(int count) {
        return ringBuffer.stream().limit(Math.max(0, count)).toList();
    }

    public Optional<CycleOutcome> getLast() {
        return Optional.ofNullable(ringBuffer.peekFirst());
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }
}
