package com.tradingagent.unit.observability;

import static com.tradingagent.support.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.domain.enums.CycleOutcomeType;
import com.tradingagent.domain.model.CycleOutcome;
import com.tradingagent.observability.CycleOutcomeLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CycleOutcomeLogTest {

    private final CycleOutcomeLog outcomeLog = new CycleOutcomeLog();

    private static CycleOutcome outcome(long cycleNumber) {
        return CycleOutcome.builder()
                .cycleNumber(cycleNumber)
                .assetPair("BTC-USD")
                .outcome(CycleOutcomeType.NO_DECISION)
                .startedAt(NOW)
                .finishedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Recent outcomes come back newest first")
    void newestFirst() {
        outcomeLog.record(outcome(1));
        outcomeLog.record(outcome(2));
        outcomeLog.record(outcome(3));

        assertThat(outcomeLog.getRecent(2)).extracting(CycleOutcome::getCycleNumber).containsExactly(3L, 2L);
        assertThat(outcomeLog.getLast()).map(CycleOutcome::getCycleNumber).contains(3L);
        assertThat(outcomeLog.getRecent(-1)).isEmpty();
    }

    @Test
    @DisplayName("The buffer drops the oldest outcomes beyond 500")
    void boundedBuffer() {
        for (long i = 1; i <= 510; i++) {
            outcomeLog.record(outcome(i));
        }

        assertThat(outcomeLog.getBufferSize()).isEqualTo(500);
        assertThat(outcomeLog.getRecent(1000)).last().extracting(CycleOutcome::getCycleNumber).isEqualTo(11L);
    }
}
