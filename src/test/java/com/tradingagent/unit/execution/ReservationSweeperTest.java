package com.tradingagent.unit.execution;

import static com.tradingagent.support.TestFixtures.NOW;
import static com.tradingagent.support.TestFixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.ExposureReservation;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.execution.ReservationSweeper;
import com.tradingagent.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReservationSweeperTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private ExposureLedger ledger;
    private ReservationSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        ledger = new ExposureLedger(clock);
        sweeper = new ReservationSweeper(
                ledger, settings("BTC-USD").reservationMaxAge(Duration.ofMinutes(5)).build(), eventPublisherHelper);
    }

    @Test
    @DisplayName("Releases expired reservations and publishes reservation_expired")
    void releasesExpired() {
        ledger.reserve("orphan", "BTC-USD", TradeAction.BUY, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.TEN);
        clock.advance(Duration.ofMinutes(6));

        List<ExposureReservation> released = sweeper.sweep();

        assertThat(released).hasSize(1);
        assertThat(released.get(0).getReleaseReason()).isEqualTo("expired");
        assertThat(ledger.heldCount()).isZero();
        verify(eventPublisherHelper)
                .publishReservationExpired(eq(sweeper), argThat(r -> r.getDecisionId().equals("orphan")));
    }

    @Test
    @DisplayName("Leaves young reservations alone")
    void keepsYoung() {
        ledger.reserve("fresh", "BTC-USD", TradeAction.BUY, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.TEN);
        clock.advance(Duration.ofMinutes(1));

        assertThat(sweeper.sweep()).isEmpty();
        assertThat(ledger.heldCount()).isEqualTo(1);
        verify(eventPublisherHelper, never()).publishReservationExpired(any(), any());
    }
}
