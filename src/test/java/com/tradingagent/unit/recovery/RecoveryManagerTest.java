package com.tradingagent.unit.recovery;

import static com.tradingagent.support.TestFixtures.NOW;
import static com.tradingagent.support.TestFixtures.fastPolicies;
import static com.tradingagent.support.TestFixtures.position;
import static com.tradingagent.support.TestFixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.domain.model.Position;
import com.tradingagent.event.EventPublisherHelper;
import com.tradingagent.exception.VenueException;
import com.tradingagent.execution.ExposureLedger;
import com.tradingagent.monitor.TradeMonitor;
import com.tradingagent.recovery.PositionCloseOrdering;
import com.tradingagent.recovery.RecoveryManager;
import com.tradingagent.recovery.RecoveryResult;
import com.tradingagent.resilience.ExternalCallExecutor;
import com.tradingagent.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for RecoveryManager covering the single retry on position fetch, the
 * close ordering for excess positions and the failure rules.
 */
@ExtendWith(MockitoExtension.class)
class RecoveryManagerTest {

    @Mock
    private TradingPlatformGateway gateway;

    @Mock
    private TradeMonitor tradeMonitor;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private ExecutorService executorService;
    private ExposureLedger ledger;
    private RecoveryManager recoveryManager;

    @BeforeEach
    void setUp() {
        executorService = Executors.newCachedThreadPool();
        MutableClock clock = new MutableClock(NOW);
        ledger = new ExposureLedger(clock);
        recoveryManager = new RecoveryManager(
                gateway,
                new ExternalCallExecutor(executorService),
                fastPolicies(),
                ledger,
                tradeMonitor,
                settings("BTC-USD").maxConcurrentTrades(2).build(),
                eventPublisherHelper,
                clock);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    private static OrderResult filled(Position position) {
        return OrderResult.builder()
                .clientOrderId("close-" + position.getAssetPair())
                .venueOrderId("V-" + position.getAssetPair())
                .status(OrderStatus.FILLED)
                .filledQuantity(position.getQuantity().abs())
                .fillPrice(position.getCurrentPrice())
                .build();
    }

    // ==============================
    // POSITION FETCH
    // ==============================

    @Nested
    @DisplayName("Position fetch")
    class PositionFetch {

        @Test
        @DisplayName("Associates surviving positions under synthetic decision ids")
        void associatesSurvivors() {
            when(gateway.getPositions()).thenReturn(List.of(position("BTC-USD", "0.5", "60000", "120", NOW)));

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isDegraded()).isFalse();
            assertThat(result.getPositionsFound()).isEqualTo(1);
            assertThat(result.getRecoveredDecisionIds())
                    .singleElement()
                    .asString()
                    .matches("RECOVERED_BTC-USD_" + NOW.getEpochSecond() + "_[0-9a-f]{8}");
            verify(tradeMonitor)
                    .associateDecision(result.getRecoveredDecisionIds().get(0), "BTC-USD", List.of("recovered"));
            verify(eventPublisherHelper).publishRecoveryComplete(eq(recoveryManager), eq(result));
        }

        @Test
        @DisplayName("Retries a failed fetch once")
        void retriesOnce() {
            when(gateway.getPositions())
                    .thenThrow(new VenueException("blip"))
                    .thenReturn(List.of(position("BTC-USD", "0.5", "60000", "0", NOW)));

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isDegraded()).isFalse();
            verify(gateway, times(2)).getPositions();
        }

        @Test
        @DisplayName("Continues degraded after two failed fetches, never a third")
        void degradedAfterTwoFailures() {
            when(gateway.getPositions()).thenThrow(new VenueException("venue down"));

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getPositionsFound()).isZero();
            verify(gateway, times(2)).getPositions();
            verify(tradeMonitor, never()).associateDecision(anyString(), anyString(), anyList());
        }

        @Test
        @DisplayName("An empty book completes without closing anything")
        void emptyBookTakesNoAction() {
            when(gateway.getPositions()).thenReturn(List.of());

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPositionsFound()).isZero();
            assertThat(result.getActionsTaken()).isZero();
            assertThat(result.getClosedPairs()).isEmpty();
            verify(gateway, never()).closePosition(any());
            verify(tradeMonitor, never()).associateDecision(anyString(), anyString(), anyList());
            verify(eventPublisherHelper).publishRecoveryComplete(eq(recoveryManager), eq(result));
        }

        @Test
        @DisplayName("Flat positions are ignored")
        void ignoresFlat() {
            when(gateway.getPositions())
                    .thenReturn(List.of(
                            position("BTC-USD", "0", "60000", "0", NOW), position("ETH-USD", "1", "3000", "0", NOW)));

            assertThat(recoveryManager.recover().getPositionsFound()).isEqualTo(1);
        }
    }

    // ==============================
    // EXCESS POSITIONS
    // ==============================

    @Nested
    @DisplayName("Excess positions")
    class ExcessPositions {

        private final List<Position> book = List.of(
                position("AAA-USD", "1", "100", "-50", NOW),
                position("BBB-USD", "1", "100", "-50", NOW.minus(Duration.ofHours(1))),
                position("CCC-USD", "1", "100", "10", NOW),
                position("DDD-USD", "1", "100", "-10", NOW));

        @Test
        @DisplayName("Closes the worst P&L first, oldest first on ties")
        void closesWorstFirst() {
            when(gateway.getPositions()).thenReturn(book);
            List<String> closeOrder = new ArrayList<>();
            when(gateway.closePosition(any())).thenAnswer(invocation -> {
                Position position = invocation.getArgument(0);
                synchronized (closeOrder) {
                    closeOrder.add(position.getAssetPair());
                }
                return filled(position);
            });

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getActionsTaken()).isEqualTo(2);
            assertThat(result.getClosedPairs()).containsExactly("BBB-USD", "AAA-USD");
            assertThat(closeOrder).containsExactly("BBB-USD", "AAA-USD");
            assertThat(result.getRecoveredDecisionIds()).hasSize(2);
            verify(tradeMonitor).associateDecision(anyString(), eq("DDD-USD"), anyList());
            verify(tradeMonitor).associateDecision(anyString(), eq("CCC-USD"), anyList());
        }

        @Test
        @DisplayName("A close that fails once is retried")
        void closeRetriedOnce() {
            when(gateway.getPositions()).thenReturn(book);
            Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
            when(gateway.closePosition(any())).thenAnswer(invocation -> {
                Position position = invocation.getArgument(0);
                if (attempts.computeIfAbsent(position.getAssetPair(), k -> new AtomicInteger()).incrementAndGet() == 1) {
                    throw new VenueException("transient");
                }
                return filled(position);
            });

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isTrue();
            assertThat(attempts.get("BBB-USD").get()).isEqualTo(2);
            assertThat(attempts.get("AAA-USD").get()).isEqualTo(2);
        }

        @Test
        @DisplayName("A close that fails twice fails recovery")
        void closeFailureFailsRecovery() {
            when(gateway.getPositions()).thenReturn(book);
            when(gateway.closePosition(any())).thenAnswer(invocation -> {
                Position position = invocation.getArgument(0);
                if (position.getAssetPair().equals("AAA-USD")) {
                    throw new VenueException("close refused");
                }
                return filled(position);
            });

            RecoveryResult result = recoveryManager.recover();

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailedClosePairs()).containsExactly("AAA-USD");
            assertThat(result.getClosedPairs()).containsExactly("BBB-USD");
            assertThat(result.getError()).contains("AAA-USD");
            verify(tradeMonitor, never()).associateDecision(anyString(), anyString(), anyList());
            verify(eventPublisherHelper).publishRecoveryFailed(eq(recoveryManager), eq(result));
            verify(eventPublisherHelper, never()).publishRecoveryComplete(any(), any());
        }
    }

    @Test
    @DisplayName("Releases reservations left from before recovery")
    void releasesLeftovers() {
        ledger.reserve("stale", "BTC-USD", TradeAction.BUY, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.TEN);
        when(gateway.getPositions()).thenReturn(List.of());

        RecoveryResult result = recoveryManager.recover();

        assertThat(result.getReleasedReservations()).isEqualTo(1);
        assertThat(ledger.heldCount()).isZero();
    }

    @Test
    @DisplayName("Close ordering puts missing P&L with zero and missing dates last")
    void closeOrderingNulls() {
        Position noPnl = position("AAA-USD", "1", "100", null, NOW);
        Position loser = position("BBB-USD", "1", "100", "-1", null);
        Position undated = position("CCC-USD", "1", "100", null, null);

        List<Position> sorted = new ArrayList<>(List.of(undated, noPnl, loser));
        sorted.sort(PositionCloseOrdering.CLOSE_PRIORITY);

        assertThat(sorted).extracting(Position::getAssetPair).containsExactly("BBB-USD", "AAA-USD", "CCC-USD");
    }
}
