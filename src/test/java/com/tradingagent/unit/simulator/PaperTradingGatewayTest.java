package com.tradingagent.unit.simulator;

import static com.tradingagent.support.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.domain.model.Position;
import com.tradingagent.exception.VenueException;
import com.tradingagent.simulator.PaperTradingGateway;
import com.tradingagent.support.MutableClock;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for PaperTradingGateway covering fills, netting, margin and idempotency. */
class PaperTradingGatewayTest {

    private Map<String, BigDecimal> prices;
    private PaperTradingGateway gateway;

    @BeforeEach
    void setUp() {
        prices = new HashMap<>();
        prices.put("BTC-USD", new BigDecimal("100"));
        gateway = new PaperTradingGateway(prices::get, new BigDecimal("10000"), BigDecimal.ONE, new MutableClock(NOW));
    }

    private OrderResult submit(String clientOrderId, TradeAction action, String quantity) {
        return gateway.submitOrder(OrderRequest.builder()
                .clientOrderId(clientOrderId)
                .assetPair("BTC-USD")
                .action(action)
                .quantity(new BigDecimal(quantity))
                .referencePrice(prices.get("BTC-USD"))
                .build());
    }

    // ==============================
    // FILLS
    // ==============================

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Buys fill above the quote by slippage plus spread")
        void buyFillsWithSlippage() {
            OrderResult result = submit("d1", TradeAction.BUY, "10");

            assertThat(result.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(result.getFillPrice()).isEqualByComparingTo("100.15");
            assertThat(result.getVenueOrderId()).startsWith("PAPER-");
            assertThat(gateway.getPositions()).singleElement().satisfies(position -> {
                assertThat(position.getQuantity()).isEqualByComparingTo("10");
                assertThat(position.getEntryPrice()).isEqualByComparingTo("100.15");
                assertThat(position.getOpenedAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("Resubmitting a client order id returns the first result")
        void idempotentOnClientOrderId() {
            OrderResult first = submit("d1", TradeAction.BUY, "10");
            OrderResult second = submit("d1", TradeAction.BUY, "10");

            assertThat(second).isSameAs(first);
            assertThat(gateway.getPositions().get(0).getQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Closing a long realises the P&L at the sell price")
        void roundTripRealisesPnl() {
            submit("d1", TradeAction.BUY, "10");
            prices.put("BTC-USD", new BigDecimal("110"));

            OrderResult sell = submit("d2", TradeAction.SELL, "10");

            // (110 * 0.9985 - 100.15) * 10
            assertThat(sell.getFillPrice()).isEqualByComparingTo("109.835");
            assertThat(gateway.getRealizedPnl()).isEqualByComparingTo("96.85");
            assertThat(gateway.getPositions()).isEmpty();
            assertThat(gateway.getBalance().getEquity()).isEqualByComparingTo("10096.85");
        }

        @Test
        @DisplayName("Selling through a long flips to a short at the fill price")
        void flipsThroughZero() {
            submit("d1", TradeAction.BUY, "5");

            submit("d2", TradeAction.SELL, "8");

            Position position = gateway.getPositions().get(0);
            assertThat(position.getQuantity()).isEqualByComparingTo("-3");
            assertThat(position.getEntryPrice()).isEqualByComparingTo("99.85");
        }

        @Test
        @DisplayName("HOLD and zero quantity are rejected")
        void rejectsNonOrders() {
            assertThat(submit("h", TradeAction.HOLD, "1").getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(submit("z", TradeAction.BUY, "0").getStatus()).isEqualTo(OrderStatus.REJECTED);
        }

        @Test
        @DisplayName("Cancel never finds an open order")
        void cancelIsNoop() {
            assertThat(gateway.cancelOrder("d1")).isFalse();
        }

        @Test
        @DisplayName("Orders can be looked up by client order id")
        void findsOrderByClientId() {
            OrderResult submitted = submit("d1", TradeAction.BUY, "10");

            assertThat(gateway.findOrder("d1")).containsSame(submitted);
            assertThat(gateway.findOrder("unknown")).isEmpty();
        }
    }

    // ==============================
    // MARGIN
    // ==============================

    @Nested
    @DisplayName("Margin")
    class Margin {

        @Test
        @DisplayName("Orders that add exposure beyond free margin are rejected")
        void insufficientMargin() {
            OrderResult result = submit("big", TradeAction.BUY, "200");

            assertThat(result.getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(result.getMessage()).isEqualTo("Insufficient margin");
            assertThat(gateway.getPositions()).isEmpty();
        }

        @Test
        @DisplayName("Balance marks open positions to market")
        void markToMarket() {
            submit("d1", TradeAction.BUY, "10");
            prices.put("BTC-USD", new BigDecimal("90"));

            AccountBalance balance = gateway.getBalance();

            // unrealised (90 - 100.15) * 10 = -101.5
            assertThat(balance.getEquity()).isEqualByComparingTo("9898.5");
            assertThat(balance.getUsedMargin()).isEqualByComparingTo("900");
            assertThat(balance.getFreeMargin()).isEqualByComparingTo("8998.5");
            assertThat(gateway.getPositions().get(0).getUnrealizedPnl()).isEqualByComparingTo("-101.5");
        }
    }

    // ==============================
    // CLOSE
    // ==============================

    @Test
    @DisplayName("closePosition flattens the book")
    void closePosition() {
        submit("d1", TradeAction.BUY, "10");
        Position open = gateway.getPositions().get(0);

        OrderResult result = gateway.closePosition(open);

        assertThat(result.isFilled()).isTrue();
        assertThat(gateway.getPositions()).isEmpty();
    }

    @Test
    @DisplayName("closePosition without a position is refused")
    void closeMissing() {
        Position ghost = Position.builder().assetPair("BTC-USD").quantity(BigDecimal.ONE).build();

        assertThatThrownBy(() -> gateway.closePosition(ghost)).isInstanceOf(VenueException.class);
    }
}
