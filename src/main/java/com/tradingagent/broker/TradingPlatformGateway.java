package com.tradingagent.broker;

import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.domain.model.Position;
import java.util.List;
import java.util.Optional;

/**
 * Everything the agent needs from the trading venue. Callers go through
 * {@code ExternalCallExecutor}, never straight to an implementation, so every call is
 * time-bounded.
 *
 * <p>{@code PaperTradingGateway} is the in-memory implementation used for paper trading.
 * A live adapter replaces it by setting {@code tradingagent.mode} to anything but PAPER.
 */
public interface TradingPlatformGateway {

    // ---- Account ----

    /**
     * @return open positions; flat pairs are not included
     * @throws com.tradingagent.exception.VenueException if the venue cannot be read
     */
    List<Position> getPositions();

    /**
     * @throws com.tradingagent.exception.VenueException if the venue cannot be read
     */
    AccountBalance getBalance();

    // ---- Orders ----

    /**
     * Submits a market order. Submitting the same {@code clientOrderId} twice must return the
     * first result rather than open a second position.
     *
     * @return FILLED when the venue confirmed the fill within the call, ACCEPTED when it took
     *     the order without confirming, REJECTED otherwise
     * @throws com.tradingagent.exception.VenueException if the venue fails the request
     */
    OrderResult submitOrder(OrderRequest request);

    /**
     * Best-effort cancel of an order that may or may not have reached the venue.
     *
     * @return true if an open order was cancelled
     */
    boolean cancelOrder(String clientOrderId);

    /**
     * Looks up an order by the id the agent submitted it under.
     *
     * @return empty if the venue never received the order
     * @throws com.tradingagent.exception.VenueException if the venue cannot be read
     */
    Optional<OrderResult> findOrder(String clientOrderId);

    /**
     * Flattens the given position with a market order.
     *
     * @throws com.tradingagent.exception.VenueException if the close is refused
     */
    OrderResult closePosition(Position position);
}
