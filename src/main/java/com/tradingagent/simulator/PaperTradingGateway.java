package com.tradingagent.simulator;

import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.AccountBalance;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderResult;
import com.tradingagent.domain.model.Position;
import com.tradingagent.exception.VenueException;
import com.tradingagent.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading venue. Market orders fill immediately against the {@link QuoteSource} price
 * plus slippage and spread; positions net per asset pair.
 *
 * <p>Margin is {@code |quantity| * price / leverage}. An order that adds exposure beyond the
 * free margin is rejected. Orders are de-duplicated on {@code clientOrderId}: resubmitting
 * returns the first result.
 *
 * <p>Active when {@code tradingagent.mode=PAPER} (the default).
 */
@Service
@ConditionalOnProperty(name = "tradingagent.mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperTradingGateway implements TradingPlatformGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingGateway.class);

    static final BigDecimal SLIPPAGE_RATE = new BigDecimal("0.001");
    static final BigDecimal SPREAD = new BigDecimal("0.0005");
    private static final int PRICE_SCALE = 8;

    private final QuoteSource quoteSource;
    private final BigDecimal startingCash;
    private final BigDecimal leverage;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Position> book = new LinkedHashMap<>();
    private final Map<String, OrderResult> ordersByClientId = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Autowired
    public PaperTradingGateway(
            QuoteSource quoteSource,
            RiskLimits riskLimits,
            @Value("${tradingagent.simulator.starting-cash:10000}") BigDecimal startingCash,
            Clock clock) {
        this(quoteSource, startingCash, riskLimits.getLeverage(), clock);
    }

    public PaperTradingGateway(QuoteSource quoteSource, BigDecimal startingCash, BigDecimal leverage, Clock clock) {
        this.quoteSource = quoteSource;
        this.startingCash = startingCash;
        this.leverage = leverage;
        this.clock = clock;
    }

    // ========================
    // ACCOUNT
    // ========================

    @Override
    public List<Position> getPositions() {
        lock.lock();
        try {
            List<Position> positions = new ArrayList<>(book.size());
            for (Position position : book.values()) {
                positions.add(markToMarket(position));
            }
            return positions;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AccountBalance getBalance() {
        lock.lock();
        try {
            BigDecimal unrealized = BigDecimal.ZERO;
            BigDecimal usedMargin = BigDecimal.ZERO;
            for (Position position : book.values()) {
                Position marked = markToMarket(position);
                unrealized = unrealized.add(marked.getUnrealizedPnl());
                usedMargin = usedMargin.add(marginFor(marked.getQuantity().abs(), marked.getCurrentPrice()));
            }
            BigDecimal equity = startingCash.add(realizedPnl).add(unrealized);
            return AccountBalance.builder()
                    .equity(equity)
                    .usedMargin(usedMargin)
                    .freeMargin(equity.subtract(usedMargin))
                    .currency("USD")
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public OrderResult submitOrder(OrderRequest request) {
        lock.lock();
        try {
            OrderResult previous = ordersByClientId.get(request.getClientOrderId());
            if (previous != null) {
                log.debug("Duplicate clientOrderId {}, returning original result", request.getClientOrderId());
                return previous;
            }
            OrderResult result = fill(request.getClientOrderId(), request.getAssetPair(), request.getAction(), request.getQuantity());
            ordersByClientId.put(request.getClientOrderId(), result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Market orders fill or reject synchronously, so there is never anything open to cancel. */
    @Override
    public boolean cancelOrder(String clientOrderId) {
        log.debug("Paper cancel for {}: no open order", clientOrderId);
        return false;
    }

    @Override
    public Optional<OrderResult> findOrder(String clientOrderId) {
        lock.lock();
        try {
            return Optional.ofNullable(ordersByClientId.get(clientOrderId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OrderResult closePosition(Position position) {
        lock.lock();
        try {
            Position held = book.get(position.getAssetPair());
            if (held == null) {
                throw new VenueException(
                        "No open position for " + position.getAssetPair(), Map.of("assetPair", position.getAssetPair()));
            }
            TradeAction action = held.getQuantity().signum() > 0 ? TradeAction.SELL : TradeAction.BUY;
            String clientOrderId = "close-" + held.getPositionId() + "-" + clock.millis();
            return fill(clientOrderId, held.getAssetPair(), action, held.getQuantity().abs());
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getRealizedPnl() {
        lock.lock();
        try {
            return realizedPnl;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private OrderResult fill(String clientOrderId, String assetPair, TradeAction action, BigDecimal quantity) {
        if (action == null || action == TradeAction.HOLD || quantity == null || quantity.signum() <= 0) {
            return rejected(clientOrderId, "Order needs BUY or SELL and a positive quantity");
        }
        BigDecimal fillPrice = withSlippage(quoteSource.currentPrice(assetPair), action);
        BigDecimal delta = action == TradeAction.BUY ? quantity : quantity.negate();

        Position existing = book.get(assetPair);
        BigDecimal currentQty = existing != null ? existing.getQuantity() : BigDecimal.ZERO;
        BigDecimal newQty = currentQty.add(delta);
        if (newQty.abs().compareTo(currentQty.abs()) > 0) {
            BigDecimal addedExposure = newQty.abs().subtract(currentQty.abs());
            BigDecimal required = marginFor(addedExposure, fillPrice);
            BigDecimal free = getBalance().getFreeMargin();
            if (required.compareTo(free) > 0) {
                log.warn("Paper order {} rejected: margin {} exceeds free {}", clientOrderId, required, free);
                return rejected(clientOrderId, "Insufficient margin");
            }
        }

        applyFill(existing, assetPair, currentQty, delta, newQty, fillPrice);
        String venueOrderId = "PAPER-" + sequence.incrementAndGet();
        log.info("Paper fill {}: {} {} {} @ {}", venueOrderId, action, quantity, assetPair, fillPrice);
        return OrderResult.builder()
                .clientOrderId(clientOrderId)
                .venueOrderId(venueOrderId)
                .status(OrderStatus.FILLED)
                .filledQuantity(quantity)
                .fillPrice(fillPrice)
                .build();
    }

    private void applyFill(
            Position existing, String assetPair, BigDecimal currentQty, BigDecimal delta, BigDecimal newQty, BigDecimal fillPrice) {
        if (existing == null) {
            book.put(assetPair, newPosition(assetPair, newQty, fillPrice));
            return;
        }
        if (currentQty.signum() == delta.signum()) {
            BigDecimal cost = existing.getEntryPrice().multiply(currentQty.abs()).add(fillPrice.multiply(delta.abs()));
            existing.setEntryPrice(cost.divide(newQty.abs(), PRICE_SCALE, RoundingMode.HALF_UP));
            existing.setQuantity(newQty);
            return;
        }

        BigDecimal closing = currentQty.abs().min(delta.abs());
        BigDecimal perUnit = fillPrice.subtract(existing.getEntryPrice()).multiply(BigDecimal.valueOf(currentQty.signum()));
        realizedPnl = realizedPnl.add(perUnit.multiply(closing));

        if (newQty.signum() == 0) {
            book.remove(assetPair);
        } else if (newQty.signum() != currentQty.signum()) {
            book.put(assetPair, newPosition(assetPair, newQty, fillPrice));
        } else {
            existing.setQuantity(newQty);
        }
    }

    private Position newPosition(String assetPair, BigDecimal quantity, BigDecimal entryPrice) {
        return Position.builder()
                .positionId("PAPER-POS-" + sequence.incrementAndGet())
                .assetPair(assetPair)
                .quantity(quantity)
                .entryPrice(entryPrice)
                .openedAt(clock.instant())
                .build();
    }

    private Position markToMarket(Position position) {
        BigDecimal price = quoteSource.currentPrice(position.getAssetPair());
        return Position.builder()
                .positionId(position.getPositionId())
                .assetPair(position.getAssetPair())
                .quantity(position.getQuantity())
                .entryPrice(position.getEntryPrice())
                .currentPrice(price)
                .unrealizedPnl(price.subtract(position.getEntryPrice()).multiply(position.getQuantity()))
                .openedAt(position.getOpenedAt())
                .build();
    }

    private BigDecimal marginFor(BigDecimal quantity, BigDecimal price) {
        return quantity.multiply(price).divide(leverage, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal withSlippage(BigDecimal price, TradeAction action) {
        BigDecimal adjustment = SLIPPAGE_RATE.add(SPREAD);
        BigDecimal factor = action == TradeAction.BUY ? BigDecimal.ONE.add(adjustment) : BigDecimal.ONE.subtract(adjustment);
        return price.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private OrderResult rejected(String clientOrderId, String message) {
        return OrderResult.builder()
                .clientOrderId(clientOrderId)
                .status(OrderStatus.REJECTED)
                .filledQuantity(BigDecimal.ZERO)
                .message(message)
                .build();
    }
}
