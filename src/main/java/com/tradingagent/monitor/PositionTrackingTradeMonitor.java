package com.tradingagent.monitor;

import com.tradingagent.broker.TradingPlatformGateway;
import com.tradingagent.domain.model.ClosedTrade;
import com.tradingagent.domain.model.Position;
import com.tradingagent.resilience.CallPolicies;
import com.tradingagent.resilience.ExternalCallExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trade monitor that polls venue positions. A tracked pair that no longer has an open
 * position is reported as closed, with the last unrealised P&L seen as its result.
 *
 * <p>The trade belongs to the decision that opened the position. A later fill on the same pair
 * adds to, reduces or closes that position, so it does not take the attribution over. It is
 * kept as the successor instead, and becomes the tracked trade only if the position flips
 * direction, which means its fill opened a new one.
 *
 * <p>A venue read failure propagates as {@code CollaboratorUnavailableException}; tracked
 * trades are left untouched so the next drain sees them again.
 */
@Component
public class PositionTrackingTradeMonitor implements TradeMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionTrackingTradeMonitor.class);

    private final TradingPlatformGateway tradingPlatformGateway;
    private final ExternalCallExecutor externalCallExecutor;
    private final CallPolicies callPolicies;
    private final Clock clock;

    private final Map<String, TrackedTrade> trackedByPair = new ConcurrentHashMap<>();

    public PositionTrackingTradeMonitor(
            TradingPlatformGateway tradingPlatformGateway,
            ExternalCallExecutor externalCallExecutor,
            CallPolicies callPolicies,
            Clock clock) {
        this.tradingPlatformGateway = tradingPlatformGateway;
        this.externalCallExecutor = externalCallExecutor;
        this.callPolicies = callPolicies;
        this.clock = clock;
    }

    @Override
    public void associateDecision(String decisionId, String assetPair, List<String> providers) {
        TrackedTrade incoming = new TrackedTrade(decisionId, providers != null ? List.copyOf(providers) : List.of());
        TrackedTrade opener = trackedByPair.putIfAbsent(assetPair, incoming);
        if (opener != null && !opener.decisionId.equals(decisionId)) {
            opener.successor = incoming;
            log.info("{} stays attributed to decision {}; {} kept as successor", assetPair, opener.decisionId, decisionId);
        }
    }

    @Override
    public List<ClosedTrade> drainClosedTrades() {
        if (trackedByPair.isEmpty()) {
            return List.of();
        }

        List<Position> positions =
                externalCallExecutor.call(callPolicies.getVenueQuery(), tradingPlatformGateway::getPositions);
        Map<String, Position> openByPair = positions.stream()
                .filter(position -> !position.isFlat())
                .collect(Collectors.toMap(Position::getAssetPair, position -> position, (a, b) -> a));

        List<ClosedTrade> closed = new ArrayList<>();
        for (Map.Entry<String, TrackedTrade> entry : trackedByPair.entrySet()) {
            String assetPair = entry.getKey();
            TrackedTrade trade = entry.getValue();
            Position open = openByPair.get(assetPair);
            if (open == null) {
                if (trackedByPair.remove(assetPair, trade)) {
                    closed.add(close(trade, assetPair));
                }
                continue;
            }
            int direction = open.getQuantity().signum();
            if (trade.direction != 0 && direction != trade.direction && trade.successor != null) {
                TrackedTrade successor = trade.successor;
                if (trackedByPair.replace(assetPair, trade, successor)) {
                    closed.add(close(trade, assetPair));
                    trade = successor;
                }
            }
            trade.direction = direction;
            trade.lastUnrealizedPnl = open.getUnrealizedPnlOrZero();
        }
        return closed;
    }

    private ClosedTrade close(TrackedTrade trade, String assetPair) {
        log.info("Trade {} on {} closed, pnl={}", trade.decisionId, assetPair, trade.lastUnrealizedPnl);
        return ClosedTrade.builder()
                .decisionId(trade.decisionId)
                .assetPair(assetPair)
                .providers(trade.providers)
                .realizedPnl(trade.lastUnrealizedPnl)
                .closedAt(clock.instant())
                .build();
    }

    @Override
    public List<String> trackedPairs() {
        Set<String> pairs = trackedByPair.keySet();
        return pairs.stream().sorted().toList();
    }

    private static final class TrackedTrade {
        private final String decisionId;
        private final List<String> providers;
        private volatile BigDecimal lastUnrealizedPnl = BigDecimal.ZERO;
        private volatile int direction;
        private volatile TrackedTrade successor;

        private TrackedTrade(String decisionId, List<String> providers) {
            this.decisionId = decisionId;
            this.providers = providers;
        }
    }
}
