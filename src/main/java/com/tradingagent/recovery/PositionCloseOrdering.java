package com.tradingagent.recovery;

import com.tradingagent.domain.model.Position;
import java.time.Instant;
import java.util.Comparator;

/**
 * Order in which recovery closes excess positions: worst unrealised P&L first, then the
 * oldest position, then asset pair alphabetically. Missing values sort last.
 */
public final class PositionCloseOrdering {

    public static final Comparator<Position> CLOSE_PRIORITY = Comparator.comparing(
                    Position::getUnrealizedPnlOrZero)
            .thenComparing(Position::getOpenedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(Position::getAssetPair, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private PositionCloseOrdering() {}
}
