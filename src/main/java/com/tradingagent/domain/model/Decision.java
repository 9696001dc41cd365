package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A proposed trading action produced by the decision provider.
 *
 * <p>{@code marketDataCollectedAt} is the {@code collectedAt} of the snapshot the decision was
 * derived from. The risk gatekeeper checks freshness against it, never against {@code createdAt}.
 */
@Value
@Builder(toBuilder = true)
public class Decision {

    String id;
    String assetPair;
    TradeAction action;

    /** 0..1 */
    double confidence;

    /** Optional; when null the position sizer computes one from the account balance. */
    BigDecimal recommendedSize;

    /** Optional stop-loss distance as a fraction of entry price. */
    BigDecimal stopLossPct;

    BigDecimal entryPrice;

    /** Providers that contributed to this decision. Learning credits or debits them. */
    List<String> providers;

    String reasoning;
    Instant marketDataCollectedAt;
    Instant createdAt;

    public boolean isHold() {
        return action == TradeAction.HOLD;
    }
}
