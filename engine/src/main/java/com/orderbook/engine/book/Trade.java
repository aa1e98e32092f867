package com.orderbook.engine.book;

import java.util.Objects;

/**
 * A single match between the front bid and the front ask.
 * Both legs carry the same quantity; each leg reports its own order's limit price.
 */
public record Trade(TradeInfo bidTrade, TradeInfo askTrade) {

    public Trade {
        Objects.requireNonNull(bidTrade, "bidTrade");
        Objects.requireNonNull(askTrade, "askTrade");
    }

    public long quantity() {
        return bidTrade.quantity();
    }
}
