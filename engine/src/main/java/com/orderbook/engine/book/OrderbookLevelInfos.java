package com.orderbook.engine.book;

import java.util.List;

/**
 * Read-only depth snapshot.
 * Bids are listed best (highest) first, asks best (lowest) first.
 */
public record OrderbookLevelInfos(List<LevelInfo> bids, List<LevelInfo> asks) {

    public OrderbookLevelInfos {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }
}
