package com.orderbook.engine.book;

/** One leg of a trade: the order that took part, at its own price. */
public record TradeInfo(long orderId, long price, long quantity) {}
