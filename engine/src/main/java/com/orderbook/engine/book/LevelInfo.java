package com.orderbook.engine.book;

/** Aggregate remaining quantity resting at one price. */
public record LevelInfo(long price, long quantity) {}
