package com.orderbook.protocol;

public enum Side {
    BUY, SELL
}
