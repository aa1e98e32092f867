package com.orderbook.protocol;

public enum OrderType {
    GOOD_TILL_CANCEL,  // rests until filled or cancelled
    FILL_AND_KILL;     // trades on arrival, never rests

    public boolean mayRest() {
        return this == GOOD_TILL_CANCEL;
    }
}
