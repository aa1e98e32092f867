package com.orderbook.protocol;

/**
 * Why a submission was turned away without touching the book.
 */
public enum RejectReason {
    DUPLICATE_ORDER_ID,
    FILL_AND_KILL_UNMATCHED
}
