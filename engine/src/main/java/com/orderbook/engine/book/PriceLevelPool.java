package com.orderbook.engine.book;

/**
 * Recycles emptied {@link PriceLevel}s so that re-occupying a price does not allocate.
 * Holds at most {@code capacity} idle levels; borrowing from an empty pool allocates.
 */
final class PriceLevelPool {
    private final PriceLevel[] pool;
    private int top;

    PriceLevelPool(int capacity) {
        pool = new PriceLevel[capacity];
    }

    PriceLevel borrow(long price) {
        PriceLevel pl;
        if (top == 0) {
            pl = new PriceLevel();
        } else {
            pl = pool[--top];
            pool[top] = null;
        }
        pl.reset();
        pl.price = price;
        return pl;
    }

    void release(PriceLevel pl) {
        pl.reset();
        if (top < pool.length) pool[top++] = pl;
    }

    int idle() { return top; }
}
