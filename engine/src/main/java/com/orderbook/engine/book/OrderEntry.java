package com.orderbook.engine.book;

/**
 * Node of a {@link PriceLevel}'s intrusive doubly-linked list, and the handle the
 * order index keeps for O(1) removal. Links are cleared when the entry leaves its level.
 */
final class OrderEntry {

    final Order order;

    OrderEntry prev;
    OrderEntry next;

    // Back-pointer to the level this entry rests in; null once unlinked
    PriceLevel level;

    OrderEntry(Order order) {
        this.order = order;
    }

    boolean isLinked() { return level != null; }
}
