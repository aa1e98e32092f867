package com.orderbook.engine.book;

/**
 * Doubly-linked list of orders at a single price.
 * Head = oldest (first to match). Tail = newest.
 * totalQty tracks the sum of remaining quantity of every linked entry.
 */
final class PriceLevel {

    long price;
    long totalQty;
    int orderCount;
    OrderEntry head;
    OrderEntry tail;

    void reset() {
        price = 0;
        totalQty = 0;
        orderCount = 0;
        head = null;
        tail = null;
    }

    void addOrder(OrderEntry e) {
        if (e.isLinked()) {
            throw new IllegalStateException("Entry already resting at " + e.level.price + ": " + e.order);
        }
        e.level = this;
        e.prev = tail;
        e.next = null;
        if (tail != null) tail.next = e;
        tail = e;
        if (head == null) head = e;
        totalQty += e.order.remainingQuantity();
        orderCount++;
    }

    void removeOrder(OrderEntry e) {
        if (e.level != this) {
            throw new IllegalStateException("Entry does not rest at " + price + ": " + e.order);
        }
        if (e.prev != null) e.prev.next = e.next;
        else head = e.next;
        if (e.next != null) e.next.prev = e.prev;
        else tail = e.prev;
        totalQty -= e.order.remainingQuantity();
        orderCount--;
        e.prev = null;
        e.next = null;
        e.level = null;
    }

    /** Fill a linked entry, keeping the level total in step. */
    void fill(OrderEntry e, long qty) {
        e.order.fill(qty);
        totalQty -= qty;
    }

    boolean isEmpty() { return head == null; }
}
