package com.orderbook.engine.book;

import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;

import java.util.Objects;

/**
 * One participant's limit order and its fill progress.
 * Identity, side, type and price are fixed at construction; only {@link #fill(long)}
 * mutates the order. Once submitted to an {@link Orderbook} the book owns it.
 */
public final class Order {

    private final long orderId;        // compared as unsigned 64-bit
    private final OrderType orderType;
    private final Side side;
    private final long price;          // ticks, may be negative
    private final long initialQuantity;
    private long remainingQuantity;

    public Order(OrderType orderType, long orderId, Side side, long price, long quantity) {
        this.orderType = Objects.requireNonNull(orderType, "orderType");
        this.side = Objects.requireNonNull(side, "side");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order (" + Long.toUnsignedString(orderId)
                    + ") quantity must be positive: " + quantity);
        }
        this.orderId = orderId;
        this.price = price;
        this.initialQuantity = quantity;
        this.remainingQuantity = quantity;
    }

    /**
     * Reduce the remaining quantity.
     * Asking for more than remains is a matching defect and fails immediately.
     */
    public void fill(long quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Fill quantity must not be negative: " + quantity);
        }
        if (quantity > remainingQuantity) {
            throw new IllegalStateException("Order (" + Long.toUnsignedString(orderId)
                    + ") cannot be filled for more than its remaining quantity: requested="
                    + quantity + " remaining=" + remainingQuantity);
        }
        remainingQuantity -= quantity;
    }

    public boolean isFilled() { return remainingQuantity == 0; }

    public long orderId() { return orderId; }
    public OrderType orderType() { return orderType; }
    public Side side() { return side; }
    public long price() { return price; }
    public long initialQuantity() { return initialQuantity; }
    public long remainingQuantity() { return remainingQuantity; }
    public long filledQuantity() { return initialQuantity - remainingQuantity; }

    @Override
    public String toString() {
        return "Order{id=" + Long.toUnsignedString(orderId)
                + ", type=" + orderType
                + ", side=" + side
                + ", price=" + price
                + ", remaining=" + remainingQuantity + '/' + initialQuantity + '}';
    }
}
