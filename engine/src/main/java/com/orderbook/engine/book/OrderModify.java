package com.orderbook.engine.book;

import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;

import java.util.Objects;

/**
 * Request to replace a resting order with a new side, price and quantity.
 * The replacement keeps the original order's type; see {@link Orderbook#modifyOrder(OrderModify)}.
 */
public record OrderModify(long orderId, Side side, long price, long quantity) {

    public OrderModify {
        Objects.requireNonNull(side, "side");
    }

    public Order toOrder(OrderType orderType) {
        return new Order(orderType, orderId, side, price, quantity);
    }
}
