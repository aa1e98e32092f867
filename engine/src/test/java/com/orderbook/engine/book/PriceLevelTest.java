package com.orderbook.engine.book;

import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceLevelTest {

    private static OrderEntry entry(long id, long qty) {
        return new OrderEntry(new Order(OrderType.GOOD_TILL_CANCEL, id, Side.BUY, 100, qty));
    }

    @Test
    void testFifoLinksAndTotals() {
        PriceLevel level = new PriceLevel();
        level.price = 100;
        OrderEntry a = entry(1, 5);
        OrderEntry b = entry(2, 7);
        OrderEntry c = entry(3, 1);

        level.addOrder(a);
        level.addOrder(b);
        level.addOrder(c);

        assertSame(a, level.head);
        assertSame(c, level.tail);
        assertSame(b, a.next);
        assertSame(a, b.prev);
        assertEquals(13, level.totalQty);
        assertEquals(3, level.orderCount);
        assertSame(level, b.level);
    }

    @Test
    void testRemoveFromMiddleHeadAndTail() {
        PriceLevel level = new PriceLevel();
        OrderEntry a = entry(1, 5);
        OrderEntry b = entry(2, 7);
        OrderEntry c = entry(3, 1);
        level.addOrder(a);
        level.addOrder(b);
        level.addOrder(c);

        level.removeOrder(b);
        assertSame(c, a.next);
        assertSame(a, c.prev);
        assertNull(b.level);
        assertFalse(b.isLinked());
        assertEquals(6, level.totalQty);

        level.removeOrder(a);
        assertSame(c, level.head);
        level.removeOrder(c);
        assertTrue(level.isEmpty());
        assertNull(level.tail);
        assertEquals(0, level.totalQty);
        assertEquals(0, level.orderCount);
    }

    @Test
    void testFillKeepsTotalInStep() {
        PriceLevel level = new PriceLevel();
        OrderEntry a = entry(1, 5);
        level.addOrder(a);

        level.fill(a, 3);

        assertEquals(2, level.totalQty);
        assertEquals(2, a.order.remainingQuantity());
        assertThrows(IllegalStateException.class, () -> level.fill(a, 3));
        assertEquals(2, level.totalQty);
    }

    @Test
    void testEntryCannotRestTwiceOrLeaveForeignLevel() {
        PriceLevel one = new PriceLevel();
        PriceLevel two = new PriceLevel();
        OrderEntry a = entry(1, 5);
        one.addOrder(a);

        assertThrows(IllegalStateException.class, () -> two.addOrder(a));
        assertThrows(IllegalStateException.class, () -> two.removeOrder(a));
    }

    @Test
    void testPoolRecyclesUpToCapacity() {
        PriceLevelPool pool = new PriceLevelPool(1);
        PriceLevel first = pool.borrow(100);
        PriceLevel second = pool.borrow(101);
        assertEquals(100, first.price);
        assertEquals(101, second.price);

        first.addOrder(entry(1, 5));
        pool.release(first);
        pool.release(second);
        assertEquals(1, pool.idle(), "Extra level dropped once the pool is full");

        PriceLevel reused = pool.borrow(102);
        assertSame(first, reused);
        assertEquals(102, reused.price);
        assertTrue(reused.isEmpty());
        assertEquals(0, reused.totalQty);
        assertEquals(0, pool.idle());
    }
}
