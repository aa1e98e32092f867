package com.orderbook.engine.book;

import com.orderbook.common.LatencyStats;
import com.orderbook.common.OrderbookConfig;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.RejectReason;
import com.orderbook.protocol.Side;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Limit order book for a single instrument with price-time priority matching.
 *
 * Data structures:
 *   - bids: TreeMap<Long, PriceLevel> ascending (best bid = lastKey(), highest price)
 *   - asks: TreeMap<Long, PriceLevel> ascending (best ask = firstKey(), lowest price)
 *   - orders: Long2ObjectOpenHashMap id -> OrderEntry, the entry doubles as the
 *     O(1) removal handle into its level's linked list
 *
 * After every add the book is matched until best bid < best ask, so no crossed
 * state is ever visible between calls. Emptied levels are dropped immediately and
 * recycled through a {@link PriceLevelPool}.
 *
 * Not thread-safe. Callers must serialise every public call, matching included.
 */
public final class Orderbook {

    /**
     * Observer of book events, invoked synchronously from the calling thread.
     * {@code onAccepted}/{@code onRejected} tell an accepted order that matched
     * nothing apart from a rejected one, which the returned trade list cannot.
     */
    public interface Listener {

        Listener NONE = new Listener() {};

        default void onAccepted(Order order) {}

        default void onRejected(Order order, RejectReason reason) {}

        default void onTrade(Trade trade) {}

        /** Explicit cancels, modify replacements and swept fill-and-kill remainders. */
        default void onCanceled(Order order) {}
    }

    private static final Logger log = LoggerFactory.getLogger(Orderbook.class);

    private final TreeMap<Long, PriceLevel> bids = new TreeMap<>(); // price -> level
    private final TreeMap<Long, PriceLevel> asks = new TreeMap<>(); // price -> level

    private final Long2ObjectOpenHashMap<OrderEntry> orders;
    private final PriceLevelPool levelPool;
    private final Listener listener;
    private final LatencyStats latency; // null unless trackLatency

    public Orderbook() {
        this(OrderbookConfig.defaults(), Listener.NONE);
    }

    public Orderbook(Listener listener) {
        this(OrderbookConfig.defaults(), listener);
    }

    public Orderbook(OrderbookConfig cfg, Listener listener) {
        cfg.validate();
        this.orders = new Long2ObjectOpenHashMap<>(cfg.orderIndexCapacity);
        this.levelPool = new PriceLevelPool(cfg.levelPoolCapacity);
        this.listener = listener != null ? listener : Listener.NONE;
        this.latency = cfg.trackLatency ? new LatencyStats("orderbook") : null;
        log.info("Orderbook created: {}", cfg);
    }

    /**
     * Submit a new order and match it.
     * A duplicate id, or a fill-and-kill order with nothing to trade against, is
     * rejected without touching the book.
     *
     * @return trades produced by this submission, oldest first; empty if none
     */
    public List<Trade> addOrder(Order order) {
        long start = latency != null ? System.nanoTime() : 0L;
        List<Trade> trades = submit(order);
        if (latency != null) latency.record(System.nanoTime() - start);
        return trades;
    }

    /** Cancel a resting order. Returns true if found and cancelled. */
    public boolean cancelOrder(long orderId) {
        OrderEntry e = orders.get(orderId);
        if (e == null) {
            log.debug("Cancel ignored, order {} not resting", Long.toUnsignedString(orderId));
            return false;
        }
        PriceLevel level = e.level;
        unlink(e);
        if (level.isEmpty()) {
            dropLevel(e.order.side(), level);
        }
        log.debug("Cancelled {}", e.order);
        listener.onCanceled(e.order);
        return true;
    }

    /**
     * Replace a resting order: cancel it, then submit {@code modify} as a new order
     * of the same type. The replacement queues behind every order already at its
     * price, even when the price is unchanged.
     *
     * @return trades produced by the replacement; empty if the id is not resting
     */
    public List<Trade> modifyOrder(OrderModify modify) {
        long start = latency != null ? System.nanoTime() : 0L;
        OrderEntry existing = orders.get(modify.orderId());
        if (existing == null) {
            log.debug("Modify ignored, order {} not resting", Long.toUnsignedString(modify.orderId()));
            return List.of();
        }
        // Build the replacement first so an invalid request leaves the original resting
        Order replacement = modify.toOrder(existing.order.orderType());
        cancelOrder(modify.orderId());
        List<Trade> trades = submit(replacement);
        if (latency != null) latency.record(System.nanoTime() - start);
        return trades;
    }

    public int size() { return orders.size(); }

    public boolean contains(long orderId) { return orders.containsKey(orderId); }

    /** Depth per occupied price, bids best first and asks best first. */
    public OrderbookLevelInfos getLevelInfos() {
        List<LevelInfo> bidInfos = new ArrayList<>(bids.size());
        List<LevelInfo> askInfos = new ArrayList<>(asks.size());
        for (PriceLevel level : bids.descendingMap().values()) {
            bidInfos.add(new LevelInfo(level.price, level.totalQty));
        }
        for (PriceLevel level : asks.values()) {
            askInfos.add(new LevelInfo(level.price, level.totalQty));
        }
        return new OrderbookLevelInfos(bidInfos, askInfos);
    }

    /**
     * True if an order on {@code side} at {@code price} would cross the opposite
     * side's best level right now.
     */
    public boolean canMatch(Side side, long price) {
        if (side == Side.BUY) {
            return !asks.isEmpty() && price >= asks.firstKey();
        }
        return !bids.isEmpty() && price <= bids.lastKey();
    }

    public long bestBid() { return bids.isEmpty() ? Long.MIN_VALUE : bids.lastKey(); }
    public long bestAsk() { return asks.isEmpty() ? Long.MAX_VALUE : asks.firstKey(); }

    public int bidLevels() { return bids.size(); }
    public int askLevels() { return asks.size(); }

    /** Null unless the book was configured with trackLatency. */
    public LatencyStats latencyStats() { return latency; }

    // Orders reachable by walking the levels; always equal to size()
    int levelOrderCount() {
        int count = 0;
        for (PriceLevel level : bids.values()) count += level.orderCount;
        for (PriceLevel level : asks.values()) count += level.orderCount;
        return count;
    }

    private List<Trade> submit(Order order) {
        if (orders.containsKey(order.orderId())) {
            reject(order, RejectReason.DUPLICATE_ORDER_ID);
            return List.of();
        }
        if (!order.orderType().mayRest() && !canMatch(order.side(), order.price())) {
            reject(order, RejectReason.FILL_AND_KILL_UNMATCHED);
            return List.of();
        }

        OrderEntry e = new OrderEntry(order);
        restOrder(e);
        orders.put(order.orderId(), e);
        listener.onAccepted(order);

        return matchOrders();
    }

    private void reject(Order order, RejectReason reason) {
        log.debug("Rejected {}: {}", order, reason);
        listener.onRejected(order, reason);
    }

    private void restOrder(OrderEntry e) {
        TreeMap<Long, PriceLevel> book = e.order.side() == Side.BUY ? bids : asks;
        PriceLevel level = book.get(e.order.price());
        if (level == null) {
            level = levelPool.borrow(e.order.price());
            book.put(e.order.price(), level);
        }
        level.addOrder(e);
    }

    private List<Trade> matchOrders() {
        List<Trade> trades = new ArrayList<>();

        while (!bids.isEmpty() && !asks.isEmpty()) {
            PriceLevel bidLevel = bids.lastEntry().getValue();
            PriceLevel askLevel = asks.firstEntry().getValue();
            if (bidLevel.price < askLevel.price) break; // no cross

            while (!bidLevel.isEmpty() && !askLevel.isEmpty()) {
                OrderEntry bid = bidLevel.head;
                OrderEntry ask = askLevel.head;
                long qty = Math.min(bid.order.remainingQuantity(), ask.order.remainingQuantity());

                bidLevel.fill(bid, qty);
                askLevel.fill(ask, qty);

                Trade trade = new Trade(
                        new TradeInfo(bid.order.orderId(), bid.order.price(), qty),
                        new TradeInfo(ask.order.orderId(), ask.order.price(), qty));
                trades.add(trade);
                log.trace("Trade {}", trade);
                listener.onTrade(trade);

                if (bid.order.isFilled()) unlink(bid);
                if (ask.order.isFilled()) unlink(ask);
            }

            if (bidLevel.isEmpty()) dropLevel(Side.BUY, bidLevel);
            if (askLevel.isEmpty()) dropLevel(Side.SELL, askLevel);
        }

        // A fill-and-kill left at the front of either side could not trade further
        cancelFillAndKillAtFront(bids.lastEntry());
        cancelFillAndKillAtFront(asks.firstEntry());

        return trades;
    }

    private void cancelFillAndKillAtFront(Map.Entry<Long, PriceLevel> best) {
        if (best == null) return;
        Order front = best.getValue().head.order;
        if (front.orderType() == OrderType.FILL_AND_KILL) {
            cancelOrder(front.orderId());
        }
    }

    // Removes from the level and the index together; the caller drops the level if it emptied
    private void unlink(OrderEntry e) {
        e.level.removeOrder(e);
        orders.remove(e.order.orderId());
    }

    private void dropLevel(Side side, PriceLevel level) {
        TreeMap<Long, PriceLevel> book = side == Side.BUY ? bids : asks;
        book.remove(level.price);
        levelPool.release(level);
    }
}
