package com.clob.core;

import com.clob.api.Side;
import org.agrona.collections.Long2ObjectHashMap;

/**
 * <h1>Book: One Side of the Market</h1>
 *
 * <p>
 * Pairs a {@link PriceIndex} with a map of price &rarr; {@link PriceLevel}.
 * </p>
 *
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose (Time Complexity)</th>
 * </tr>
 * <tr>
 * <td><b>Lookup</b></td>
 * <td>{@link org.agrona.collections.Long2ObjectHashMap}</td>
 * <td><b>O(1)</b> access to any price level for insertions and cancels.</td>
 * </tr>
 * <tr>
 * <td><b>Ordering</b></td>
 * <td>{@link PriceIndex}</td>
 * <td><b>O(log N)</b> best price and next best price.</td>
 * </tr>
 * </table>
 *
 * <p>
 * Invariant: a price is in the index if and only if its level queue is
 * non-empty. The best bid is the maximum key, the best ask the minimum key.
 * </p>
 * <p>
 * Not thread-safe. Only the {@link MatchingEngine} that owns the book mutates it.
 * </p>
 */
public class Book {

    private final byte side;
    private final PriceIndex index = new PriceIndex();
    private final Long2ObjectHashMap<PriceLevel> levels = new Long2ObjectHashMap<>();

    public Book(byte side) {
        if (!Side.isValid(side)) {
            throw new IllegalArgumentException("unknown side " + side);
        }
        this.side = side;
    }

    public byte side() {
        return side;
    }

    public void insert(long id, long price, long quantity) {
        ensureCapacity(price, quantity);
        index.insert(price);

        PriceLevel level = levels.get(price);
        if (level == null) {
            level = new PriceLevel(price);
            levels.put(price, level);
        }

        level.queue.push(id);
        level.orderCount += 1;
        level.orderValue += quantity;
    }

    /**
     * Checks that {@code quantity} more can rest at {@code price} without the
     * level value leaving the {@code long} range. Mutates nothing.
     *
     * @throws OrderBookException AMOUNT_OVERFLOW
     */
    public void ensureCapacity(long price, long quantity) {
        PriceLevel level = levels.get(price);
        if (level == null) {
            return;
        }
        try {
            Math.addExact(level.orderValue, quantity);
        } catch (ArithmeticException e) {
            throw new OrderBookException(OrderBookException.Reason.AMOUNT_OVERFLOW,
                    Side.name(side) + " level " + price + " cannot take " + quantity + " more", e);
        }
    }

    /**
     * Takes the order out of its level. Uses the order's current
     * {@code availableQuantity} to keep the level value in step.
     */
    public void remove(Order order) {
        PriceLevel level = requireLevel(order.price);

        if (level.orderCount <= 0 || level.orderValue < order.availableQuantity) {
            throw new IllegalStateException("level aggregates out of step at " + level + " removing " + order);
        }
        level.orderCount -= 1;
        level.orderValue -= order.availableQuantity;
        level.queue.remove(order.id);

        if (level.queue.isEmpty()) {
            index.remove(order.price);
            levels.remove(order.price);
        }
    }

    /**
     * Records that {@code delta} was consumed from an order that stays in the book.
     */
    public void update(long price, long delta) {
        PriceLevel level = requireLevel(price);
        if (level.orderValue < delta) {
            throw new IllegalStateException("level value underflow at " + level + " consuming " + delta);
        }
        level.orderValue -= delta;
    }

    /**
     * @return Best Bid (max) or Best Ask (min), or {@link PriceIndex#EMPTY}.
     */
    public long bestPrice() {
        return side == Side.BUY ? index.max() : index.min();
    }

    /**
     * @return The next price after {@code price} walking away from the best
     *         price, or {@link PriceIndex#EMPTY}.
     */
    public long nextPrice(long price) {
        return side == Side.BUY ? index.predecessor(price) : index.successor(price);
    }

    /**
     * @return The oldest order id at {@code price}, or {@link PriceLevelQueue#EMPTY}.
     */
    public long nextOrderIdAtPrice(long price) {
        PriceLevel level = levels.get(price);
        return level == null ? PriceLevelQueue.EMPTY : level.queue.head();
    }

    /**
     * @return The id queued behind {@code id} at {@code price}, or {@link PriceLevelQueue#EMPTY}.
     */
    public long orderIdAfter(long price, long id) {
        return requireLevel(price).queue.next(id);
    }

    public long[] top3Prices() {
        return topPrices(3);
    }

    /**
     * Walks {@code n} steps from the best price; missing prices are 0.
     */
    public long[] topPrices(int n) {
        long[] prices = new long[n];
        long price = bestPrice();
        for (int i = 0; i < n && price != PriceIndex.EMPTY; i++) {
            prices[i] = price;
            price = nextPrice(price);
        }
        return prices;
    }

    /**
     * @return Up to {@code n} levels from the best price, with their aggregates.
     */
    public LevelStats[] depth(int n) {
        long[] prices = topPrices(n);
        int count = 0;
        while (count < n && prices[count] != PriceIndex.EMPTY) {
            count++;
        }
        LevelStats[] depth = new LevelStats[count];
        for (int i = 0; i < count; i++) {
            depth[i] = levelStats(prices[i]);
        }
        return depth;
    }

    public LevelStats levelStats(long price) {
        PriceLevel level = levels.get(price);
        return level == null ? LevelStats.EMPTY : new LevelStats(price, level.orderCount, level.orderValue);
    }

    public boolean hasPrice(long price) {
        return index.exists(price);
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public int levelCount() {
        return levels.size();
    }

    /**
     * @return The level at {@code price}, or {@code null}. For inspection only.
     */
    public PriceLevel level(long price) {
        return levels.get(price);
    }

    private PriceLevel requireLevel(long price) {
        PriceLevel level = levels.get(price);
        if (level == null) {
            throw new OrderBookException(OrderBookException.Reason.PRICE_NOT_FOUND, Side.name(side) + " level " + price);
        }
        return level;
    }
}
