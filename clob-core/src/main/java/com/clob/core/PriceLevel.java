package com.clob.core;

/**
 * <b>The Price Level</b>
 * <p>
 * All resting orders at one exact price on one side: the FIFO of their ids
 * and two running aggregates kept in step with every queue mutation, so
 * depth-of-market questions are answered in O(1).
 * </p>
 */
public class PriceLevel {
    public final long price;
    public final PriceLevelQueue queue = new PriceLevelQueue();
    public long orderCount;
    public long orderValue; // sum of availableQuantity over the queue

    public PriceLevel(long price) {
        this.price = price;
    }

    @Override
    public String toString() {
        return "PriceLevel{" +
                "price=" + price +
                ", orderCount=" + orderCount +
                ", orderValue=" + orderValue +
                '}';
    }
}
