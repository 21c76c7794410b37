package com.clob.core;

/**
 * Aggregates of one price level, as returned by depth queries.
 */
public final class LevelStats {

    public static final LevelStats EMPTY = new LevelStats(0, 0, 0);

    public final long price;
    public final long orderCount;
    public final long totalValue;

    public LevelStats(long price, long orderCount, long totalValue) {
        this.price = price;
        this.orderCount = orderCount;
        this.totalValue = totalValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LevelStats)) return false;
        LevelStats that = (LevelStats) o;
        return price == that.price && orderCount == that.orderCount && totalValue == that.totalValue;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(price);
        result = 31 * result + Long.hashCode(orderCount);
        return 31 * result + Long.hashCode(totalValue);
    }

    @Override
    public String toString() {
        return "LevelStats{price=" + price + ", orderCount=" + orderCount + ", totalValue=" + totalValue + '}';
    }
}
