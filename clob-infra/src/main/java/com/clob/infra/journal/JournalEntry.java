package com.clob.infra.journal;

import com.clob.api.Side;

/**
 * One domain event as read back from the journal.
 */
public final class JournalEntry {
    public static final String CREATED = "CREATED";
    public static final String FILLED = "FILLED";
    public static final String PARTIALLY_FILLED = "PARTIALLY_FILLED";
    public static final String CANCELED = "CANCELED";

    public final String type;
    public final long orderId;
    public final long owner;
    public final long counterparty; // 0 for CREATED / CANCELED
    public final byte side;
    public final long price;
    public final long quantity;

    public JournalEntry(String type, long orderId, long owner, long counterparty, byte side, long price,
            long quantity) {
        this.type = type;
        this.orderId = orderId;
        this.owner = owner;
        this.counterparty = counterparty;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
    }

    @Override
    public String toString() {
        return "JournalEntry{" +
                "type=" + type +
                ", orderId=" + orderId +
                ", owner=" + owner +
                ", counterparty=" + counterparty +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", quantity=" + quantity +
                '}';
    }
}
