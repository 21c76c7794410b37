package com.clob.core;

import com.clob.api.OrderStatus;
import com.clob.api.Side;

/**
 * The resting order record. The {@link OrderTable} holds the only live copy;
 * everything else (price queues, owner registry) refers to it by id.
 * <p>
 * Invariant while stored: {@code 0 < availableQuantity <= originalQuantity}.
 * </p>
 */
public class Order {
    public long id;
    public long owner;
    public byte side; // 0=Buy, 1=Sell
    public long price;
    public long originalQuantity;
    public long availableQuantity;
    public long timestamp;
    public long expiresAt; // 0 = never, stored only
    public long lockedAmount; // still held in escrow: quote for a buy, base for a sell
    public byte status = OrderStatus.CREATED;

    public Order copy() {
        Order copy = new Order();
        copy.id = id;
        copy.owner = owner;
        copy.side = side;
        copy.price = price;
        copy.originalQuantity = originalQuantity;
        copy.availableQuantity = availableQuantity;
        copy.timestamp = timestamp;
        copy.expiresAt = expiresAt;
        copy.lockedAmount = lockedAmount;
        copy.status = status;
        return copy;
    }

    public long filledQuantity() {
        return originalQuantity - availableQuantity;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", owner=" + owner +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", available=" + availableQuantity +
                "/" + originalQuantity +
                ", status=" + OrderStatus.name(status) +
                '}';
    }
}
