package com.clob.core;

import org.agrona.collections.Long2ObjectHashMap;

/**
 * Order records by id. The single source of truth for order fields.
 */
public class OrderTable {

    private final Long2ObjectHashMap<Order> orders = new Long2ObjectHashMap<>();

    public void create(Order order) {
        if (order.id == PriceLevelQueue.EMPTY) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_DOES_NOT_EXIST, "id 0 is reserved");
        }
        if (orders.containsKey(order.id)) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_ALREADY_EXISTS, "id " + order.id);
        }
        orders.put(order.id, order);
    }

    /**
     * @return The live, mutable record.
     * @throws OrderBookException ORDER_ID_DOES_NOT_EXIST
     */
    public Order get(long id) {
        Order order = orders.get(id);
        if (order == null) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_DOES_NOT_EXIST, "id " + id);
        }
        return order;
    }

    public Order delete(long id) {
        Order order = orders.remove(id);
        if (order == null) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_DOES_NOT_EXIST, "id " + id);
        }
        return order;
    }

    public boolean exists(long id) {
        return orders.containsKey(id);
    }

    public int size() {
        return orders.size();
    }
}
