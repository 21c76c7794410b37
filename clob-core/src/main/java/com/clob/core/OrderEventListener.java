package com.clob.core;

/**
 * Domain events of the matching core, emitted once a submit or cancel has
 * fully applied. A failed call emits nothing.
 * <p>
 * {@code counterparty} is the owner of the other order in the fill.
 * </p>
 */
public interface OrderEventListener {

    void onOrderCreated(long orderId, long owner, byte side, long price, long quantity);

    void onOrderFilled(long orderId, long owner, long counterparty, byte side, long price, long quantity);

    void onOrderPartiallyFilled(long orderId, long owner, long counterparty, byte side, long price, long quantity);

    void onOrderCanceled(long orderId, long owner, byte side, long price, long remainingQuantity);

    OrderEventListener NO_OP = new OrderEventListener() {
        @Override
        public void onOrderCreated(long orderId, long owner, byte side, long price, long quantity) {
        }

        @Override
        public void onOrderFilled(long orderId, long owner, long counterparty, byte side, long price, long quantity) {
        }

        @Override
        public void onOrderPartiallyFilled(long orderId, long owner, long counterparty, byte side, long price,
                long quantity) {
        }

        @Override
        public void onOrderCanceled(long orderId, long owner, byte side, long price, long remainingQuantity) {
        }
    };
}
