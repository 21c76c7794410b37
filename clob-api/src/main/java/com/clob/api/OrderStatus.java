package com.clob.api;

/**
 * Lifecycle status of an order.
 * <p>
 * Only {@link #CREATED} and {@link #PARTIALLY_FILLED} are ever observed on a
 * resting order. {@link #FILLED} and {@link #CANCELED} are terminal and are
 * reported through events; the order has left every index by then.
 * </p>
 */
public final class OrderStatus {
    public static final byte CREATED = 0;
    public static final byte PARTIALLY_FILLED = 1;
    public static final byte FILLED = 2;
    public static final byte CANCELED = 3;

    private OrderStatus() {
    }

    public static String name(byte status) {
        switch (status) {
            case CREATED:
                return "CREATED";
            case PARTIALLY_FILLED:
                return "PARTIALLY_FILLED";
            case FILLED:
                return "FILLED";
            case CANCELED:
                return "CANCELED";
            default:
                return "UNKNOWN(" + status + ")";
        }
    }
}
