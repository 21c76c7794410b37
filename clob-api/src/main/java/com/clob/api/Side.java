package com.clob.api;

/**
 * <b>Side: The Direction of the Order.</b>
 * <p>
 * Represents whether an order is a BUY (Bid) or a SELL (Ask).
 * </p>
 * <p>
 * Kept as primitive {@code byte} constants so that the order records, the
 * sequencer events and the journal all carry the side as a single byte.
 * </p>
 */
public final class Side {
    /** Buy Side (Bid) */
    public static final byte BUY = 0;

    /** Sell Side (Ask) */
    public static final byte SELL = 1;

    private Side() {
        // Prevent instantiation
    }

    public static byte opposite(byte side) {
        return side == BUY ? SELL : BUY;
    }

    public static boolean isValid(byte side) {
        return side == BUY || side == SELL;
    }

    public static String name(byte side) {
        return side == BUY ? "BUY" : side == SELL ? "SELL" : "UNKNOWN(" + side + ")";
    }
}
