package com.clob.api;

/**
 * The two assets of a trading pair. Quantities are denominated in BASE,
 * prices in QUOTE per unit of BASE.
 */
public enum Asset {
    BASE,
    QUOTE;

    /**
     * @return the asset an order of the given side locks while it rests.
     */
    public static Asset lockedBy(byte side) {
        return side == Side.BUY ? QUOTE : BASE;
    }
}
