package com.clob.core;

/**
 * Per-instrument engine settings. All fields have defaults usable for a
 * single local book.
 */
public final class EngineConfig {

    public static final long DEFAULT_PRECISION = 1_000_000_000_000_000_000L;
    public static final int DEFAULT_MAX_ORDERS_PER_MATCH = 1500;
    public static final int BPS_DENOMINATOR = 10_000;

    /** Fixed-point denominator shared by every price. */
    public long precision = DEFAULT_PRECISION;

    /** Fee taken from what the taker receives, in basis points. */
    public int feeBps = 0;

    /** Account holding the funds locked by resting orders. */
    public long escrowAccount = 0;

    /** Account receiving fees. */
    public long feeRecipient = 0;

    /** Upper bound on resting orders consumed by a single submit. */
    public int maxOrdersPerMatch = DEFAULT_MAX_ORDERS_PER_MATCH;

    public EngineConfig validate() {
        if (precision <= 0) {
            throw new IllegalArgumentException("precision must be positive: " + precision);
        }
        if (feeBps < 0 || feeBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("feeBps must be within 0.." + BPS_DENOMINATOR + ": " + feeBps);
        }
        if (maxOrdersPerMatch <= 0) {
            throw new IllegalArgumentException("maxOrdersPerMatch must be positive: " + maxOrdersPerMatch);
        }
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "precision=" + precision +
                ", feeBps=" + feeBps +
                ", escrowAccount=" + escrowAccount +
                ", feeRecipient=" + feeRecipient +
                ", maxOrdersPerMatch=" + maxOrdersPerMatch +
                '}';
    }
}
