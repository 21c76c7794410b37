package com.clob.core;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic on prices and amounts.
 * <p>
 * Products are taken in {@link BigInteger} so that {@code quantity * price}
 * cannot wrap; division truncates toward zero. A result that does not fit a
 * {@code long} is rejected as {@code AMOUNT_OVERFLOW}.
 * </p>
 */
public final class FixedPoint {

    private static final BigInteger BPS = BigInteger.valueOf(EngineConfig.BPS_DENOMINATOR);

    private FixedPoint() {
    }

    /**
     * @return {@code quantity * price / precision}, truncated.
     */
    public static long quoteAmount(long quantity, long price, long precision) {
        BigInteger product = BigInteger.valueOf(quantity).multiply(BigInteger.valueOf(price));
        return narrow(product.divide(BigInteger.valueOf(precision)), "quote amount of " + quantity + " @ " + price);
    }

    /**
     * @return {@code amount * feeBps / 10000}, truncated.
     */
    public static long fee(long amount, int feeBps) {
        if (feeBps == 0) {
            return 0;
        }
        BigInteger product = BigInteger.valueOf(amount).multiply(BigInteger.valueOf(feeBps));
        return narrow(product.divide(BPS), "fee on " + amount);
    }

    private static long narrow(BigInteger value, String what) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new OrderBookException(OrderBookException.Reason.AMOUNT_OVERFLOW, what, e);
        }
    }
}
