package com.clob.core;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content-derived order ids: SHA-256 over owner, side, price, timestamp and an
 * engine-local nonce, truncated to a positive {@code long}.
 * <p>
 * The nonce moves forward on every call, so resubmitting identical fields
 * after an order has left the book still yields a fresh id.
 * </p>
 */
public class HashingOrderIdGenerator implements OrderIdGenerator {

    private final MessageDigest digest;
    private final ByteBuffer input = ByteBuffer.allocate(8 + 1 + 8 + 8 + 8);
    private long nonce;

    public HashingOrderIdGenerator() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every JRE", e);
        }
    }

    @Override
    public long nextId(long owner, byte side, long price, long timestamp) {
        input.clear();
        input.putLong(owner).put(side).putLong(price).putLong(timestamp).putLong(++nonce);

        digest.reset();
        digest.update(input.array(), 0, input.position());
        long id = ByteBuffer.wrap(digest.digest()).getLong() & Long.MAX_VALUE;
        return id == 0 ? 1 : id;
    }
}
