package com.clob.core;

/**
 * Produces the identifier of a new order. Ids must be non-zero and must not
 * repeat for the lifetime of a book.
 */
public interface OrderIdGenerator {

    long nextId(long owner, byte side, long price, long timestamp);
}
