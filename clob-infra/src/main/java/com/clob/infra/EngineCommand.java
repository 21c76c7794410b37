package com.clob.infra;

import com.clob.core.MatchingEngine;
import com.lmax.disruptor.EventFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Event wrapper for engine calls in the Ring Buffer.
 */
public class EngineCommand {
    public static final byte SUBMIT = 0;
    public static final byte CANCEL = 1;
    public static final byte QUERY = 2;

    public byte type;
    public long owner; // submitter, or caller of a cancel
    public byte side;
    public long price;
    public long quantity;
    public long timestamp;
    public long expiresAt;
    public long orderId;
    public Function<MatchingEngine, ?> query;
    public CompletableFuture<Object> result;

    public void reset() {
        type = 0;
        owner = 0;
        side = 0;
        price = 0;
        quantity = 0;
        timestamp = 0;
        expiresAt = 0;
        orderId = 0;
        query = null;
        result = null;
    }

    public final static EventFactory<EngineCommand> FACTORY = EngineCommand::new;
}
