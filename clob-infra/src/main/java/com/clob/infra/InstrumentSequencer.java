package com.clob.infra;

import com.clob.api.Ledger;
import com.clob.core.MatchingEngine;
import com.clob.core.OrderEventListener;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * <b>The Instrument Sequencer: one writer per book.</b>
 * <p>
 * Serializes every call against one {@link MatchingEngine} through a
 * Disruptor ring buffer. Any number of threads may publish; a single consumer
 * thread ({@link EngineCommandHandler}) executes the commands one after the
 * other, so no two submits or cancels ever interleave.
 * </p>
 *
 * <pre>
 * [Caller threads] -- submit/cancel/query --> (Ring Buffer, MULTI producer)
 *                                                   |
 *                                                   v
 *                                   [EngineCommandHandler] -> MatchingEngine
 *                                                   |
 *                                                   v
 *                                        CompletableFuture per call
 * </pre>
 */
public class InstrumentSequencer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstrumentSequencer.class);

    private final Disruptor<EngineCommand> disruptor;
    private final RingBuffer<EngineCommand> ringBuffer;
    private final EngineCommandHandler handler;

    public InstrumentSequencer(ServerConfig config, Ledger ledger, OrderEventListener listener) {
        this(config, new MatchingEngine(config.engine, ledger, listener));
    }

    public InstrumentSequencer(ServerConfig config, MatchingEngine matchingEngine) {
        WaitStrategy waitStrategy = config.busySpin ? new BusySpinWaitStrategy() : new BlockingWaitStrategy();
        this.disruptor = new Disruptor<>(
                EngineCommand.FACTORY,
                config.ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                waitStrategy);

        this.handler = new EngineCommandHandler(matchingEngine);
        this.disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();

        log.info("Sequencer started: ringBufferSize={} busySpin={} {}", config.ringBufferSize, config.busySpin,
                config.engine);
    }

    public CompletableFuture<Long> submit(long owner, byte side, long price, long quantity, long timestamp) {
        return submit(owner, side, price, quantity, timestamp, 0);
    }

    public CompletableFuture<Long> submit(long owner, byte side, long price, long quantity, long timestamp,
            long expiresAt) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            EngineCommand cmd = ringBuffer.get(sequence);
            cmd.type = EngineCommand.SUBMIT;
            cmd.owner = owner;
            cmd.side = side;
            cmd.price = price;
            cmd.quantity = quantity;
            cmd.timestamp = timestamp;
            cmd.expiresAt = expiresAt;
            cmd.result = result;
        } finally {
            ringBuffer.publish(sequence);
        }
        return result.thenApply(Long.class::cast);
    }

    public CompletableFuture<Void> cancel(long orderId, long caller) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            EngineCommand cmd = ringBuffer.get(sequence);
            cmd.type = EngineCommand.CANCEL;
            cmd.orderId = orderId;
            cmd.owner = caller;
            cmd.result = result;
        } finally {
            ringBuffer.publish(sequence);
        }
        return result.thenApply(ignored -> null);
    }

    /**
     * Runs a read-only function on the engine thread, ordered with the
     * surrounding submits and cancels.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> query(Function<MatchingEngine, T> query) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            EngineCommand cmd = ringBuffer.get(sequence);
            cmd.type = EngineCommand.QUERY;
            cmd.query = query;
            cmd.result = result;
        } finally {
            ringBuffer.publish(sequence);
        }
        return result.thenApply(value -> (T) value);
    }

    public boolean isHalted() {
        return handler.isHalted();
    }

    /**
     * Drains the commands already published, then stops the consumer thread.
     */
    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Sequencer stopped");
    }
}
