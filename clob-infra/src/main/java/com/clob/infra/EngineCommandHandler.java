package com.clob.infra;

import com.clob.core.MatchingEngine;
import com.clob.core.OrderBookException;
import com.lmax.disruptor.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * The single consumer of the ring buffer. Applies each command to the
 * engine and completes the caller's future.
 * <p>
 * A rejection ({@link OrderBookException}, bad arguments, a failing query)
 * fails only its own command. Any other exception thrown by submit or cancel
 * means the book can no longer be trusted: the handler halts and fails every
 * later command.
 * </p>
 */
public class EngineCommandHandler implements EventHandler<EngineCommand> {

    private static final Logger log = LoggerFactory.getLogger(EngineCommandHandler.class);

    private final MatchingEngine matchingEngine;
    private volatile RuntimeException haltCause;

    public EngineCommandHandler(MatchingEngine matchingEngine) {
        this.matchingEngine = matchingEngine;
    }

    @Override
    public void onEvent(EngineCommand event, long sequence, boolean endOfBatch) {
        CompletableFuture<Object> result = event.result;
        try {
            if (haltCause != null) {
                result.completeExceptionally(new IllegalStateException("engine halted", haltCause));
                return;
            }
            result.complete(execute(event));
        } catch (OrderBookException | IllegalArgumentException e) {
            result.completeExceptionally(e);
        } catch (RuntimeException e) {
            if (event.type == EngineCommand.QUERY) {
                // Queries never mutate the book
                result.completeExceptionally(e);
                return;
            }
            haltCause = e;
            log.error("Engine halted at sequence {} by an internal failure", sequence, e);
            result.completeExceptionally(e);
        } finally {
            event.reset();
        }
    }

    private Object execute(EngineCommand event) {
        switch (event.type) {
            case EngineCommand.SUBMIT:
                return matchingEngine.submit(event.owner, event.side, event.price, event.quantity,
                        event.timestamp, event.expiresAt);
            case EngineCommand.CANCEL:
                matchingEngine.cancel(event.orderId, event.owner);
                return null;
            case EngineCommand.QUERY:
                return event.query.apply(matchingEngine);
            default:
                throw new IllegalArgumentException("unknown command type " + event.type);
        }
    }

    public boolean isHalted() {
        return haltCause != null;
    }
}
