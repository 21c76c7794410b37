package com.clob.infra.journal;

import com.clob.core.OrderEventListener;
import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.ExcerptTailer;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;

import java.util.function.Consumer;

/**
 * <b>Chronicle Event Journal: the audit trail.</b>
 * <p>
 * Appends every domain event of the engine to a memory-mapped Chronicle Queue
 * as a self-describing document, and replays them in order.
 * </p>
 * <p>
 * Appending happens on the engine thread, inside the call that produced the
 * event.
 * </p>
 */
public class ChronicleEventJournal implements OrderEventListener, AutoCloseable {

    private final ChronicleQueue queue;

    public ChronicleEventJournal(String path) {
        this.queue = SingleChronicleQueueBuilder.binary(path).build();
    }

    @Override
    public void onOrderCreated(long orderId, long owner, byte side, long price, long quantity) {
        append(JournalEntry.CREATED, orderId, owner, 0, side, price, quantity);
    }

    @Override
    public void onOrderFilled(long orderId, long owner, long counterparty, byte side, long price, long quantity) {
        append(JournalEntry.FILLED, orderId, owner, counterparty, side, price, quantity);
    }

    @Override
    public void onOrderPartiallyFilled(long orderId, long owner, long counterparty, byte side, long price,
            long quantity) {
        append(JournalEntry.PARTIALLY_FILLED, orderId, owner, counterparty, side, price, quantity);
    }

    @Override
    public void onOrderCanceled(long orderId, long owner, byte side, long price, long remainingQuantity) {
        append(JournalEntry.CANCELED, orderId, owner, 0, side, price, remainingQuantity);
    }

    private void append(String type, long orderId, long owner, long counterparty, byte side, long price,
            long quantity) {
        // Appenders are bound to the acquiring thread
        queue.acquireAppender().writeDocument(w -> w.write("type").text(type)
                .write("orderId").int64(orderId)
                .write("owner").int64(owner)
                .write("counterparty").int64(counterparty)
                .write("side").int8(side)
                .write("price").int64(price)
                .write("qty").int64(quantity));
    }

    /**
     * Reads every entry from the start of the journal.
     *
     * @return The number of entries read.
     */
    public int replay(Consumer<JournalEntry> consumer) {
        ExcerptTailer tailer = queue.createTailer();
        int count = 0;
        while (tailer.readDocument(w -> consumer.accept(new JournalEntry(
                w.read("type").text(),
                w.read("orderId").int64(),
                w.read("owner").int64(),
                w.read("counterparty").int64(),
                w.read("side").int8(),
                w.read("price").int64(),
                w.read("qty").int64())))) {
            count++;
        }
        return count;
    }

    @Override
    public void close() {
        queue.close();
    }
}
