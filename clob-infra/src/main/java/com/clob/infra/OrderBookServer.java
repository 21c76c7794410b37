package com.clob.infra;

import com.clob.api.Ledger;
import com.clob.infra.journal.ChronicleEventJournal;
import com.clob.infra.ledger.InMemoryLedger;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <b>The Order Book Server.</b>
 * <p>
 * Composition root for one instrument: wires the host's {@link Ledger}, the
 * {@link ChronicleEventJournal} audit trail and the
 * {@link InstrumentSequencer} around a fresh matching engine.
 * </p>
 *
 * <pre>
 * [Callers] --> InstrumentSequencer (Disruptor) --> MatchingEngine --> Ledger
 *                                                        |
 *                                                        v
 *                                           ChronicleEventJournal (journalPath)
 * </pre>
 *
 * Usage:
 *   java com.clob.infra.OrderBookServer [config-path]
 */
public class OrderBookServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderBookServer.class);

    private final ChronicleEventJournal journal;
    private final InstrumentSequencer sequencer;

    public OrderBookServer(ServerConfig config, Ledger ledger) {
        this.journal = new ChronicleEventJournal(config.journalPath);
        this.sequencer = new InstrumentSequencer(config, ledger, journal);
        log.info("Order book server started, journal at {}", config.journalPath);
    }

    public InstrumentSequencer sequencer() {
        return sequencer;
    }

    public ChronicleEventJournal journal() {
        return journal;
    }

    /**
     * Stops the sequencer first so that every published command reaches the
     * journal before it is closed.
     */
    @Override
    public void close() {
        sequencer.close();
        journal.close();
        log.info("Order book server stopped");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : null;
        ServerConfig config = ServerConfig.load(configPath);

        // Stand-alone runs settle against an empty in-memory ledger
        InMemoryLedger ledger = new InMemoryLedger(config.engine.escrowAccount);

        try (OrderBookServer server = new OrderBookServer(config, ledger)) {
            int replayed = server.journal().replay(entry -> log.debug("Journal {}", entry));
            log.info("Journal holds {} events. Waiting for shutdown signal.", replayed);
            new ShutdownSignalBarrier().await();
        }
    }
}
