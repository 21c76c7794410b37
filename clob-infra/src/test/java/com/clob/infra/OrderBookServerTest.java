package com.clob.infra;

import com.clob.api.Asset;
import com.clob.api.Side;
import com.clob.infra.journal.JournalEntry;
import com.clob.infra.ledger.InMemoryLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrderBookServerTest {

    private static final long ESCROW = 900;
    private static final long FEES = 901;
    private static final long ONE = 1_000_000_000_000_000_000L;

    @TempDir
    Path dir;

    @Test
    void shouldTradeSettleAndJournal() throws Exception {
        ServerConfig config = new ServerConfig();
        config.journalPath = dir.resolve("journal").toString();
        config.engine.feeBps = 20;
        config.engine.escrowAccount = ESCROW;
        config.engine.feeRecipient = FEES;

        InMemoryLedger ledger = new InMemoryLedger(ESCROW);
        ledger.deposit(Asset.BASE, 2, 10_000);
        ledger.deposit(Asset.QUOTE, 1, 100_000);

        List<JournalEntry> entries = new ArrayList<>();
        try (OrderBookServer server = new OrderBookServer(config, ledger)) {
            long ask = server.sequencer().submit(2, Side.SELL, 3 * ONE, 10_000, 1).get(5, TimeUnit.SECONDS);
            long bid = server.sequencer().submit(1, Side.BUY, 3 * ONE, 5_000, 2).get(5, TimeUnit.SECONDS);

            long remaining = server.sequencer().query(engine -> engine.orderDetail(ask).availableQuantity)
                    .get(5, TimeUnit.SECONDS);
            assertEquals(5_000, remaining);
            assertFalse(server.sequencer().query(engine -> engine.orderExists(bid)).get(5, TimeUnit.SECONDS));

            server.sequencer().cancel(ask, 2).get(5, TimeUnit.SECONDS);
            server.journal().replay(entries::add);
        }

        // buyer paid 15000 quote and received 5000 base less a 10 base fee
        assertEquals(85_000, ledger.balanceOf(Asset.QUOTE, 1));
        assertEquals(4_990, ledger.balanceOf(Asset.BASE, 1));
        assertEquals(15_000, ledger.balanceOf(Asset.QUOTE, 2));
        assertEquals(5_000, ledger.balanceOf(Asset.BASE, 2));
        assertEquals(10, ledger.balanceOf(Asset.BASE, FEES));
        assertEquals(0, ledger.balanceOf(Asset.BASE, ESCROW));
        assertEquals(10_000, ledger.total(Asset.BASE));
        assertEquals(100_000, ledger.total(Asset.QUOTE));

        assertEquals(4, entries.size());
        assertEquals(JournalEntry.CREATED, entries.get(0).type);
        assertEquals(JournalEntry.PARTIALLY_FILLED, entries.get(1).type);
        assertEquals(1, entries.get(1).counterparty);
        assertEquals(JournalEntry.FILLED, entries.get(2).type);
        assertEquals(2, entries.get(2).counterparty);
        assertEquals(JournalEntry.CANCELED, entries.get(3).type);
        assertEquals(5_000, entries.get(3).quantity);
    }
}
