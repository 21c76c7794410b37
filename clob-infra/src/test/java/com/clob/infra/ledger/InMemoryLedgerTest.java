package com.clob.infra.ledger;

import com.clob.api.Asset;
import com.clob.api.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLedgerTest {

    private static final long CUSTODY = 100;

    private InMemoryLedger ledger;

    @BeforeEach
    void setup() {
        ledger = new InMemoryLedger(CUSTODY);
        ledger.deposit(Asset.QUOTE, 1, 1_000);
    }

    @Test
    void shouldMoveFunds() throws LedgerException {
        ledger.transfer(Asset.QUOTE, 1, 2, 400);

        assertEquals(600, ledger.balanceOf(Asset.QUOTE, 1));
        assertEquals(400, ledger.balanceOf(Asset.QUOTE, 2));
        assertEquals(1_000, ledger.total(Asset.QUOTE));
        assertEquals(0, ledger.balanceOf(Asset.BASE, 1));
    }

    @Test
    void shouldAllowDrainingToZero() throws LedgerException {
        ledger.transfer(Asset.QUOTE, 1, 2, 1_000);
        ledger.transfer(Asset.QUOTE, 2, 1, 1_000);

        assertEquals(0, ledger.balanceOf(Asset.QUOTE, 2));
        assertEquals(1_000, ledger.balanceOf(Asset.QUOTE, 1));
    }

    @Test
    void shouldRefuseOverdraft() {
        LedgerException e = assertThrows(LedgerException.class, () -> ledger.transfer(Asset.QUOTE, 1, 2, 1_001));

        assertEquals(Asset.QUOTE, e.asset());
        assertEquals(1_001, e.amount());
        assertEquals(1_000, ledger.balanceOf(Asset.QUOTE, 1));
        assertEquals(0, ledger.balanceOf(Asset.QUOTE, 2));
    }

    @Test
    void shouldRefuseNegativeAmounts() {
        assertThrows(LedgerException.class, () -> ledger.transfer(Asset.QUOTE, 1, 2, -1));
        assertThrows(IllegalArgumentException.class, () -> ledger.deposit(Asset.BASE, 1, -1));
    }

    @Test
    void shouldRefuseCreditPastLongRange() {
        ledger.deposit(Asset.QUOTE, 2, Long.MAX_VALUE - 5);

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.transfer(Asset.QUOTE, 1, 2, 10));

        assertEquals(10, e.amount());
        assertEquals(1_000, ledger.balanceOf(Asset.QUOTE, 1));
        assertEquals(Long.MAX_VALUE - 5, ledger.balanceOf(Asset.QUOTE, 2));
    }

    @Test
    void shouldPayFeesOutOfCustody() throws LedgerException {
        ledger.transfer(Asset.QUOTE, 1, CUSTODY, 50);
        ledger.transferFee(Asset.QUOTE, 7, 20);

        assertEquals(30, ledger.balanceOf(Asset.QUOTE, CUSTODY));
        assertEquals(20, ledger.balanceOf(Asset.QUOTE, 7));
        assertThrows(LedgerException.class, () -> ledger.transferFee(Asset.QUOTE, 7, 31));
    }
}
