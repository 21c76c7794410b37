package com.clob.core;

import com.clob.api.Asset;
import com.clob.api.Ledger;
import com.clob.api.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The ledger calls of one submit or cancel.
 * <p>
 * Every transfer that went through is remembered so that, when a later one
 * fails, the completed ones can be reversed newest first. Zero amounts are
 * never sent to the ledger.
 * </p>
 */
final class Settlement {

    private static final Logger log = LoggerFactory.getLogger(Settlement.class);

    private static final class Transfer {
        final Asset asset;
        final long from;
        final long to;
        final long amount;

        Transfer(Asset asset, long from, long to, long amount) {
            this.asset = asset;
            this.from = from;
            this.to = to;
            this.amount = amount;
        }
    }

    private final Ledger ledger;
    private final long escrowAccount;
    private final List<Transfer> completed = new ArrayList<>();

    Settlement(Ledger ledger, long escrowAccount) {
        this.ledger = ledger;
        this.escrowAccount = escrowAccount;
    }

    void transfer(Asset asset, long from, long to, long amount) throws LedgerException {
        if (amount == 0) {
            return;
        }
        ledger.transfer(asset, from, to, amount);
        completed.add(new Transfer(asset, from, to, amount));
    }

    void transferFee(Asset asset, long feeRecipient, long amount) throws LedgerException {
        if (amount == 0) {
            return;
        }
        ledger.transferFee(asset, feeRecipient, amount);
        completed.add(new Transfer(asset, escrowAccount, feeRecipient, amount));
    }

    /**
     * Reverses every completed transfer after {@code cause} stopped the call,
     * whether the ledger refused a transfer or failed outright. A reversal that
     * itself fails is attached to {@code cause} and logged; the remaining ones
     * are still tried.
     */
    void rollback(Exception cause) {
        for (int i = completed.size() - 1; i >= 0; i--) {
            Transfer t = completed.get(i);
            try {
                ledger.transfer(t.asset, t.to, t.from, t.amount);
            } catch (LedgerException | RuntimeException e) {
                cause.addSuppressed(e);
                log.error("Compensating transfer of {} {} from {} back to {} failed", t.amount, t.asset, t.to, t.from, e);
            }
        }
        completed.clear();
    }
}
