package com.clob.api;

/**
 * <b>The Ledger: custody of traded assets.</b>
 * <p>
 * The matching core never holds balances itself. It computes every amount
 * (including fees) and asks the host's ledger to move already-custodied
 * balances between accounts. Calls are synchronous and made inline from the
 * single writer thread of an instrument.
 * </p>
 * <p>
 * A ledger must either move the full amount or throw; a thrown
 * {@link LedgerException} aborts the calling submit/cancel.
 * </p>
 */
public interface Ledger {

    /**
     * Moves {@code amount} of {@code asset} from account {@code from} to account {@code to}.
     */
    void transfer(Asset asset, long from, long to, long amount) throws LedgerException;

    /**
     * Moves a fee of {@code amount} of {@code asset} out of the book's custody
     * account into the fee recipient {@code to}.
     */
    void transferFee(Asset asset, long to, long amount) throws LedgerException;
}
