package com.clob.api;

/**
 * Raised by a {@link Ledger} that refuses or fails to move funds.
 */
public class LedgerException extends Exception {

    private final Asset asset;
    private final long amount;

    public LedgerException(String message, Asset asset, long amount) {
        super(message);
        this.asset = asset;
        this.amount = amount;
    }

    public LedgerException(String message, Asset asset, long amount, Throwable cause) {
        super(message, cause);
        this.asset = asset;
        this.amount = amount;
    }

    public Asset asset() {
        return asset;
    }

    public long amount() {
        return amount;
    }
}
