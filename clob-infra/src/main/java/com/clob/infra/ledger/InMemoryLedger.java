package com.clob.infra.ledger;

import com.clob.api.Asset;
import com.clob.api.Ledger;
import com.clob.api.LedgerException;
import org.agrona.collections.Long2LongHashMap;

import java.util.EnumMap;
import java.util.Map;

/**
 * A reference {@link Ledger} keeping balances in memory, one primitive map
 * per asset. Refuses transfers that would overdraw an account or push a
 * balance past {@code Long.MAX_VALUE}.
 * <p>
 * Not thread-safe; meant to be called from the engine thread only.
 * </p>
 */
public class InMemoryLedger implements Ledger {

    private static final long MISSING = Long.MIN_VALUE;

    private final long custodyAccount;
    private final Map<Asset, Long2LongHashMap> balances = new EnumMap<>(Asset.class);

    public InMemoryLedger(long custodyAccount) {
        this.custodyAccount = custodyAccount;
        for (Asset asset : Asset.values()) {
            balances.put(asset, new Long2LongHashMap(MISSING));
        }
    }

    public void deposit(Asset asset, long account, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("negative deposit " + amount);
        }
        Long2LongHashMap accounts = balances.get(asset);
        accounts.put(account, Math.addExact(balance(accounts, account), amount));
    }

    public long balanceOf(Asset asset, long account) {
        return balance(balances.get(asset), account);
    }

    /**
     * @return The sum of every account's balance in {@code asset}.
     */
    public long total(Asset asset) {
        long total = 0;
        Long2LongHashMap.ValueIterator values = balances.get(asset).values().iterator();
        while (values.hasNext()) {
            total += values.nextValue();
        }
        return total;
    }

    @Override
    public void transfer(Asset asset, long from, long to, long amount) throws LedgerException {
        if (amount < 0) {
            throw new LedgerException("negative transfer from " + from + " to " + to, asset, amount);
        }
        Long2LongHashMap accounts = balances.get(asset);
        long available = balance(accounts, from);
        if (available < amount) {
            throw new LedgerException("insufficient " + asset + " in account " + from + ": " + available,
                    asset, amount);
        }
        if (from == to) {
            return;
        }
        long credited = balance(accounts, to) + amount;
        if (credited < 0) {
            throw new LedgerException(asset + " balance of account " + to + " would overflow", asset, amount);
        }
        accounts.put(from, available - amount);
        accounts.put(to, credited);
    }

    @Override
    public void transferFee(Asset asset, long to, long amount) throws LedgerException {
        transfer(asset, custodyAccount, to, amount);
    }

    private static long balance(Long2LongHashMap accounts, long account) {
        long balance = accounts.get(account);
        return balance == MISSING ? 0 : balance;
    }
}
