package com.clob.core;

import org.agrona.collections.Long2LongHashMap;
import org.agrona.collections.Long2ObjectHashMap;
import org.agrona.collections.LongArrayList;

/**
 * <b>OwnerOrderRegistry: who owns which resting orders.</b>
 * <p>
 * Per owner, an array of order ids plus an id &rarr; array index side table.
 * Removal swaps the target with the last element and pops, so it costs O(1)
 * wherever the id sits. The array order is therefore NOT insertion order.
 * </p>
 * <p>
 * Invariant: {@code index[ids[i]] == i} for every i, and an id is in the
 * index iff it is in the array.
 * </p>
 */
public class OwnerOrderRegistry {

    private static final long MISSING = -1;
    private static final long[] NO_ORDERS = new long[0];

    static final class Entry {
        final LongArrayList ids = new LongArrayList();
        final Long2LongHashMap index = new Long2LongHashMap(MISSING);
    }

    private final Long2ObjectHashMap<Entry> owners = new Long2ObjectHashMap<>();

    public void add(long owner, long id) {
        Entry entry = owners.get(owner);
        if (entry == null) {
            entry = new Entry();
            owners.put(owner, entry);
        }
        if (entry.index.containsKey(id)) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_ALREADY_EXISTS, "owner " + owner + " id " + id);
        }
        entry.index.put(id, entry.ids.size());
        entry.ids.addLong(id);
    }

    public void remove(long owner, long id) {
        Entry entry = owners.get(owner);
        long position = entry == null ? MISSING : entry.index.get(id);
        if (position == MISSING) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_DOES_NOT_EXIST, "owner " + owner + " id " + id);
        }

        int i = (int) position;
        int last = entry.ids.size() - 1;
        if (i != last) {
            long moved = entry.ids.getLong(last);
            entry.ids.setLong(i, moved);
            entry.index.put(moved, i);
        }
        entry.ids.removeAt(last);
        entry.index.remove(id);

        if (entry.ids.isEmpty()) {
            owners.remove(owner);
        }
    }

    public boolean contains(long owner, long id) {
        Entry entry = owners.get(owner);
        return entry != null && entry.index.containsKey(id);
    }

    /**
     * @return A copy of the owner's order ids, in no particular order.
     */
    public long[] ordersOf(long owner) {
        Entry entry = owners.get(owner);
        return entry == null ? NO_ORDERS : entry.ids.toLongArray();
    }

    /**
     * @return The position of {@code id} in the owner's array, or -1.
     */
    public int indexOf(long owner, long id) {
        Entry entry = owners.get(owner);
        return entry == null ? (int) MISSING : (int) entry.index.get(id);
    }
}
