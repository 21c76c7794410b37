package com.clob.core;

import org.agrona.collections.Long2ObjectHashMap;

/**
 * <b>PriceLevelQueue: the time priority inside one price.</b>
 * <p>
 * A doubly-linked FIFO of order ids. The links are not object references to
 * orders but ids, kept in a small id-indexed arena, so any id can be spliced
 * out in O(1) without a scan. Matching always reads the head, which makes the
 * oldest order at a price the first one filled.
 * </p>
 * <p>
 * Id {@code 0} is the {@link #EMPTY} sentinel for "no neighbour".
 * </p>
 */
public class PriceLevelQueue {

    public static final long EMPTY = 0;

    private static final class Link {
        long prev = EMPTY;
        long next = EMPTY;
    }

    private final Long2ObjectHashMap<Link> links = new Long2ObjectHashMap<>();
    private long head = EMPTY;
    private long tail = EMPTY;

    /**
     * Appends {@code id} at the tail.
     */
    public void push(long id) {
        if (id == EMPTY) {
            throw new OrderBookException(OrderBookException.Reason.QUEUE_ITEM_ALREADY_EXISTS, "id 0 is reserved");
        }
        if (links.containsKey(id)) {
            throw new OrderBookException(OrderBookException.Reason.QUEUE_ITEM_ALREADY_EXISTS, "id " + id);
        }

        Link link = new Link();
        if (tail == EMPTY) {
            head = id;
        } else {
            link.prev = tail;
            linkOf(tail).next = id;
        }
        tail = id;
        links.put(id, link);
    }

    /**
     * Splices {@code id} out of the list, wherever it sits.
     */
    public void remove(long id) {
        if (head == EMPTY) {
            throw new OrderBookException(OrderBookException.Reason.QUEUE_EMPTY, "removing " + id);
        }
        Link link = links.get(id);
        if (link == null) {
            throw new OrderBookException(OrderBookException.Reason.QUEUE_ITEM_DOES_NOT_EXIST, "id " + id);
        }

        if (link.prev != EMPTY) {
            linkOf(link.prev).next = link.next;
        } else {
            // It was head
            head = link.next;
        }

        if (link.next != EMPTY) {
            linkOf(link.next).prev = link.prev;
        } else {
            // It was tail
            tail = link.prev;
        }

        links.remove(id);
    }

    public boolean exists(long id) {
        return id != EMPTY && links.containsKey(id);
    }

    public boolean isEmpty() {
        return head == EMPTY;
    }

    public int length() {
        return links.size();
    }

    /**
     * @return The oldest id, or {@link #EMPTY}.
     */
    public long head() {
        return head;
    }

    public long tail() {
        return tail;
    }

    /**
     * @return The id queued right after {@code id}, or {@link #EMPTY} if it is the tail.
     */
    public long next(long id) {
        Link link = links.get(id);
        if (link == null) {
            throw new OrderBookException(OrderBookException.Reason.QUEUE_ITEM_DOES_NOT_EXIST, "id " + id);
        }
        return link.next;
    }

    private Link linkOf(long neighbour) {
        Link link = links.get(neighbour);
        if (link == null) {
            throw new IllegalStateException("dangling queue neighbour " + neighbour);
        }
        return link;
    }
}
