package com.clob.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceLevelQueueTest {

    private PriceLevelQueue queue;

    @BeforeEach
    void setup() {
        queue = new PriceLevelQueue();
    }

    @Test
    void shouldKeepArrivalOrder() {
        queue.push(11);
        queue.push(12);
        queue.push(13);

        assertEquals(11, queue.head());
        assertEquals(13, queue.tail());
        assertEquals(12, queue.next(11));
        assertEquals(13, queue.next(12));
        assertEquals(PriceLevelQueue.EMPTY, queue.next(13));
        assertEquals(3, queue.length());
    }

    @Test
    void shouldSpliceOutInteriorItem() {
        queue.push(1);
        queue.push(2);
        queue.push(3);

        queue.remove(2);

        assertFalse(queue.exists(2));
        assertEquals(3, queue.next(1));
        assertEquals(1, queue.head());
        assertEquals(3, queue.tail());
    }

    @Test
    void shouldMoveHeadAndTailOnEndRemoval() {
        queue.push(1);
        queue.push(2);
        queue.push(3);

        queue.remove(1);
        assertEquals(2, queue.head());

        queue.remove(3);
        assertEquals(2, queue.tail());
        assertEquals(2, queue.head());

        queue.remove(2);
        assertTrue(queue.isEmpty());
        assertEquals(PriceLevelQueue.EMPTY, queue.head());
        assertEquals(PriceLevelQueue.EMPTY, queue.tail());
    }

    @Test
    void shouldAppendBehindSurvivorsAfterRemoval() {
        queue.push(1);
        queue.push(2);
        queue.remove(2);
        queue.push(4);

        assertEquals(4, queue.next(1));
        assertEquals(4, queue.tail());
    }

    @Test
    void shouldRejectDuplicateAndReservedIds() {
        queue.push(7);

        assertEquals(OrderBookException.Reason.QUEUE_ITEM_ALREADY_EXISTS,
                assertThrows(OrderBookException.class, () -> queue.push(7)).reason());
        assertEquals(OrderBookException.Reason.QUEUE_ITEM_ALREADY_EXISTS,
                assertThrows(OrderBookException.class, () -> queue.push(PriceLevelQueue.EMPTY)).reason());
        assertEquals(1, queue.length());
    }

    @Test
    void shouldRejectRemovalFromEmptyQueue() {
        OrderBookException e = assertThrows(OrderBookException.class, () -> queue.remove(5));
        assertEquals(OrderBookException.Reason.QUEUE_EMPTY, e.reason());
    }

    @Test
    void shouldRejectRemovalOfUnknownId() {
        queue.push(1);

        OrderBookException e = assertThrows(OrderBookException.class, () -> queue.remove(5));
        assertEquals(OrderBookException.Reason.QUEUE_ITEM_DOES_NOT_EXIST, e.reason());
        assertEquals(1, queue.head());
    }
}
