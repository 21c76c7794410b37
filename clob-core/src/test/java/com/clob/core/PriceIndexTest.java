package com.clob.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PriceIndexTest {

    private PriceIndex index;

    @BeforeEach
    public void setup() {
        index = new PriceIndex();
    }

    @Test
    public void testRootInsertion() {
        index.insert(100);

        PriceIndex.Node root = index.getRoot();
        assertEquals(100, root.price());
        assertFalse(root.isRed(), "Root must always be BLACK");
        assertNull(root.parent());
        assertTrue(index.exists(100));
    }

    @Test
    public void testSimpleRedInsertion() {
        // Root: 100 (Black)
        // Child: 50 (Red)
        index.insert(100);
        index.insert(50);

        assertEquals(100, index.getRoot().price());
        assertEquals(50, index.getRoot().left().price());
        assertTrue(index.getRoot().left().isRed(), "Child of black root should be RED");
    }

    @Test
    public void testRecoloringWhenUncleIsRed() {
        // 10(B)
        // / \
        // 5(R) 15(R)
        // /
        // 1(R) -> Trigger Recolor
        index.insert(10);
        index.insert(5);
        index.insert(15);
        index.insert(1);

        assertFalse(index.getRoot().isRed(), "Root 10 is Black");
        assertFalse(index.getRoot().left().isRed(), "Node 5 is Black");
        assertFalse(index.getRoot().right().isRed(), "Node 15 is Black");
        assertTrue(index.getRoot().left().left().isRed(), "Node 1 is Red");
    }

    @Test
    public void testRotationRight() {
        // 10(B) / 5(R) / 1(R) -> 5(B) with 1(R) and 10(R)
        index.insert(10);
        index.insert(5);
        index.insert(1);

        assertEquals(5, index.getRoot().price());
        assertFalse(index.getRoot().isRed(), "New Root 5 is Black");
        assertEquals(1, index.getRoot().left().price());
        assertTrue(index.getRoot().left().isRed());
        assertEquals(10, index.getRoot().right().price());
        assertTrue(index.getRoot().right().isRed());
    }

    @Test
    public void testRotationLeft() {
        index.insert(10);
        index.insert(15);
        index.insert(20);

        assertEquals(15, index.getRoot().price());
        assertFalse(index.getRoot().isRed(), "New Root 15 is Black");
        assertEquals(10, index.getRoot().left().price());
        assertEquals(20, index.getRoot().right().price());
    }

    @Test
    public void testZigZagRotation() {
        // 10 / 5 \ 7 -> 7(B) with 5(R) and 10(R)
        index.insert(10);
        index.insert(5);
        index.insert(7);

        assertEquals(7, index.getRoot().price());
        assertEquals(5, index.getRoot().left().price());
        assertEquals(10, index.getRoot().right().price());
        assertEquals(index.getRoot(), index.getRoot().left().parent());
    }

    @Test
    public void testFindMinMax() {
        index.insert(50);
        index.insert(20);
        index.insert(80);
        index.insert(10);
        index.insert(30);

        assertEquals(10, index.min(), "Min should be 10");
        assertEquals(80, index.max(), "Max should be 80");
    }

    @Test
    public void testEmptyIndexReturnsSentinel() {
        assertTrue(index.isEmpty());
        assertEquals(PriceIndex.EMPTY, index.min());
        assertEquals(PriceIndex.EMPTY, index.max());
        assertFalse(index.exists(100));
        assertFalse(index.exists(PriceIndex.EMPTY));
    }

    @Test
    public void testSuccessorAndPredecessorWalk() {
        long[] prices = {40, 10, 70, 30, 20, 60, 50};
        for (long price : prices) {
            index.insert(price);
        }

        long price = index.min();
        StringBuilder ascending = new StringBuilder();
        while (price != PriceIndex.EMPTY) {
            ascending.append(price).append(' ');
            price = index.successor(price);
        }
        assertEquals("10 20 30 40 50 60 70 ", ascending.toString());

        price = index.max();
        StringBuilder descending = new StringBuilder();
        while (price != PriceIndex.EMPTY) {
            descending.append(price).append(' ');
            price = index.predecessor(price);
        }
        assertEquals("70 60 50 40 30 20 10 ", descending.toString());
    }

    @Test
    public void testDuplicateInsertIsNoOp() {
        index.insert(100);
        index.insert(100);

        assertEquals(1, index.size());
        assertEquals(100, index.min());
        assertEquals(100, index.max());
    }

    @Test
    public void testRemoveRootWithTwoChildren() {
        index.insert(20);
        index.insert(10);
        index.insert(30);

        index.remove(20);

        assertFalse(index.exists(20));
        assertEquals(2, index.size());
        assertEquals(30, index.successor(10));
        assertEquals(10, index.predecessor(30));
        assertFalse(index.getRoot().isRed());
        assertNull(index.getRoot().parent());
    }

    @Test
    public void testReinsertAfterRemove() {
        index.insert(20);
        index.insert(10);
        index.remove(10);
        assertFalse(index.exists(10));

        index.insert(10);
        assertTrue(index.exists(10));
        assertEquals(10, index.min());
    }

    @Test
    public void testRemoveLastPriceEmptiesIndex() {
        index.insert(42);
        index.remove(42);

        assertTrue(index.isEmpty());
        assertNull(index.getRoot());
        assertEquals(PriceIndex.EMPTY, index.min());
    }

    @Test
    public void testRemoveAbsentPrice() {
        index.insert(10);

        OrderBookException e = assertThrows(OrderBookException.class, () -> index.remove(11));
        assertEquals(OrderBookException.Reason.PRICE_NOT_FOUND, e.reason());
        assertEquals(1, index.size());
    }

    @Test
    public void testNeighbourOfAbsentPrice() {
        index.insert(10);

        assertEquals(OrderBookException.Reason.PRICE_NOT_FOUND,
                assertThrows(OrderBookException.class, () -> index.successor(11)).reason());
        assertEquals(OrderBookException.Reason.PRICE_NOT_FOUND,
                assertThrows(OrderBookException.class, () -> index.predecessor(11)).reason());
    }

    @Test
    public void testZeroPriceRejected() {
        OrderBookException e = assertThrows(OrderBookException.class, () -> index.insert(0));
        assertEquals(OrderBookException.Reason.INVALID_PRICE, e.reason());
        assertTrue(index.isEmpty());
    }
}
