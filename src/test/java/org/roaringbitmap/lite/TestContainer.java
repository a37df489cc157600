/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestContainer {

    private static Container containerOf(int key, int lo, int hi) {
        Container c = new Container((short) key);
        for (int i = lo; i < hi; ++i) {
            c.add((short) i);
        }
        return c;
    }

    @Test
    public void testThresholdOnAdd() {
        Container c = containerOf(0, 0, 4095);
        assertEquals(4095, c.getCardinality());
        assertFalse(c.isBitmap());
        assertTrue(c.add((short) 4095));
        assertEquals(4096, c.getCardinality());
        assertTrue(c.isBitmap());
        assertFalse(c.add((short) 4095));
        assertEquals(4096, c.getCardinality());
    }

    @Test
    public void testThresholdOnRemove() {
        Container c = containerOf(0, 0, 4096);
        assertTrue(c.isBitmap());
        assertFalse(c.remove((short) 5000));
        assertTrue(c.isBitmap());
        assertTrue(c.remove((short) 0));
        assertEquals(4095, c.getCardinality());
        assertFalse(c.isBitmap());
        for (int i = 1; i < 4096; ++i) {
            assertTrue(c.contains((short) i));
        }
    }

    @Test
    public void testRemoveRangeConverts() {
        Container c = containerOf(7, 0, 10000);
        assertTrue(c.isBitmap());
        assertEquals(6000, c.removeRange(4000, 10000));
        assertEquals(4000, c.getCardinality());
        assertFalse(c.isBitmap());
        assertEquals(0, c.removeRange(4000, 10000));
        assertEquals(4000, c.removeRange(0, 65536));
        assertEquals(0, c.getCardinality());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRemoveRangeRejectsInvertedBounds() {
        containerOf(0, 0, 10).removeRange(8, 2);
    }

    @Test
    public void testCombinatorsPickTheStore() {
        Container a = containerOf(1, 0, 3000);
        Container b = containerOf(1, 2000, 5000);

        Container union = a.or(b);
        assertEquals(5000, union.getCardinality());
        assertTrue(union.isBitmap());

        Container intersection = a.and(b);
        assertEquals(1000, intersection.getCardinality());
        assertFalse(intersection.isBitmap());

        Container bigA = containerOf(1, 0, 20000);
        Container bigB = containerOf(1, 19000, 40000);
        Container small = bigA.and(bigB);
        assertEquals(1000, small.getCardinality());
        assertFalse(small.isBitmap());

        Container difference = bigA.andNot(bigB);
        assertEquals(19000, difference.getCardinality());
        assertTrue(difference.isBitmap());

        Container symmetric = bigA.xor(bigB);
        assertEquals(39000, symmetric.getCardinality());
        assertEquals((short) 1, symmetric.key);
    }

    @Test
    public void testEmptyResultsAreDropped() {
        Container a = containerOf(2, 0, 100);
        Container b = containerOf(2, 200, 300);
        assertNull(a.and(b));
        assertNull(a.andNot(a));
        assertNull(a.xor(a.clone()));
        Container bigA = containerOf(2, 0, 5000);
        assertNull(bigA.xor(bigA.clone()));
        assertNull(bigA.andNot(containerOf(2, 0, 6000)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKeysMustMatch() {
        containerOf(1, 0, 10).or(containerOf(2, 0, 10));
    }

    @Test
    public void testIsSubset() {
        assertTrue(containerOf(0, 1000, 8196).isSubset(containerOf(0, 0, 16384)));
        assertTrue(containerOf(0, 10, 20).isSubset(containerOf(0, 0, 16384)));
        assertFalse(containerOf(0, 0, 16384).isSubset(containerOf(0, 10, 20)));
        assertFalse(containerOf(0, 0, 5000).isSubset(containerOf(0, 1, 5001)));
    }

    @Test
    public void testCloneAndEquals() {
        Container a = containerOf(3, 0, 5000);
        Container copy = a.clone();
        assertEquals(a, copy);
        assertEquals(a.hashCode(), copy.hashCode());
        copy.remove((short) 0);
        assertEquals(5000, a.getCardinality());
        assertFalse(a.equals(copy));
    }
}
