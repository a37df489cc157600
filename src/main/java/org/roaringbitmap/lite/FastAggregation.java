/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * Aggregation of many bitmaps at once. None of the inputs is modified.
 */
public final class FastAggregation {

    private FastAggregation() {
    }

    /**
     * @return the union of all the bitmaps, empty if there are none
     */
    public static RoaringBitmap or(final RoaringBitmap... bitmaps) {
        if (bitmaps.length == 0) {
            return new RoaringBitmap();
        }
        final RoaringBitmap answer = bitmaps[0].clone();
        for (int k = 1; k < bitmaps.length; ++k) {
            answer.or(bitmaps[k]);
        }
        return answer;
    }

    /**
     * @return the intersection of all the bitmaps, empty if there are none
     */
    public static RoaringBitmap and(final RoaringBitmap... bitmaps) {
        if (bitmaps.length == 0) {
            return new RoaringBitmap();
        }
        final RoaringBitmap answer = bitmaps[0].clone();
        for (int k = 1; k < bitmaps.length && !answer.isEmpty(); ++k) {
            answer.and(bitmaps[k]);
        }
        return answer;
    }

    /**
     * @return the values present in an odd number of the bitmaps
     */
    public static RoaringBitmap xor(final RoaringBitmap... bitmaps) {
        if (bitmaps.length == 0) {
            return new RoaringBitmap();
        }
        final RoaringBitmap answer = bitmaps[0].clone();
        for (int k = 1; k < bitmaps.length; ++k) {
            answer.xor(bitmaps[k]);
        }
        return answer;
    }
}
