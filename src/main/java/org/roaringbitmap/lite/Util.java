/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * Bit twiddling and search helpers shared by the stores and the container
 * array. Keys and low values are kept in {@code short} and always compared
 * unsigned.
 */
final class Util {

    private Util() {
    }

    static short highbits(int x) {
        return (short) (x >>> 16);
    }

    static short highbits(long x) {
        return (short) (x >>> 16);
    }

    static short lowbits(int x) {
        return (short) (x & 0xFFFF);
    }

    static int toIntUnsigned(short x) {
        return x & 0xFFFF;
    }

    static int compareUnsigned(short a, short b) {
        return toIntUnsigned(a) - toIntUnsigned(b);
    }

    /**
     * Binary search over an unsigned sorted range of shorts.
     *
     * @return the index of {@code k}, or {@code -(insertion point) - 1}
     */
    static int unsignedBinarySearch(final short[] array, final int begin, final int end, final short k) {
        int ikey = toIntUnsigned(k);
        // common case: appending at the end
        if ((end > 0) && (toIntUnsigned(array[end - 1]) < ikey)) {
            return -end - 1;
        }
        int low = begin;
        int high = end - 1;
        while (low <= high) {
            final int middleIndex = (low + high) >>> 1;
            final int middleValue = toIntUnsigned(array[middleIndex]);
            if (middleValue < ikey) {
                low = middleIndex + 1;
            } else if (middleValue > ikey) {
                high = middleIndex - 1;
            } else {
                return middleIndex;
            }
        }
        return -(low + 1);
    }

    /**
     * @return the first index in {@code [0, length)} whose unsigned value is
     *         at least {@code min}, or {@code length}
     */
    static int lowerBound(final short[] array, final int length, final int min) {
        int low = 0;
        int high = length;
        while (low < high) {
            final int middleIndex = (low + high) >>> 1;
            if (toIntUnsigned(array[middleIndex]) < min) {
                low = middleIndex + 1;
            } else {
                high = middleIndex;
            }
        }
        return low;
    }

    static void rangeSanityCheck(final long rangeStart, final long rangeEnd) {
        if (rangeStart < 0 || rangeStart > (1L << 32)) {
            throw new IllegalArgumentException("rangeStart=" + rangeStart + " should be in [0, 0xffffffff + 1]");
        }
        if (rangeEnd < 0 || rangeEnd > (1L << 32)) {
            throw new IllegalArgumentException("rangeEnd=" + rangeEnd + " should be in [0, 0xffffffff + 1]");
        }
    }
}
