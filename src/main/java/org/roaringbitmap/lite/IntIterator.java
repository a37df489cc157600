/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * Iterator over the values of a bitmap, in ascending unsigned order. Values
 * above {@link Integer#MAX_VALUE} come out negative; use
 * {@link Integer#toUnsignedLong(int)} to widen them.
 */
public interface IntIterator extends Cloneable {

    boolean hasNext();

    int next();

    /**
     * @return an independent copy positioned at the same value
     */
    IntIterator clone();
}
