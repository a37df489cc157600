/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * Ascending iterator over the low 16-bit values of one store.
 */
interface ShortIterator extends Cloneable {

    boolean hasNext();

    short next();

    /**
     * @return the next value, as an unsigned int
     */
    int nextAsInt();

    ShortIterator clone();
}
