/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * The operations a collaborator needs to build, query and walk a set of
 * unsigned 32-bit integers.
 */
public interface BitmapInterface {

    /**
     * 
     * @param x element to be added
     * @return if the operation modified the bitmap cardinality
     */
    boolean add(int x);

    /**
     * 
     * @param x element to be removed
     * @return if the operation modified the bitmap cardinality
     */
    boolean remove(int x);

    boolean contains(int x);

    long getLongCardinality();

    /**
     * @return the cardinality, truncated to an int
     */
    int getCardinality();

    /**
     * @return the values in ascending unsigned order
     */
    IntIterator getIntIterator();

    int getSizeInBytes();

}
