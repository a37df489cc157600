/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Storage of the low 16 bits of the values sharing one container key. There
 * are exactly two variants, {@link ArrayStore} for sparse chunks and
 * {@link BitmapStore} for dense ones; pairwise operations dispatch on the
 * variant of their argument and cover every pairing.
 * <p>
 * Stores do not pick their own variant. The owning {@link Container} decides
 * when to convert.
 */
abstract class Store implements Cloneable {

    /**
     * @return true if {@code x} was not present before
     */
    abstract boolean add(short x);

    /**
     * @return true if {@code x} was present and has been removed
     */
    abstract boolean remove(short x);

    abstract boolean contains(short x);

    abstract int cardinality();

    /**
     * Removes every value in {@code [lo, hi)}.
     *
     * @param lo inclusive lower bound, in [0, 65536]
     * @param hi exclusive upper bound, in [lo, 65536]
     * @return how many values were removed
     */
    abstract int removeRange(int lo, int hi);

    /**
     * @return true iff every value of this store is a value of {@code other}
     */
    abstract boolean isSubset(Store other);

    abstract boolean intersects(Store other);

    abstract Store or(Store other);

    abstract Store and(Store other);

    abstract Store andNot(Store other);

    abstract Store xor(Store other);

    abstract ArrayStore toArrayStore();

    abstract BitmapStore toBitmapStore();

    abstract ShortIterator getShortIterator();

    /**
     * @return the size of the data block {@link #writeArray(DataOutput)} emits
     */
    abstract int serializedSizeInBytes();

    /**
     * Writes the raw little endian data block of this store.
     */
    abstract void writeArray(DataOutput out) throws IOException;

    /**
     * @return approximate heap usage, in bytes
     */
    abstract int getSizeInBytes();

    @Override
    public abstract Store clone();
}
