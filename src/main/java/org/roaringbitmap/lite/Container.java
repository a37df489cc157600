/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

/**
 * All the values of a bitmap sharing the same high 16 bits. The container
 * keeps the exact cardinality of its store and chooses the store variant:
 * fewer than {@link #ARRAY_MAX_SIZE} values are kept in an
 * {@link ArrayStore}, anything larger in a {@link BitmapStore}.
 * <p>
 * Combinators return {@code null} instead of an empty container.
 */
final class Container implements Cloneable {

    /**
     * Cardinality at which a container switches to the bitmap store.
     */
    static final int ARRAY_MAX_SIZE = 4096;

    final short key;

    int cardinality;

    Store store;

    Container(final short key) {
        this(key, 0, new ArrayStore());
    }

    /**
     * Trusts {@code cardinality} to be the cardinality of {@code store}, and
     * {@code store} to be the variant that cardinality calls for.
     */
    Container(final short key, final int cardinality, final Store store) {
        this.key = key;
        this.cardinality = cardinality;
        this.store = store;
    }

    /**
     * Wraps the result of a store combinator, or returns {@code null} if it is empty.
     */
    private static Container wrap(final short key, final Store store) {
        final int cardinality = store.cardinality();
        if (cardinality == 0) {
            return null;
        }
        final Container answer = new Container(key, cardinality, store);
        answer.ensureCorrectStore();
        return answer;
    }

    void ensureCorrectStore() {
        if (cardinality >= ARRAY_MAX_SIZE) {
            store = store.toBitmapStore();
        } else {
            store = store.toArrayStore();
        }
    }

    boolean isBitmap() {
        return store instanceof BitmapStore;
    }

    boolean add(final short x) {
        if (store.add(x)) {
            ++cardinality;
            ensureCorrectStore();
            return true;
        }
        return false;
    }

    boolean remove(final short x) {
        if (store.remove(x)) {
            --cardinality;
            ensureCorrectStore();
            return true;
        }
        return false;
    }

    boolean contains(final short x) {
        return store.contains(x);
    }

    int getCardinality() {
        return cardinality;
    }

    /**
     * Removes every low value in {@code [lo, hi)}.
     *
     * @return how many values were removed
     */
    int removeRange(final int lo, final int hi) {
        if (lo < 0 || hi > BitmapStore.MAX_CAPACITY || lo > hi) {
            throw new IllegalArgumentException("invalid container range [" + lo + ", " + hi + ")");
        }
        final int removed = store.removeRange(lo, hi);
        if (removed > 0) {
            cardinality -= removed;
            ensureCorrectStore();
        }
        return removed;
    }

    Container or(final Container other) {
        checkSameKey(other);
        return wrap(key, store.or(other.store));
    }

    Container and(final Container other) {
        checkSameKey(other);
        return wrap(key, store.and(other.store));
    }

    Container andNot(final Container other) {
        checkSameKey(other);
        return wrap(key, store.andNot(other.store));
    }

    Container xor(final Container other) {
        checkSameKey(other);
        return wrap(key, store.xor(other.store));
    }

    boolean isSubset(final Container other) {
        checkSameKey(other);
        return cardinality <= other.cardinality && store.isSubset(other.store);
    }

    boolean intersects(final Container other) {
        checkSameKey(other);
        return store.intersects(other.store);
    }

    private void checkSameKey(final Container other) {
        if (key != other.key) {
            throw new IllegalArgumentException("containers with different keys: "
                    + Util.toIntUnsigned(key) + " and " + Util.toIntUnsigned(other.key));
        }
    }

    ShortIterator getShortIterator() {
        return store.getShortIterator();
    }

    int getSizeInBytes() {
        return 16 + store.getSizeInBytes();
    }

    @Override
    public Container clone() {
        return new Container(key, cardinality, store.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof Container) {
            final Container c = (Container) o;
            return c.key == key && c.cardinality == cardinality && c.store.equals(store);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return key * 0xF0F0F0 + store.hashCode();
    }
}
