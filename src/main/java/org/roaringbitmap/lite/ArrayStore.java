/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Sparse store: a sorted array of unique values, compared unsigned. Merges
 * against another array are linear two-pointer walks; merges against a
 * bitmap walk this array and probe the bitmap.
 */
final class ArrayStore extends Store {

    private static final int DEFAULT_INIT_SIZE = 4;

    short[] content;

    int cardinality = 0;

    ArrayStore() {
        this(DEFAULT_INIT_SIZE);
    }

    ArrayStore(final int capacity) {
        content = new short[capacity];
    }

    /**
     * Wraps {@code content}, which must be sorted and free of duplicates in
     * its first {@code cardinality} slots.
     */
    ArrayStore(final short[] content, final int cardinality) {
        this.content = content;
        this.cardinality = cardinality;
    }

    @Override
    boolean add(final short x) {
        int loc = Util.unsignedBinarySearch(content, 0, cardinality, x);
        if (loc >= 0) {
            return false;
        }
        loc = -loc - 1;
        if (cardinality == content.length) {
            increaseCapacity();
        }
        System.arraycopy(content, loc, content, loc + 1, cardinality - loc);
        content[loc] = x;
        ++cardinality;
        return true;
    }

    private void increaseCapacity() {
        final int length = content.length;
        int newCapacity;
        if (length == 0) {
            newCapacity = DEFAULT_INIT_SIZE;
        } else if (length < 64) {
            newCapacity = length * 2;
        } else if (length < 1024) {
            newCapacity = length * 3 / 2;
        } else {
            newCapacity = length * 5 / 4;
        }
        content = Arrays.copyOf(content, Math.min(newCapacity, BitmapStore.MAX_CAPACITY));
    }

    @Override
    boolean remove(final short x) {
        final int loc = Util.unsignedBinarySearch(content, 0, cardinality, x);
        if (loc < 0) {
            return false;
        }
        System.arraycopy(content, loc + 1, content, loc, cardinality - loc - 1);
        --cardinality;
        return true;
    }

    @Override
    boolean contains(final short x) {
        return Util.unsignedBinarySearch(content, 0, cardinality, x) >= 0;
    }

    @Override
    int cardinality() {
        return cardinality;
    }

    @Override
    int removeRange(final int lo, final int hi) {
        final int start = Util.lowerBound(content, cardinality, lo);
        final int end = Util.lowerBound(content, cardinality, hi);
        final int removed = end - start;
        if (removed > 0) {
            System.arraycopy(content, end, content, start, cardinality - end);
            cardinality -= removed;
        }
        return removed;
    }

    @Override
    boolean isSubset(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore o = (ArrayStore) other;
            if (cardinality > o.cardinality) {
                return false;
            }
            int j = 0;
            for (int i = 0; i < cardinality; ++i) {
                final int v = Util.toIntUnsigned(content[i]);
                while (j < o.cardinality && Util.toIntUnsigned(o.content[j]) < v) {
                    ++j;
                }
                if (j == o.cardinality || Util.toIntUnsigned(o.content[j]) != v) {
                    return false;
                }
                ++j;
            }
            return true;
        }
        final BitmapStore b = (BitmapStore) other;
        for (int i = 0; i < cardinality; ++i) {
            if (!b.contains(content[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    boolean intersects(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore o = (ArrayStore) other;
            int i = 0;
            int j = 0;
            while (i < cardinality && j < o.cardinality) {
                final int v1 = Util.toIntUnsigned(content[i]);
                final int v2 = Util.toIntUnsigned(o.content[j]);
                if (v1 == v2) {
                    return true;
                } else if (v1 < v2) {
                    ++i;
                } else {
                    ++j;
                }
            }
            return false;
        }
        final BitmapStore b = (BitmapStore) other;
        for (int i = 0; i < cardinality; ++i) {
            if (b.contains(content[i])) {
                return true;
            }
        }
        return false;
    }

    @Override
    Store or(final Store other) {
        if (other instanceof BitmapStore) {
            return other.or(this);
        }
        final ArrayStore o = (ArrayStore) other;
        final short[] result = new short[cardinality + o.cardinality];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < cardinality && j < o.cardinality) {
            final int v1 = Util.toIntUnsigned(content[i]);
            final int v2 = Util.toIntUnsigned(o.content[j]);
            if (v1 == v2) {
                result[k++] = content[i++];
                ++j;
            } else if (v1 < v2) {
                result[k++] = content[i++];
            } else {
                result[k++] = o.content[j++];
            }
        }
        while (i < cardinality) {
            result[k++] = content[i++];
        }
        while (j < o.cardinality) {
            result[k++] = o.content[j++];
        }
        return new ArrayStore(result, k);
    }

    @Override
    Store and(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore o = (ArrayStore) other;
            final short[] result = new short[Math.min(cardinality, o.cardinality)];
            int i = 0;
            int j = 0;
            int k = 0;
            while (i < cardinality && j < o.cardinality) {
                final int v1 = Util.toIntUnsigned(content[i]);
                final int v2 = Util.toIntUnsigned(o.content[j]);
                if (v1 == v2) {
                    result[k++] = content[i++];
                    ++j;
                } else if (v1 < v2) {
                    ++i;
                } else {
                    ++j;
                }
            }
            return new ArrayStore(result, k);
        }
        final BitmapStore b = (BitmapStore) other;
        final short[] result = new short[cardinality];
        int k = 0;
        for (int i = 0; i < cardinality; ++i) {
            if (b.contains(content[i])) {
                result[k++] = content[i];
            }
        }
        return new ArrayStore(result, k);
    }

    @Override
    Store andNot(final Store other) {
        final short[] result = new short[cardinality];
        int k = 0;
        if (other instanceof ArrayStore) {
            final ArrayStore o = (ArrayStore) other;
            int j = 0;
            for (int i = 0; i < cardinality; ++i) {
                final int v = Util.toIntUnsigned(content[i]);
                while (j < o.cardinality && Util.toIntUnsigned(o.content[j]) < v) {
                    ++j;
                }
                if (j == o.cardinality || Util.toIntUnsigned(o.content[j]) != v) {
                    result[k++] = content[i];
                }
            }
        } else {
            final BitmapStore b = (BitmapStore) other;
            for (int i = 0; i < cardinality; ++i) {
                if (!b.contains(content[i])) {
                    result[k++] = content[i];
                }
            }
        }
        return new ArrayStore(result, k);
    }

    @Override
    Store xor(final Store other) {
        if (other instanceof BitmapStore) {
            return other.xor(this);
        }
        final ArrayStore o = (ArrayStore) other;
        final short[] result = new short[cardinality + o.cardinality];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < cardinality && j < o.cardinality) {
            final int v1 = Util.toIntUnsigned(content[i]);
            final int v2 = Util.toIntUnsigned(o.content[j]);
            if (v1 == v2) {
                ++i;
                ++j;
            } else if (v1 < v2) {
                result[k++] = content[i++];
            } else {
                result[k++] = o.content[j++];
            }
        }
        while (i < cardinality) {
            result[k++] = content[i++];
        }
        while (j < o.cardinality) {
            result[k++] = o.content[j++];
        }
        return new ArrayStore(result, k);
    }

    @Override
    ArrayStore toArrayStore() {
        return this;
    }

    @Override
    BitmapStore toBitmapStore() {
        final BitmapStore answer = new BitmapStore();
        for (int i = 0; i < cardinality; ++i) {
            answer.add(content[i]);
        }
        return answer;
    }

    @Override
    ShortIterator getShortIterator() {
        return new ArrayShortIterator(this);
    }

    @Override
    int serializedSizeInBytes() {
        return cardinality * 2;
    }

    @Override
    void writeArray(final DataOutput out) throws IOException {
        for (int i = 0; i < cardinality; ++i) {
            out.writeShort(Short.reverseBytes(content[i]));
        }
    }

    @Override
    int getSizeInBytes() {
        return 4 + content.length * 2;
    }

    @Override
    public ArrayStore clone() {
        return new ArrayStore(Arrays.copyOf(content, cardinality), cardinality);
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof ArrayStore) {
            final ArrayStore s = (ArrayStore) o;
            if (s.cardinality != cardinality) {
                return false;
            }
            for (int i = 0; i < cardinality; ++i) {
                if (content[i] != s.content[i]) {
                    return false;
                }
            }
            return true;
        }
        if (o instanceof Store) {
            final Store s = (Store) o;
            return s.cardinality() == cardinality && isSubset(s);
        }
        return false;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (int i = 0; i < cardinality; ++i) {
            hash = 31 * hash + Util.toIntUnsigned(content[i]);
        }
        return hash;
    }

    private static final class ArrayShortIterator implements ShortIterator {
        private final ArrayStore parent;
        private int pos = 0;

        ArrayShortIterator(ArrayStore parent) {
            this.parent = parent;
        }

        @Override
        public boolean hasNext() {
            return pos < parent.cardinality;
        }

        @Override
        public short next() {
            if (pos >= parent.cardinality) {
                throw new NoSuchElementException();
            }
            return parent.content[pos++];
        }

        @Override
        public int nextAsInt() {
            return Util.toIntUnsigned(next());
        }

        @Override
        public ShortIterator clone() {
            final ArrayShortIterator c = new ArrayShortIterator(parent);
            c.pos = pos;
            return c;
        }
    }
}
