/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.DataOutput;
import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * Dense store: one bit per possible low value, 1024 words. Every word-wise
 * operation costs the same regardless of how many bits are set.
 */
final class BitmapStore extends Store {

    static final int MAX_CAPACITY = 1 << 16;

    static final int WORD_COUNT = MAX_CAPACITY / 64;

    final long[] bitmap;

    BitmapStore() {
        this.bitmap = new long[WORD_COUNT];
    }

    /**
     * Wraps {@code bitmap}, which must hold exactly {@link #WORD_COUNT} words.
     */
    BitmapStore(final long[] bitmap) {
        if (bitmap.length != WORD_COUNT) {
            throw new IllegalArgumentException("a bitmap store needs " + WORD_COUNT + " words, got " + bitmap.length);
        }
        this.bitmap = bitmap;
    }

    @Override
    boolean add(final short x) {
        final int i = Util.toIntUnsigned(x);
        final long previous = bitmap[i >>> 6];
        final long next = previous | (1L << i);
        bitmap[i >>> 6] = next;
        return previous != next;
    }

    @Override
    boolean remove(final short x) {
        final int i = Util.toIntUnsigned(x);
        final long previous = bitmap[i >>> 6];
        final long next = previous & ~(1L << i);
        bitmap[i >>> 6] = next;
        return previous != next;
    }

    @Override
    boolean contains(final short x) {
        final int i = Util.toIntUnsigned(x);
        return (bitmap[i >>> 6] & (1L << i)) != 0;
    }

    @Override
    int cardinality() {
        int count = 0;
        for (int k = 0; k < WORD_COUNT; ++k) {
            count += Long.bitCount(bitmap[k]);
        }
        return count;
    }

    @Override
    int removeRange(final int lo, final int hi) {
        if (lo >= hi) {
            return 0;
        }
        final int firstWord = lo >>> 6;
        final int lastWord = (hi - 1) >>> 6;
        // shifts are taken mod 64
        final long startMask = -1L << lo;
        final long endMask = -1L >>> -hi;
        if (firstWord == lastWord) {
            final long mask = startMask & endMask;
            final int removed = Long.bitCount(bitmap[firstWord] & mask);
            bitmap[firstWord] &= ~mask;
            return removed;
        }
        int removed = Long.bitCount(bitmap[firstWord] & startMask);
        bitmap[firstWord] &= ~startMask;
        for (int k = firstWord + 1; k < lastWord; ++k) {
            removed += Long.bitCount(bitmap[k]);
            bitmap[k] = 0;
        }
        removed += Long.bitCount(bitmap[lastWord] & endMask);
        bitmap[lastWord] &= ~endMask;
        return removed;
    }

    @Override
    boolean isSubset(final Store other) {
        if (other instanceof BitmapStore) {
            final long[] o = ((BitmapStore) other).bitmap;
            for (int k = 0; k < WORD_COUNT; ++k) {
                if ((bitmap[k] & ~o[k]) != 0) {
                    return false;
                }
            }
            return true;
        }
        final ArrayStore a = (ArrayStore) other;
        if (cardinality() > a.cardinality) {
            return false;
        }
        final ShortIterator it = getShortIterator();
        while (it.hasNext()) {
            if (!a.contains(it.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    boolean intersects(final Store other) {
        if (other instanceof ArrayStore) {
            return other.intersects(this);
        }
        final long[] o = ((BitmapStore) other).bitmap;
        for (int k = 0; k < WORD_COUNT; ++k) {
            if ((bitmap[k] & o[k]) != 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    Store or(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore a = (ArrayStore) other;
            final BitmapStore answer = clone();
            for (int i = 0; i < a.cardinality; ++i) {
                answer.add(a.content[i]);
            }
            return answer;
        }
        final long[] o = ((BitmapStore) other).bitmap;
        final long[] words = new long[WORD_COUNT];
        for (int k = 0; k < WORD_COUNT; ++k) {
            words[k] = bitmap[k] | o[k];
        }
        return new BitmapStore(words);
    }

    @Override
    Store and(final Store other) {
        if (other instanceof ArrayStore) {
            return other.and(this);
        }
        final long[] o = ((BitmapStore) other).bitmap;
        final long[] words = new long[WORD_COUNT];
        for (int k = 0; k < WORD_COUNT; ++k) {
            words[k] = bitmap[k] & o[k];
        }
        return new BitmapStore(words);
    }

    @Override
    Store andNot(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore a = (ArrayStore) other;
            final BitmapStore answer = clone();
            for (int i = 0; i < a.cardinality; ++i) {
                answer.remove(a.content[i]);
            }
            return answer;
        }
        final long[] o = ((BitmapStore) other).bitmap;
        final long[] words = new long[WORD_COUNT];
        for (int k = 0; k < WORD_COUNT; ++k) {
            words[k] = bitmap[k] & ~o[k];
        }
        return new BitmapStore(words);
    }

    @Override
    Store xor(final Store other) {
        if (other instanceof ArrayStore) {
            final ArrayStore a = (ArrayStore) other;
            final BitmapStore answer = clone();
            for (int i = 0; i < a.cardinality; ++i) {
                final int v = Util.toIntUnsigned(a.content[i]);
                answer.bitmap[v >>> 6] ^= 1L << v;
            }
            return answer;
        }
        final long[] o = ((BitmapStore) other).bitmap;
        final long[] words = new long[WORD_COUNT];
        for (int k = 0; k < WORD_COUNT; ++k) {
            words[k] = bitmap[k] ^ o[k];
        }
        return new BitmapStore(words);
    }

    @Override
    ArrayStore toArrayStore() {
        final short[] content = new short[cardinality()];
        int pos = 0;
        for (int k = 0; k < WORD_COUNT; ++k) {
            long w = bitmap[k];
            while (w != 0) {
                content[pos++] = (short) ((k << 6) + Long.numberOfTrailingZeros(w));
                w &= w - 1;
            }
        }
        return new ArrayStore(content, pos);
    }

    @Override
    BitmapStore toBitmapStore() {
        return this;
    }

    @Override
    ShortIterator getShortIterator() {
        return new BitmapShortIterator(bitmap);
    }

    @Override
    int serializedSizeInBytes() {
        return WORD_COUNT * 8;
    }

    @Override
    void writeArray(final DataOutput out) throws IOException {
        for (int k = 0; k < WORD_COUNT; ++k) {
            out.writeLong(Long.reverseBytes(bitmap[k]));
        }
    }

    @Override
    int getSizeInBytes() {
        return WORD_COUNT * 8;
    }

    @Override
    public BitmapStore clone() {
        return new BitmapStore(bitmap.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof BitmapStore) {
            final long[] other = ((BitmapStore) o).bitmap;
            for (int k = 0; k < WORD_COUNT; ++k) {
                if (bitmap[k] != other[k]) {
                    return false;
                }
            }
            return true;
        }
        if (o instanceof Store) {
            final Store s = (Store) o;
            return s.cardinality() == cardinality() && isSubset(s);
        }
        return false;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        final ShortIterator it = getShortIterator();
        while (it.hasNext()) {
            hash = 31 * hash + it.nextAsInt();
        }
        return hash;
    }

    private static final class BitmapShortIterator implements ShortIterator {
        private final long[] bitmap;
        private int wordIndex;
        private long word;

        BitmapShortIterator(long[] bitmap) {
            this.bitmap = bitmap;
            this.wordIndex = 0;
            this.word = bitmap[0];
            advance();
        }

        private BitmapShortIterator(long[] bitmap, int wordIndex, long word) {
            this.bitmap = bitmap;
            this.wordIndex = wordIndex;
            this.word = word;
        }

        private void advance() {
            while (word == 0 && ++wordIndex < WORD_COUNT) {
                word = bitmap[wordIndex];
            }
        }

        @Override
        public boolean hasNext() {
            return word != 0;
        }

        @Override
        public short next() {
            return (short) nextAsInt();
        }

        @Override
        public int nextAsInt() {
            if (word == 0) {
                throw new NoSuchElementException();
            }
            final int value = (wordIndex << 6) + Long.numberOfTrailingZeros(word);
            word &= word - 1;
            advance();
            return value;
        }

        @Override
        public ShortIterator clone() {
            return new BitmapShortIterator(bitmap, wordIndex, word);
        }
    }
}
