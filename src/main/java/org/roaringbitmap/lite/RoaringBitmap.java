/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * A compressed set of unsigned 32-bit integers. Values are split into a
 * 16-bit key, which selects a container, and 16 low bits stored inside it.
 * Set operations walk the containers of both operands in key order.
 * <p>
 * Instances are not synchronized: concurrent reads are fine, but any
 * mutation needs exclusive access.
 *
 * <pre>
 * {@code
 *      RoaringBitmap rr = RoaringBitmap.bitmapOf(1, 2, 3, 1000);
 *      RoaringBitmap rror = RoaringBitmap.or(rr, RoaringBitmap.bitmapOf(7, 1 << 20));
 *      rror.removeRange(0, 100);
 *      // rror is now {1000, 1048576}
 * }
 * </pre>
 */
public class RoaringBitmap implements Cloneable, BitmapInterface {

    RoaringArray highLowContainer;

    private long cardinality;

    /**
     * Create an empty bitmap
     */
    public RoaringBitmap() {
        this(new RoaringArray());
    }

    RoaringBitmap(final RoaringArray highLowContainer) {
        this.highLowContainer = highLowContainer;
        this.cardinality = highLowContainer.getLongCardinality();
    }

    /**
     * Generate a bitmap with the specified values set to true. The provided
     * integers values don't have to be in sorted order.
     *
     * @param dat set values
     * @return a new bitmap
     */
    public static RoaringBitmap bitmapOf(final int... dat) {
        final RoaringBitmap ans = new RoaringBitmap();
        for (final int i : dat) {
            ans.add(i);
        }
        return ans;
    }

    @Override
    public boolean add(final int x) {
        final short hb = Util.highbits(x);
        final int i = highLowContainer.getIndex(hb);
        final Container c;
        if (i >= 0) {
            c = highLowContainer.getContainerAtIndex(i);
        } else {
            c = new Container(hb);
            highLowContainer.insertNewContainerAt(-i - 1, c);
        }
        if (c.add(Util.lowbits(x))) {
            ++cardinality;
            return true;
        }
        return false;
    }

    @Override
    public boolean remove(final int x) {
        final int i = highLowContainer.getIndex(Util.highbits(x));
        if (i < 0) {
            return false;
        }
        final Container c = highLowContainer.getContainerAtIndex(i);
        if (!c.remove(Util.lowbits(x))) {
            return false;
        }
        --cardinality;
        if (c.getCardinality() == 0) {
            highLowContainer.removeAtIndex(i);
        }
        return true;
    }

    @Override
    public boolean contains(final int x) {
        final Container c = highLowContainer.getContainer(Util.highbits(x));
        return c != null && c.contains(Util.lowbits(x));
    }

    @Override
    public long getLongCardinality() {
        return cardinality;
    }

    @Override
    public int getCardinality() {
        return (int) cardinality;
    }

    public boolean isEmpty() {
        return highLowContainer.size() == 0;
    }

    /**
     * Reset to an empty bitmap.
     */
    public void clear() {
        highLowContainer.clear();
        cardinality = 0;
    }

    /**
     * Bitwise OR (union) operation. The provided bitmaps are *not* modified.
     *
     * @param x1 first bitmap
     * @param x2 other bitmap
     * @return result of the operation
     */
    public static RoaringBitmap or(final RoaringBitmap x1, final RoaringBitmap x2) {
        final RoaringArray a1 = x1.highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(a1.size() + a2.size());
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                answer.append(a1.getContainerAtIndex(pos1).or(a2.getContainerAtIndex(pos2)));
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                answer.append(a1.getContainerAtIndex(pos1).clone());
                ++pos1;
            } else {
                answer.append(a2.getContainerAtIndex(pos2).clone());
                ++pos2;
            }
        }
        answer.appendCopies(a1, pos1, length1);
        answer.appendCopies(a2, pos2, length2);
        return new RoaringBitmap(answer);
    }

    /**
     * Bitwise AND (intersection) operation. The provided bitmaps are *not* modified.
     *
     * @param x1 first bitmap
     * @param x2 other bitmap
     * @return result of the operation
     */
    public static RoaringBitmap and(final RoaringBitmap x1, final RoaringBitmap x2) {
        final RoaringArray a1 = x1.highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(Math.min(a1.size(), a2.size()));
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).and(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    answer.append(c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                ++pos1;
            } else {
                ++pos2;
            }
        }
        return new RoaringBitmap(answer);
    }

    /**
     * Bitwise ANDNOT (difference) operation. The provided bitmaps are *not* modified.
     *
     * @param x1 first bitmap
     * @param x2 other bitmap
     * @return the values of x1 that are not in x2
     */
    public static RoaringBitmap andNot(final RoaringBitmap x1, final RoaringBitmap x2) {
        final RoaringArray a1 = x1.highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(a1.size());
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).andNot(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    answer.append(c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                answer.append(a1.getContainerAtIndex(pos1).clone());
                ++pos1;
            } else {
                ++pos2;
            }
        }
        answer.appendCopies(a1, pos1, length1);
        return new RoaringBitmap(answer);
    }

    /**
     * Bitwise XOR (symmetric difference) operation. The provided bitmaps are *not* modified.
     *
     * @param x1 first bitmap
     * @param x2 other bitmap
     * @return result of the operation
     */
    public static RoaringBitmap xor(final RoaringBitmap x1, final RoaringBitmap x2) {
        final RoaringArray a1 = x1.highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(a1.size() + a2.size());
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).xor(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    answer.append(c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                answer.append(a1.getContainerAtIndex(pos1).clone());
                ++pos1;
            } else {
                answer.append(a2.getContainerAtIndex(pos2).clone());
                ++pos2;
            }
        }
        answer.appendCopies(a1, pos1, length1);
        answer.appendCopies(a2, pos2, length2);
        return new RoaringBitmap(answer);
    }

    /**
     * In-place bitwise OR (union) operation. The current bitmap is modified.
     *
     * @param x2 other bitmap
     */
    public void or(final RoaringBitmap x2) {
        if (x2 == this) {
            return;
        }
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(a1.size() + a2.size());
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                answer.append(a1.getContainerAtIndex(pos1).or(a2.getContainerAtIndex(pos2)));
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                // our own containers move over without a copy
                answer.append(a1.getContainerAtIndex(pos1));
                ++pos1;
            } else {
                answer.append(a2.getContainerAtIndex(pos2).clone());
                ++pos2;
            }
        }
        while (pos1 < length1) {
            answer.append(a1.getContainerAtIndex(pos1++));
        }
        answer.appendCopies(a2, pos2, length2);
        highLowContainer = answer;
        cardinality = answer.getLongCardinality();
    }

    /**
     * In-place bitwise AND (intersection) operation. The current bitmap is modified.
     *
     * @param x2 other bitmap
     */
    public void and(final RoaringBitmap x2) {
        if (x2 == this) {
            return;
        }
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        int pos1 = 0;
        int pos2 = 0;
        int intersectionSize = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).and(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    a1.setContainerAtIndex(intersectionSize++, c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                ++pos1;
            } else {
                ++pos2;
            }
        }
        a1.resize(intersectionSize);
        cardinality = a1.getLongCardinality();
    }

    /**
     * In-place bitwise ANDNOT (difference) operation. The current bitmap is modified.
     *
     * @param x2 other bitmap
     */
    public void andNot(final RoaringBitmap x2) {
        if (x2 == this) {
            clear();
            return;
        }
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        int pos1 = 0;
        int pos2 = 0;
        int kept = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).andNot(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    a1.setContainerAtIndex(kept++, c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                a1.setContainerAtIndex(kept++, a1.getContainerAtIndex(pos1));
                ++pos1;
            } else {
                ++pos2;
            }
        }
        while (pos1 < length1) {
            a1.setContainerAtIndex(kept++, a1.getContainerAtIndex(pos1++));
        }
        a1.resize(kept);
        cardinality = a1.getLongCardinality();
    }

    /**
     * In-place bitwise XOR (symmetric difference) operation. The current bitmap is modified.
     *
     * @param x2 other bitmap
     */
    public void xor(final RoaringBitmap x2) {
        if (x2 == this) {
            clear();
            return;
        }
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = x2.highLowContainer;
        final RoaringArray answer = new RoaringArray(a1.size() + a2.size());
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                final Container c = a1.getContainerAtIndex(pos1).xor(a2.getContainerAtIndex(pos2));
                if (c != null) {
                    answer.append(c);
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                answer.append(a1.getContainerAtIndex(pos1));
                ++pos1;
            } else {
                answer.append(a2.getContainerAtIndex(pos2).clone());
                ++pos2;
            }
        }
        while (pos1 < length1) {
            answer.append(a1.getContainerAtIndex(pos1++));
        }
        answer.appendCopies(a2, pos2, length2);
        highLowContainer = answer;
        cardinality = answer.getLongCardinality();
    }

    /**
     * Checks whether every value of this bitmap is also in {@code other}.
     *
     * @param other candidate superset
     * @return true if this bitmap is a subset of {@code other}
     */
    public boolean isSubset(final RoaringBitmap other) {
        if (cardinality > other.cardinality) {
            return false;
        }
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = other.highLowContainer;
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1) {
            if (pos2 == length2) {
                return false;
            }
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                if (!a1.getContainerAtIndex(pos1).isSubset(a2.getContainerAtIndex(pos2))) {
                    return false;
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                return false;
            } else {
                ++pos2;
            }
        }
        return true;
    }

    /**
     * Checks whether the two bitmaps share at least one value. Cheaper than
     * computing the intersection.
     *
     * @param other other bitmap
     * @return true if they intersect
     */
    public boolean intersects(final RoaringBitmap other) {
        final RoaringArray a1 = highLowContainer;
        final RoaringArray a2 = other.highLowContainer;
        int pos1 = 0;
        int pos2 = 0;
        final int length1 = a1.size();
        final int length2 = a2.size();
        while (pos1 < length1 && pos2 < length2) {
            final int s1 = Util.toIntUnsigned(a1.getKeyAtIndex(pos1));
            final int s2 = Util.toIntUnsigned(a2.getKeyAtIndex(pos2));
            if (s1 == s2) {
                if (a1.getContainerAtIndex(pos1).intersects(a2.getContainerAtIndex(pos2))) {
                    return true;
                }
                ++pos1;
                ++pos2;
            } else if (s1 < s2) {
                ++pos1;
            } else {
                ++pos2;
            }
        }
        return false;
    }

    /**
     * Remove from the current bitmap all integers in [rangeStart,rangeEnd).
     * Containers entirely inside the range are dropped without looking at
     * their values.
     *
     * @param rangeStart inclusive beginning of range, in [0, 0xffffffff + 1]
     * @param rangeEnd exclusive ending of range, in [0, 0xffffffff + 1]
     * @return how many values were removed
     */
    public long removeRange(final long rangeStart, final long rangeEnd) {
        Util.rangeSanityCheck(rangeStart, rangeEnd);
        if (rangeStart >= rangeEnd) {
            return 0; // empty range
        }
        final int hbStart = Util.toIntUnsigned(Util.highbits(rangeStart));
        final int lbStart = (int) (rangeStart & 0xFFFF);
        final int hbLast = Util.toIntUnsigned(Util.highbits(rangeEnd - 1));
        final int lbEnd = (int) ((rangeEnd - 1) & 0xFFFF) + 1;

        final RoaringArray array = highLowContainer;
        int begin = array.getIndex((short) hbStart);
        if (begin < 0) {
            begin = -begin - 1;
        }
        int end = array.getIndex((short) hbLast);
        end = end >= 0 ? end + 1 : -end - 1;

        long removed = 0;
        int kept = begin;
        for (int i = begin; i < end; ++i) {
            final Container c = array.getContainerAtIndex(i);
            final int key = Util.toIntUnsigned(c.key);
            final int lo = key == hbStart ? lbStart : 0;
            final int hi = key == hbLast ? lbEnd : BitmapStore.MAX_CAPACITY;
            if (lo == 0 && hi == BitmapStore.MAX_CAPACITY) {
                removed += c.getCardinality();
                continue;
            }
            removed += c.removeRange(lo, hi);
            if (c.getCardinality() > 0) {
                array.setContainerAtIndex(kept++, c);
            }
        }
        array.removeIndexRange(kept, end);
        cardinality -= removed;
        return removed;
    }

    @Override
    public IntIterator getIntIterator() {
        return new RoaringIntIterator(highLowContainer);
    }

    /**
     * @return the values, in ascending unsigned order
     */
    public int[] toArray() {
        final int[] array = new int[getCardinality()];
        int pos = 0;
        for (int i = 0; i < highLowContainer.size(); ++i) {
            final Container c = highLowContainer.getContainerAtIndex(i);
            final int hs = Util.toIntUnsigned(c.key) << 16;
            final ShortIterator it = c.getShortIterator();
            while (it.hasNext()) {
                array[pos++] = hs | it.nextAsInt();
            }
        }
        return array;
    }

    /**
     * Estimate of the memory usage of this data structure.
     */
    @Override
    public int getSizeInBytes() {
        return (int) highLowContainer.getLongSizeInBytes();
    }

    /**
     * Serialize this bitmap in the portable format shared with the C, Go,
     * Rust and Java roaring implementations (without run containers). Write
     * to a {@code java.io.DataOutputStream} to target a byte stream.
     * <p>
     * The current bitmap is not modified.
     *
     * @param out the DataOutput stream
     * @throws IOException Signals that an I/O exception has occurred.
     */
    public void serialize(final DataOutput out) throws IOException {
        highLowContainer.serialize(out);
    }

    /**
     * Report the number of bytes required to serialize this bitmap. This is
     * the number of bytes written out when using the serialize method.
     *
     * @return the size in bytes
     */
    public int serializedSizeInBytes() {
        return highLowContainer.serializedSizeInBytes();
    }

    /**
     * Read a bitmap written by {@link #serialize(DataOutput)} or by another
     * implementation of the portable format.
     *
     * @param in the DataInput stream
     * @return a complete bitmap, never a partially read one
     * @throws UnsupportedRoaringFormatException if the stream uses run containers
     * @throws InvalidRoaringFormatException if the stream is corrupt
     * @throws IOException if {@code in} fails or ends early
     */
    public static RoaringBitmap deserialize(final DataInput in) throws IOException {
        return new RoaringBitmap(RoaringArray.deserialize(in));
    }

    @Override
    public RoaringBitmap clone() {
        return new RoaringBitmap(highLowContainer.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof RoaringBitmap) {
            final RoaringBitmap srb = (RoaringBitmap) o;
            return srb.cardinality == cardinality && srb.highLowContainer.equals(highLowContainer);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return highLowContainer.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder answer = new StringBuilder("{");
        final IntIterator i = getIntIterator();
        int printed = 0;
        while (i.hasNext()) {
            if (printed > 0) {
                answer.append(',');
            }
            if (printed++ == 1024) {
                answer.append("...");
                break;
            }
            answer.append(Integer.toUnsignedString(i.next()));
        }
        return answer.append('}').toString();
    }

    private static final class RoaringIntIterator implements IntIterator {

        private final RoaringArray array;

        private int pos;

        private int hs;

        private ShortIterator iter;

        RoaringIntIterator(RoaringArray array) {
            this.array = array;
            this.pos = 0;
            nextContainer();
        }

        private RoaringIntIterator(RoaringIntIterator other) {
            this.array = other.array;
            this.pos = other.pos;
            this.hs = other.hs;
            this.iter = other.iter == null ? null : other.iter.clone();
        }

        private void nextContainer() {
            if (pos < array.size()) {
                final Container c = array.getContainerAtIndex(pos);
                iter = c.getShortIterator();
                hs = Util.toIntUnsigned(c.key) << 16;
            }
        }

        @Override
        public boolean hasNext() {
            return pos < array.size();
        }

        @Override
        public int next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final int x = iter.nextAsInt() | hs;
            if (!iter.hasNext()) {
                ++pos;
                nextContainer();
            }
            return x;
        }

        @Override
        public IntIterator clone() {
            return new RoaringIntIterator(this);
        }
    }
}
