/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The containers of a {@link RoaringBitmap}, sorted by strictly ascending
 * unsigned key. Also reads and writes the portable serialization format
 * without run containers. This is not meant to be used by end users.
 */
final class RoaringArray implements Cloneable {

    static final int SERIAL_COOKIE_NO_RUNCONTAINER = 12346;

    static final int SERIAL_COOKIE = 12347;

    /**
     * Largest container count a serialized bitmap may declare.
     */
    static final int MAX_SERIALIZED_CONTAINERS = 0xFFFF;

    static final int INITIAL_CAPACITY = 4;

    private static final Logger logger = Logger.getLogger(RoaringArray.class.getName());

    Container[] containers;

    int size = 0;

    RoaringArray() {
        this(INITIAL_CAPACITY);
    }

    RoaringArray(final int capacity) {
        this.containers = new Container[Math.max(capacity, 1)];
    }

    int size() {
        return size;
    }

    Container getContainerAtIndex(final int i) {
        return containers[i];
    }

    short getKeyAtIndex(final int i) {
        return containers[i].key;
    }

    void setContainerAtIndex(final int i, final Container c) {
        containers[i] = c;
    }

    /**
     * @return the index of the container for {@code key}, or
     *         {@code -(insertion point) - 1} if there is none
     */
    int getIndex(final short key) {
        // before the binary search, we optimize for appends
        if ((size == 0) || (containers[size - 1].key == key)) {
            return size - 1;
        }
        final int ikey = Util.toIntUnsigned(key);
        int low = 0;
        int high = size - 1;
        while (low <= high) {
            final int middleIndex = (low + high) >>> 1;
            final int middleKey = Util.toIntUnsigned(containers[middleIndex].key);
            if (middleKey < ikey) {
                low = middleIndex + 1;
            } else if (middleKey > ikey) {
                high = middleIndex - 1;
            } else {
                return middleIndex;
            }
        }
        return -(low + 1);
    }

    Container getContainer(final short key) {
        final int i = getIndex(key);
        return i < 0 ? null : containers[i];
    }

    /**
     * Appends {@code c}, whose key must be greater than every key already present.
     */
    void append(final Container c) {
        extendArray(1);
        containers[size++] = c;
    }

    /**
     * Appends clones of the containers in {@code [begin, end)} of {@code source}.
     */
    void appendCopies(final RoaringArray source, final int begin, final int end) {
        extendArray(end - begin);
        for (int i = begin; i < end; ++i) {
            containers[size++] = source.containers[i].clone();
        }
    }

    // insert a new key, it is assumed that it does not exist
    void insertNewContainerAt(final int i, final Container c) {
        extendArray(1);
        System.arraycopy(containers, i, containers, i + 1, size - i);
        containers[i] = c;
        ++size;
    }

    void removeAtIndex(final int i) {
        System.arraycopy(containers, i + 1, containers, i, size - i - 1);
        containers[--size] = null;
    }

    void removeIndexRange(final int begin, final int end) {
        if (end <= begin) {
            return;
        }
        final int range = end - begin;
        System.arraycopy(containers, end, containers, begin, size - end);
        Arrays.fill(containers, size - range, size, null);
        size -= range;
    }

    void resize(final int newLength) {
        Arrays.fill(containers, newLength, size, null);
        size = newLength;
    }

    // make sure there is capacity for at least k more elements
    private void extendArray(final int k) {
        if (size + k > containers.length) {
            int newCapacity;
            if (containers.length < 1024) {
                newCapacity = 2 * (size + k);
            } else {
                newCapacity = 5 * (size + k) / 4;
            }
            containers = Arrays.copyOf(containers, newCapacity);
        }
    }

    void clear() {
        containers = new Container[INITIAL_CAPACITY];
        size = 0;
    }

    long getLongCardinality() {
        long cardinality = 0;
        for (int i = 0; i < size; ++i) {
            cardinality += containers[i].getCardinality();
        }
        return cardinality;
    }

    long getLongSizeInBytes() {
        long bytes = 8;
        for (int i = 0; i < size; ++i) {
            bytes += 8 + containers[i].getSizeInBytes();
        }
        return bytes;
    }

    @Override
    public RoaringArray clone() {
        final RoaringArray answer = new RoaringArray(size);
        answer.appendCopies(this, 0, size);
        return answer;
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof RoaringArray) {
            final RoaringArray other = (RoaringArray) o;
            if (other.size != size) {
                return false;
            }
            for (int i = 0; i < size; ++i) {
                if (!containers[i].equals(other.containers[i])) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    @Override
    public int hashCode() {
        int hashvalue = 0;
        for (int i = 0; i < size; ++i) {
            hashvalue = 31 * hashvalue + containers[i].hashCode();
        }
        return hashvalue;
    }

    private int headerSize() {
        // cookie, count, then a descriptor and an offset per container
        return 4 + 4 + 8 * size;
    }

    /**
     * @return the exact number of bytes {@link #serialize(DataOutput)} writes
     */
    int serializedSizeInBytes() {
        int count = headerSize();
        for (int i = 0; i < size; ++i) {
            count += containers[i].store.serializedSizeInBytes();
        }
        return count;
    }

    /**
     * Writes the containers in the portable little endian format.
     */
    void serialize(final DataOutput out) throws IOException {
        out.writeInt(Integer.reverseBytes(SERIAL_COOKIE_NO_RUNCONTAINER));
        out.writeInt(Integer.reverseBytes(size));
        for (int k = 0; k < size; ++k) {
            out.writeShort(Short.reverseBytes(containers[k].key));
            out.writeShort(Short.reverseBytes((short) (containers[k].getCardinality() - 1)));
        }
        int offset = headerSize();
        for (int k = 0; k < size; ++k) {
            out.writeInt(Integer.reverseBytes(offset));
            offset += containers[k].store.serializedSizeInBytes();
        }
        for (int k = 0; k < size; ++k) {
            containers[k].store.writeArray(out);
        }
    }

    /**
     * Reads a complete container array. Nothing is returned unless the whole
     * stream was valid.
     *
     * @throws UnsupportedRoaringFormatException if the stream uses run containers
     * @throws InvalidRoaringFormatException if the stream is corrupt
     * @throws IOException if {@code in} fails or ends early
     */
    static RoaringArray deserialize(final DataInput in) throws IOException {
        final int cookie = Integer.reverseBytes(in.readInt());
        if (cookie != SERIAL_COOKIE_NO_RUNCONTAINER) {
            if ((cookie & 0xFFFF) == SERIAL_COOKIE) {
                throw rejected(new UnsupportedRoaringFormatException("run containers are unsupported"));
            }
            throw rejected(new InvalidRoaringFormatException("unknown cookie value: " + cookie));
        }
        final long declaredSize = Integer.toUnsignedLong(Integer.reverseBytes(in.readInt()));
        if (declaredSize > MAX_SERIALIZED_CONTAINERS) {
            throw rejected(new InvalidRoaringFormatException(
                    "container count " + declaredSize + " is greater than supported"));
        }
        final int containerCount = (int) declaredSize;

        final short[] keys = new short[containerCount];
        final int[] cardinalities = new int[containerCount];
        for (int k = 0; k < containerCount; ++k) {
            keys[k] = Short.reverseBytes(in.readShort());
            cardinalities[k] = 1 + (0xFFFF & Short.reverseBytes(in.readShort()));
            if (k > 0 && Util.compareUnsigned(keys[k - 1], keys[k]) >= 0) {
                throw rejected(new InvalidRoaringFormatException("container keys are not strictly ascending at "
                        + Util.toIntUnsigned(keys[k])));
            }
        }

        // container boundaries follow from the cardinalities, offsets are not needed
        in.readFully(new byte[4 * containerCount]);

        final RoaringArray answer = new RoaringArray(containerCount);
        for (int k = 0; k < containerCount; ++k) {
            final Store store;
            if (cardinalities[k] < Container.ARRAY_MAX_SIZE) {
                store = readArrayStore(in, keys[k], cardinalities[k]);
            } else {
                store = readBitmapStore(in, keys[k], cardinalities[k]);
            }
            answer.append(new Container(keys[k], cardinalities[k], store));
        }
        logger.log(Level.FINER, "read {0} containers", containerCount);
        return answer;
    }

    private static ArrayStore readArrayStore(final DataInput in, final short key, final int cardinality)
            throws IOException {
        final short[] content = new short[cardinality];
        for (int i = 0; i < cardinality; ++i) {
            content[i] = Short.reverseBytes(in.readShort());
            if (i > 0 && Util.compareUnsigned(content[i - 1], content[i]) >= 0) {
                throw rejected(new InvalidRoaringFormatException("values of container "
                        + Util.toIntUnsigned(key) + " are not strictly ascending"));
            }
        }
        return new ArrayStore(content, cardinality);
    }

    private static BitmapStore readBitmapStore(final DataInput in, final short key, final int cardinality)
            throws IOException {
        final long[] words = new long[BitmapStore.WORD_COUNT];
        for (int i = 0; i < words.length; ++i) {
            words[i] = Long.reverseBytes(in.readLong());
        }
        final BitmapStore store = new BitmapStore(words);
        final int actual = store.cardinality();
        if (actual != cardinality) {
            throw rejected(new InvalidRoaringFormatException("container " + Util.toIntUnsigned(key)
                    + " declares " + cardinality + " values but holds " + actual));
        }
        return store;
    }

    private static <E extends IOException> E rejected(final E e) {
        logger.log(Level.FINE, "rejecting serialized bitmap: {0}", e.getMessage());
        return e;
    }
}
