/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.*;

public class TestSerialization {

    private static byte[] toBytes(RoaringBitmap bitmap) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bos);
        bitmap.serialize(out);
        out.flush();
        return bos.toByteArray();
    }

    private static RoaringBitmap fromBytes(byte[] bytes) throws IOException {
        return RoaringBitmap.deserialize(new DataInputStream(new ByteArrayInputStream(bytes)));
    }

    private static ByteBuffer littleEndian(int capacity) {
        return ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    public void testTwoValuesLayout() throws IOException {
        RoaringBitmap bitmap = new RoaringBitmap();
        bitmap.add(1);
        bitmap.add(2);
        byte[] expected = {
            0x3A, 0x30, 0x00, 0x00, // cookie 12346
            0x01, 0x00, 0x00, 0x00, // one container
            0x00, 0x00, 0x01, 0x00, // key 0, cardinality - 1 = 1
            0x10, 0x00, 0x00, 0x00, // data starts at byte 16
            0x01, 0x00, 0x02, 0x00
        };
        assertArrayEquals(expected, toBytes(bitmap));
        assertEquals(expected.length, bitmap.serializedSizeInBytes());
    }

    @Test
    public void testEmptyBitmap() throws IOException {
        byte[] empty = {0x3A, 0x30, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00};
        RoaringBitmap bitmap = fromBytes(empty);
        assertEquals(0, bitmap.getLongCardinality());
        assertTrue(bitmap.isEmpty());
        assertArrayEquals(empty, toBytes(new RoaringBitmap()));
        assertEquals(8, new RoaringBitmap().serializedSizeInBytes());
    }

    @Test
    public void testBitmapContainerLayout() throws IOException {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (int i = 0; i < 4096; ++i) {
            bitmap.add((3 << 16) + i);
        }
        byte[] bytes = toBytes(bitmap);
        assertEquals(8 + 8 + 8192, bytes.length);
        assertEquals(bytes.length, bitmap.serializedSizeInBytes());
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(12346, buffer.getInt(0));
        assertEquals(1, buffer.getInt(4));
        assertEquals(3, buffer.getShort(8));
        assertEquals(4095, buffer.getShort(10));
        assertEquals(16, buffer.getInt(12));
        // the first 64 words are full, the rest empty
        assertEquals(-1L, buffer.getLong(16));
        assertEquals(-1L, buffer.getLong(16 + 63 * 8));
        assertEquals(0L, buffer.getLong(16 + 64 * 8));
        assertEquals(bitmap, fromBytes(bytes));
    }

    @Test
    public void testOffsetsAndSizes() throws IOException {
        RoaringBitmap bitmap = RoaringBitmap.bitmapOf(5, 6, 7, 65536 * 9);
        for (int i = 0; i < 5000; ++i) {
            bitmap.add(65536 * 4 + i * 3);
        }
        byte[] bytes = toBytes(bitmap);
        int expected = 8 + (8 + 3 * 2) + (8 + 8192) + (8 + 2);
        assertEquals(expected, bytes.length);
        assertEquals(expected, bitmap.serializedSizeInBytes());

        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int header = 8 + 8 * 3;
        assertEquals(header, buffer.getInt(20));
        assertEquals(header + 6, buffer.getInt(24));
        assertEquals(header + 6 + 8192, buffer.getInt(28));
    }

    @Test
    public void testRoundTrip() throws IOException {
        Random r = new Random(3141592L);
        for (int round = 0; round < 10; ++round) {
            RoaringBitmap bitmap = new RoaringBitmap();
            int chunks = r.nextInt(20);
            for (int c = 0; c < chunks; ++c) {
                int key = r.nextInt(65536);
                int count = r.nextBoolean() ? 1 + r.nextInt(100) : 4000 + r.nextInt(60000);
                for (int i = 0; i < count; ++i) {
                    bitmap.add((key << 16) | r.nextInt(65536));
                }
            }
            byte[] bytes = toBytes(bitmap);
            assertEquals(bitmap.serializedSizeInBytes(), bytes.length);
            RoaringBitmap copy = fromBytes(bytes);
            assertEquals(bitmap, copy);
            assertEquals(bitmap.getLongCardinality(), copy.getLongCardinality());
            assertArrayEquals(bitmap.toArray(), copy.toArray());
        }
    }

    @Test
    public void testOffsetsAreNotUsedOnRead() throws IOException {
        RoaringBitmap bitmap = RoaringBitmap.bitmapOf(1, 2, 3, 1 << 20);
        byte[] bytes = toBytes(bitmap);
        Arrays.fill(bytes, 8 + 4 * 2, 8 + 8 * 2, (byte) 0x7F);
        assertEquals(bitmap, fromBytes(bytes));
    }

    @Test(expected = UnsupportedRoaringFormatException.class)
    public void testRunContainerCookieIsUnsupported() throws IOException {
        ByteBuffer buffer = littleEndian(16);
        buffer.putInt(12347 | (2 << 16));
        fromBytes(buffer.array());
    }

    @Test
    public void testUnknownCookie() throws IOException {
        byte[] bytes = {0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00};
        try {
            fromBytes(bytes);
            fail();
        } catch (InvalidRoaringFormatException expected) {
            assertTrue(expected.getMessage().contains("cookie"));
        }
    }

    @Test
    public void testTooManyContainers() throws IOException {
        for (int count : new int[] {65536, -1}) {
            ByteBuffer buffer = littleEndian(8);
            buffer.putInt(12346);
            buffer.putInt(count);
            try {
                fromBytes(buffer.array());
                fail();
            } catch (InvalidRoaringFormatException expected) {
                // ok
            }
        }
    }

    @Test(expected = EOFException.class)
    public void testTruncatedStream() throws IOException {
        byte[] bytes = toBytes(RoaringBitmap.bitmapOf(1, 2, 3, 100000));
        fromBytes(Arrays.copyOf(bytes, bytes.length - 1));
    }

    @Test(expected = EOFException.class)
    public void testTruncatedHeader() throws IOException {
        fromBytes(new byte[] {0x3A, 0x30, 0x00, 0x00, 0x02});
    }

    @Test(expected = InvalidRoaringFormatException.class)
    public void testKeysOutOfOrder() throws IOException {
        ByteBuffer buffer = littleEndian(8 + 8 * 2 + 4);
        buffer.putInt(12346).putInt(2);
        buffer.putShort((short) 5).putShort((short) 0);
        buffer.putShort((short) 4).putShort((short) 0);
        buffer.putInt(24).putInt(26);
        buffer.putShort((short) 1).putShort((short) 1);
        fromBytes(buffer.array());
    }

    @Test(expected = InvalidRoaringFormatException.class)
    public void testArrayValuesOutOfOrder() throws IOException {
        ByteBuffer buffer = littleEndian(8 + 8 + 4);
        buffer.putInt(12346).putInt(1);
        buffer.putShort((short) 0).putShort((short) 1);
        buffer.putInt(16);
        buffer.putShort((short) 9).putShort((short) 9);
        fromBytes(buffer.array());
    }

    @Test(expected = InvalidRoaringFormatException.class)
    public void testBitmapCardinalityMismatch() throws IOException {
        ByteBuffer buffer = littleEndian(8 + 8 + 8192);
        buffer.putInt(12346).putInt(1);
        buffer.putShort((short) 0).putShort((short) 4999);
        buffer.putInt(16);
        // only 4096 bits set where 5000 are declared
        for (int i = 0; i < 64; ++i) {
            buffer.putLong(-1L);
        }
        fromBytes(buffer.array());
    }

    @Test
    public void testStoreChosenByCardinalityOnRead() throws IOException {
        RoaringBitmap threshold = new RoaringBitmap();
        for (int i = 0; i < 4096; ++i) {
            threshold.add(i * 2);
        }
        RoaringBitmap copy = fromBytes(toBytes(threshold));
        assertTrue(copy.highLowContainer.getContainerAtIndex(0).isBitmap());

        threshold.remove(0);
        copy = fromBytes(toBytes(threshold));
        assertFalse(copy.highLowContainer.getContainerAtIndex(0).isBitmap());
        assertEquals(8 + 8 + 4095 * 2, threshold.serializedSizeInBytes());
    }
}
