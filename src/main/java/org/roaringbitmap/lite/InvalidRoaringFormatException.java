/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.IOException;

/**
 * Thrown when a serialized bitmap is corrupt or is not a roaring bitmap at all.
 */
public class InvalidRoaringFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public InvalidRoaringFormatException(String message) {
        super(message);
    }
}
