/*
 * (c) King.com Ltd, Galderic Punti
 * Licensed under the Apache License, Version 2.0.
 */

package org.roaringbitmap.lite;

import java.io.IOException;

/**
 * Thrown when a serialized bitmap is well formed but uses run containers,
 * which this library cannot represent.
 */
public class UnsupportedRoaringFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public UnsupportedRoaringFormatException(String message) {
        super(message);
    }
}
