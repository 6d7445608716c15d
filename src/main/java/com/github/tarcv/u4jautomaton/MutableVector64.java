// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
/*
 *******************************************************************************
 * Copyright (C) 2014, International Business Machines Corporation and
 * others. All Rights Reserved.
 *******************************************************************************
 */
package com.github.tarcv.u4jautomaton;

import java.util.Arrays;

/**
 * Growable array of longs without boxing, for packed sort keys.
 */
final class MutableVector64 {
    private long[] buffer = new long[32];
    private int length = 0;

    public int size() { return length; }
    public long elementAti(final int i) {
        if (i >= length) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for length " + length);
        }
        return buffer[i];
    }

    public void addElement(final long e) {
        ensureCapacity(length + 1);
        buffer[length++] = e;
    }

    public void removeAllElements() {
        length = 0;
    }

    void ensureCapacity(final int minimumCapacity) {
        if (minimumCapacity < 0) {
            throw new IllegalArgumentException();
        }
        if (buffer.length >= minimumCapacity) {
            return;
        }
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }

    /**
     * Sort the held elements in ascending order.
     */
    void sort() {
        Arrays.sort(buffer, 0, length);
    }
}
