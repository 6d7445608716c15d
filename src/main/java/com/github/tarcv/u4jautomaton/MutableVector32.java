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
 * Growable array of ints without boxing. Used as a list, and as a stack through
 * {@link #push(int)} / {@link #popi()}.
 */
final class MutableVector32 {
    private int[] buffer;
    private int length = 0;

    public MutableVector32() {
        this(-1);
    }

    public MutableVector32(final int initialCapacity) {
        int fixedCapacity = initialCapacity;
        if (fixedCapacity < 1) {
            fixedCapacity = 32;
        }
        buffer = new int[fixedCapacity];
    }

    public boolean isEmpty() { return length == 0; }
    public int size() { return length; }
    public int elementAti(final int i) {
        if (i >= length) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for length " + length);
        }
        return buffer[i];
    }
    public void addElement(final int e) {
        ensureCapacity(length + 1);
        buffer[length++] = e;
    }
    public void setElementAt(final int elem, final int index) {
        if (index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        }
        buffer[index] = elem;
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

    public int popi() {
        int result = 0;
        if (length > 0) {
            length--;
            result = buffer[length];
        }
        return result;
    }

    public int push(final int i) {
        addElement(i);
        return i;
    }

    /**
     * Change the size of this vector as follows: If newSize is smaller,
     * then truncate the array, possibly deleting held elements for i >=
     * newSize.  If newSize is larger, grow the array, filling in new
     * slots with 0.
     */
    void setSize(final int newSize) {
        if (newSize < 0) {
            return;
        }
        if (newSize > length) {
            ensureCapacity(newSize);
            Arrays.fill(buffer, length, newSize, 0);
        }
        length = newSize;
    }

    int[] toArray() {
        return Arrays.copyOf(buffer, length);
    }
}
