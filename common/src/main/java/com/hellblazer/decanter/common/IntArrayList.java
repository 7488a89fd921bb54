/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Decanter.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.decanter.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Unboxed, append mostly list of ints. Backs the solver's node arena, where millions of parent links and packed moves
 * would otherwise be boxed.
 *
 * @author hal.hildebrand
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 16;

    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        array = new int[Math.max(1, initialCapacity)];
    }

    public static IntArrayList of(int... values) {
        var list = new IntArrayList(values.length);
        System.arraycopy(values, 0, list.array, 0, values.length);
        list.size = values.length;
        return list;
    }

    /**
     * Append an element.
     *
     * @return the index of the appended element
     */
    public int addInt(int element) {
        if (size == array.length) {
            if (size == Integer.MAX_VALUE - 8) {
                throw new OutOfMemoryError("IntArrayList at maximum size");
            }
            // grow by 1.5x
            long length = Math.min(Integer.MAX_VALUE - 8L, ((size * 3L) / 2) + 1);
            array = Arrays.copyOf(array, (int) length);
        }
        array[size] = element;
        return size++;
    }

    public void clear() {
        size = 0;
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int setInt(int index, int element) {
        ensureIndexInRange(index);
        int previous = array[index];
        array[index] = element;
        return previous;
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntArrayList other) || size != other.size) {
            return false;
        }
        return Arrays.equals(array, 0, size, other.array, 0, size);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index:" + index + ", Size:" + size);
        }
    }
}
