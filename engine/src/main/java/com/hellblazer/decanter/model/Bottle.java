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
package com.hellblazer.decanter.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable bottle: {@code capacity} slots filled bottom to top with colored units, optionally flagged as a sink.
 * <p>
 * Occupied slots are always contiguous from the bottom, so a bottle is fully described by its capacity, its sink flag
 * and the ordered list of occupied slots. Every "mutation" returns a new bottle, which lets search snapshots share
 * bottles freely.
 * <p>
 * A sink accepts pours like any other bottle but can never be poured from.
 *
 * @author hal.hildebrand
 */
public final class Bottle {

    private final int     capacity;
    private final boolean sink;
    /** Color codes of the occupied slots, bottom first */
    private final byte[]  contents;

    private Bottle(int capacity, boolean sink, byte[] contents) {
        this.capacity = capacity;
        this.sink = sink;
        this.contents = contents;
    }

    public static Bottle empty(int capacity) {
        return create(capacity, false, new byte[0]);
    }

    public static Bottle emptySink(int capacity) {
        return create(capacity, true, new byte[0]);
    }

    /**
     * A bottle filled to capacity with one color.
     */
    public static Bottle filled(int capacity, ColorId color, boolean sink) {
        Objects.requireNonNull(color, "color");
        var contents = new byte[capacity];
        Arrays.fill(contents, (byte) color.code());
        return create(capacity, sink, contents);
    }

    /**
     * @param capacity    slot count
     * @param bottomToTop the occupied slots, bottom first
     */
    public static Bottle of(int capacity, ColorId... bottomToTop) {
        return create(capacity, false, encode(bottomToTop));
    }

    public static Bottle sink(int capacity, ColorId... bottomToTop) {
        return create(capacity, true, encode(bottomToTop));
    }

    /**
     * Build a bottle from a full slot array, bottom first, where null marks an empty slot. The capacity is the array
     * length.
     *
     * @throws IllegalArgumentException if an occupied slot sits above an empty one
     */
    public static Bottle fromSlots(boolean sink, ColorId... slots) {
        Objects.requireNonNull(slots, "slots");
        int count = 0;
        while (count < slots.length && slots[count] != null) {
            count++;
        }
        for (int i = count; i < slots.length; i++) {
            if (slots[i] != null) {
                throw new IllegalArgumentException(
                "Occupied slot " + i + " above empty slot " + count + ": " + Arrays.toString(slots));
            }
        }
        return create(slots.length, sink, encode(Arrays.copyOf(slots, count)));
    }

    private static Bottle create(int capacity, boolean sink, byte[] contents) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        if (contents.length > capacity) {
            throw new IllegalArgumentException("Contents exceed capacity: " + contents.length + " > " + capacity);
        }
        return new Bottle(capacity, sink, contents);
    }

    private static byte[] encode(ColorId[] colors) {
        Objects.requireNonNull(colors, "colors");
        var contents = new byte[colors.length];
        for (int i = 0; i < colors.length; i++) {
            if (colors[i] == null) {
                throw new IllegalArgumentException("Null color at slot " + i);
            }
            contents[i] = (byte) colors[i].code();
        }
        return contents;
    }

    public boolean canPourInto(Bottle target) {
        return maxPourAmountInto(target) > 0;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return the occupied slots, bottom first
     */
    public List<ColorId> colors() {
        var colors = new ArrayList<ColorId>(contents.length);
        for (byte code : contents) {
            colors.add(ColorId.fromCode(code));
        }
        return Collections.unmodifiableList(colors);
    }

    /**
     * @return the length of the same-colored run at the top, zero when empty
     */
    public int contiguousTopCount() {
        int n = contents.length;
        if (n == 0) {
            return 0;
        }
        byte top = contents[n - 1];
        int run = 1;
        while (run < n && contents[n - 1 - run] == top) {
            run++;
        }
        return run;
    }

    public int count() {
        return contents.length;
    }

    /**
     * Add this bottle's unit counts into {@code volumes}, indexed by color ordinal.
     */
    public void accumulateVolumes(int[] volumes) {
        for (byte code : contents) {
            volumes[code - 1]++;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bottle other)) {
            return false;
        }
        return capacity == other.capacity && sink == other.sink && Arrays.equals(contents, other.contents);
    }

    /**
     * @return the number of contiguous same-colored runs
     */
    public int fragmentCount() {
        if (contents.length == 0) {
            return 0;
        }
        int runs = 1;
        for (int i = 1; i < contents.length; i++) {
            if (contents[i] != contents[i - 1]) {
                runs++;
            }
        }
        return runs;
    }

    public int freeSpace() {
        return capacity - contents.length;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * capacity + (sink ? 1 : 0)) + Arrays.hashCode(contents);
    }

    public boolean isEmpty() {
        return contents.length == 0;
    }

    public boolean isFull() {
        return contents.length == capacity;
    }

    public boolean isFullSolved() {
        return isFull() && isSolved();
    }

    /**
     * A full sink can take nothing more and can never be poured from.
     */
    public boolean isSealed() {
        return sink && isFull();
    }

    public boolean isSingleColorOrEmpty() {
        return contents.length == 0 || isSolved();
    }

    public boolean isSink() {
        return sink;
    }

    /**
     * @return true if the bottle is non-empty and every occupied slot holds the same color
     */
    public boolean isSolved() {
        if (contents.length == 0) {
            return false;
        }
        for (int i = 1; i < contents.length; i++) {
            if (contents[i] != contents[0]) {
                return false;
            }
        }
        return true;
    }

    /**
     * The number of units a pour from this bottle into {@code target} would move: the top run, limited by the
     * target's free space. Zero when this bottle is empty or a sink, when the target is full, or when the target's top
     * color differs.
     */
    public int maxPourAmountInto(Bottle target) {
        Objects.requireNonNull(target, "target");
        if (sink || contents.length == 0 || target.isFull()) {
            return 0;
        }
        if (!target.isEmpty() && target.topCode() != topCode()) {
            return 0;
        }
        return Math.min(contiguousTopCount(), target.freeSpace());
    }

    /**
     * @param index slot index, zero is the bottom
     * @return the color in that slot, or null when the slot is empty
     */
    public ColorId slot(int index) {
        return ColorId.fromCode(slotCode(index));
    }

    /**
     * @return the color code of the slot, zero when empty
     */
    public int slotCode(int index) {
        if (index < 0 || index >= capacity) {
            throw new IndexOutOfBoundsException("Slot:" + index + ", Capacity:" + capacity);
        }
        return index < contents.length ? contents[index] : 0;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(capacity + 1);
        if (sink) {
            sb.append('*');
        }
        for (byte code : contents) {
            sb.append(ColorId.fromCode(code).symbol());
        }
        sb.append("_".repeat(freeSpace()));
        return sb.toString();
    }

    /**
     * @return the top color, or null when empty
     */
    public ColorId topColor() {
        return ColorId.fromCode(topCode());
    }

    /**
     * Push {@code amount} units of {@code color} on top.
     */
    public Bottle withPushed(ColorId color, int amount) {
        Objects.requireNonNull(color, "color");
        if (amount < 0 || amount > freeSpace()) {
            throw new IllegalArgumentException("Cannot push " + amount + " into free space " + freeSpace());
        }
        if (amount == 0) {
            return this;
        }
        var next = Arrays.copyOf(contents, contents.length + amount);
        Arrays.fill(next, contents.length, next.length, (byte) color.code());
        return new Bottle(capacity, sink, next);
    }

    /**
     * Remove {@code amount} units from the top run.
     */
    public Bottle withTopRemoved(int amount) {
        if (amount < 0 || amount > contiguousTopCount()) {
            throw new IllegalArgumentException(
            "Cannot remove " + amount + " from top run of " + contiguousTopCount());
        }
        if (amount == 0) {
            return this;
        }
        return new Bottle(capacity, sink, Arrays.copyOf(contents, contents.length - amount));
    }

    int topCode() {
        return contents.length == 0 ? 0 : contents[contents.length - 1];
    }
}
