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

/**
 * Platform independent pseudo-random sequence.
 * <p>
 * A 32 bit mulberry style generator: every operation is plain two's complement integer arithmetic, so a given seed
 * produces the identical sequence on every JVM and every platform. {@link java.util.Random} makes the same promise,
 * but its sequence is tied to the JDK's algorithm; this one is tied only to the code below, which lets generated
 * levels be reproduced by any other implementation of the same mixing steps.
 * <p>
 * Usage:
 * <pre>
 * var rng = new DeterministicRandom(seed);
 * int bottle = rng.nextInt(bottleCount);
 * boolean flip = rng.nextBoolean();
 * </pre>
 * Instances are mutable and not thread safe. Give each unit of work its own instance.
 *
 * @author hal.hildebrand
 */
public final class DeterministicRandom {

    private static final int    INCREMENT = 0x6D2B79F5;
    private static final double TWO_32    = 4294967296.0;

    private int state;

    /**
     * Create a generator from a 64 bit seed. The seed is folded to the 32 bit state, so seeds differing only in the
     * way they fold collide.
     *
     * @param seed the seed
     */
    public DeterministicRandom(long seed) {
        this.state = (int) (seed ^ (seed >>> 32));
    }

    /**
     * @return the next raw 32 bits of the sequence
     */
    public int nextInt() {
        state += INCREMENT;
        int z = state;
        z = (z ^ (z >>> 15)) * (z | 1);
        z ^= z + (z ^ (z >>> 7)) * (z | 61);
        return z ^ (z >>> 14);
    }

    /**
     * @param bound exclusive upper bound, must be positive
     * @return a value in {@code [0, bound)}
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (Integer.toUnsignedLong(nextInt()) % bound);
    }

    /**
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return a value in {@code [min, max]}
     */
    public int nextInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max < min: " + min + ".." + max);
        }
        return min + nextInt(max - min + 1);
    }

    /**
     * @return a value in {@code [0, 1)}
     */
    public double nextDouble() {
        return Integer.toUnsignedLong(nextInt()) / TWO_32;
    }

    public boolean nextBoolean() {
        return (nextInt() & 1) != 0;
    }

    /**
     * Shuffle the first {@code length} entries of the array in place (Fisher-Yates).
     */
    public void shuffle(int[] values, int length) {
        if (length > values.length) {
            throw new IllegalArgumentException("length exceeds array: " + length + " > " + values.length);
        }
        for (int i = length - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
