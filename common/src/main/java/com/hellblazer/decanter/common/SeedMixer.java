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
 * Integer hashing used to derive independent seed streams.
 * <p>
 * All functions are pure: the same inputs give the same output on every platform.
 *
 * @author hal.hildebrand
 */
public final class SeedMixer {

    private static final long GOLDEN_64  = 0x9E3779B97F4A7C15L;
    private static final int  FNV_OFFSET = 0x811C9DC5;
    private static final int  FNV_PRIME  = 16777619;

    private SeedMixer() {
    }

    /**
     * SplitMix64 finalizer.
     */
    public static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /**
     * Derive the seed of one stream from a base seed and a stream index (level, attempt, candidate).
     */
    public static long mix(long seed, int stream) {
        return mix64(seed + (stream + 1L) * GOLDEN_64);
    }

    /**
     * 32 bit avalanche hash of a level index, used for per level coin flips that must not depend on the seed.
     */
    public static int levelHash(int level) {
        int v = level;
        v ^= 0x9E3779B9;
        v *= 0x85EBCA6B;
        v ^= v >>> 13;
        v *= 0xC2B2AE35;
        v ^= v >>> 16;
        return v;
    }

    /**
     * FNV-1a style seed for the {@code candidate}th alternative of a level. Always non-negative.
     */
    public static long candidateSeed(int level, int candidate) {
        int h = FNV_OFFSET;
        h = (h ^ level) * FNV_PRIME;
        h = (h ^ candidate) * FNV_PRIME;
        h = (h ^ (level >>> 16)) * FNV_PRIME;
        h = (h ^ (candidate * 31)) * FNV_PRIME;
        return h & 0x7FFFFFFFL;
    }

    /**
     * Seed for the {@code attempt}th caller side retry of a seed. Attempt zero is the seed itself.
     */
    public static long perturb(long seed, int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative: " + attempt);
        }
        return attempt == 0 ? seed : mix(seed ^ 0x5DEECE66DL, attempt);
    }
}
