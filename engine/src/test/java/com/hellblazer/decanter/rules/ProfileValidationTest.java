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
package com.hellblazer.decanter.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ProfileValidationTest {

    private static final CapacityProfile      POOL          = new CapacityProfile(new int[] { 4 }, 1, 0, 0);
    private static final FragmentationProfile FRAGMENTATION = new FragmentationProfile(1.0, 0.0, 1);

    @Test
    void testCapacityPoolIsCopied() {
        var pool = new int[] { 2, 3, 6 };
        var profile = new CapacityProfile(pool, 2, 1, 1);
        pool[0] = 99;
        assertArrayEquals(new int[] { 2, 3, 6 }, profile.capacityPool());
        profile.capacityPool()[1] = 42;
        assertArrayEquals(new int[] { 2, 3, 6 }, profile.capacityPool());
        assertEquals(2, profile.minCapacity());
        assertEquals(6, profile.maxCapacity());
        assertEquals(new CapacityProfile(new int[] { 2, 3, 6 }, 2, 1, 1), profile);
    }

    @Test
    void testCapacityProfileRejects() {
        assertThrows(IllegalArgumentException.class, () -> new CapacityProfile(new int[0], 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new CapacityProfile(new int[] { 4, 3 }, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new CapacityProfile(new int[] { 4 }, 2, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new CapacityProfile(new int[] { 4, 5 }, 1, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CapacityProfile(new int[] { 4, 5 }, 1, 0, 1));
    }

    @Test
    void testDifficultyProfileCounts() {
        var optional = new DifficultyProfile(5, LevelBand.A, POOL, FRAGMENTATION, 4, 2, 1, 8, 4, false);
        assertEquals(7, optional.bottleCount());
        assertEquals(6, optional.regularBottleCount());

        var required = new DifficultyProfile(5, LevelBand.A, POOL, FRAGMENTATION, 4, 2, 1, 8, 4, true);
        assertEquals(6, required.bottleCount());
        assertEquals(5, required.regularBottleCount());
        assertEquals(3, required.withReverseMoveCount(3).reverseMoveCount());
        assertEquals(7, required.withTargetOptimalMoves(7).targetOptimalMoves());
        assertEquals(4, required.withReverseMoveCount(3).targetOptimalMoves());
    }

    @Test
    void testDifficultyProfileRejects() {
        assertThrows(IllegalArgumentException.class,
                     () -> new DifficultyProfile(0, LevelBand.A, POOL, FRAGMENTATION, 3, 2, 0, 6, 4, false));
        assertThrows(IllegalArgumentException.class,
                     () -> new DifficultyProfile(1, LevelBand.A, POOL, FRAGMENTATION, 3, 2, 0, 6, 4, true));
        assertThrows(IllegalArgumentException.class,
                     () -> new DifficultyProfile(1, LevelBand.A, POOL, FRAGMENTATION, 8, 2, 0, 6, 4, false));
        assertThrows(NullPointerException.class,
                     () -> new DifficultyProfile(1, null, POOL, FRAGMENTATION, 3, 2, 0, 6, 4, false));
        assertThrows(IllegalArgumentException.class,
                     () -> new DifficultyProfile(1, LevelBand.A, POOL, FRAGMENTATION, 3, 2, 0, 6, 0, false));
    }

    @Test
    void testFragmentationProfileRejects() {
        assertThrows(IllegalArgumentException.class, () -> new FragmentationProfile(0.5, 0.0, 0));
        assertThrows(IllegalArgumentException.class, () -> new FragmentationProfile(1.0, -0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> new FragmentationProfile(1.0, 0.0, -1));
    }
}
