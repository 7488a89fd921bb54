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

import com.hellblazer.decanter.common.SeedMixer;

/**
 * Maps a level index to its {@link DifficultyProfile}.
 * <p>
 * Every parameter ramps linearly from level 1 to {@link #MAX_EFFECTIVE_LEVEL} and holds from there on; past the
 * plateau levels differ only by their seed. Pure and stateless.
 *
 * @author hal.hildebrand
 */
public final class LevelDifficultyEngine {

    public static final int MAX_EFFECTIVE_LEVEL = 100;

    private LevelDifficultyEngine() {
    }

    public static int effectiveLevel(int levelIndex) {
        requirePositive(levelIndex);
        return Math.min(levelIndex, MAX_EFFECTIVE_LEVEL);
    }

    /**
     * Whether the level's solved configuration places a color in its sink. Roughly half the levels that have a sink
     * require it, decided by the level index alone.
     */
    public static boolean isSinkRequiredClass(int levelIndex) {
        requirePositive(levelIndex);
        return (SeedMixer.levelHash(levelIndex) & 1) == 0;
    }

    /**
     * @return 0.0 at level 1 rising to 1.0 at the plateau
     */
    public static double linearProgress(int levelIndex) {
        return (effectiveLevel(levelIndex) - 1) / (double) (MAX_EFFECTIVE_LEVEL - 1);
    }

    public static DifficultyProfile profile(int levelIndex) {
        int eff = effectiveLevel(levelIndex);
        double t = linearProgress(levelIndex);

        int sinks = ramp(0, 1, t);
        boolean sinkRequired = sinks > 0 && isSinkRequiredClass(levelIndex);
        int empties = ramp(2, 1, t);
        int colors = ramp(3, 7, t);
        int overflow = colors + empties + (sinkRequired ? 0 : sinks) - DifficultyProfile.MAX_BOTTLES;
        if (overflow > 0) {
            int reduction = Math.min(overflow, empties - 1);
            empties -= reduction;
            colors -= overflow - reduction;
        }
        int regular = colors + empties - (sinkRequired ? sinks : 0);

        int minCapacity = ramp(4, 2, t);
        int maxCapacity = ramp(4, 8, t);
        var pool = new int[maxCapacity - minCapacity + 1];
        for (int i = 0; i < pool.length; i++) {
            pool[i] = minCapacity + i;
        }
        int distinct = Math.min(Math.min(ramp(1, 5, t), pool.length), regular);
        int small = CapacityProfile.isSmall(minCapacity) ? ramp(0, 2, t) : 0;
        int large = CapacityProfile.isLarge(maxCapacity) ? ramp(0, 2, t) : 0;
        var capacity = new CapacityProfile(pool, distinct, small, large);

        var fragmentation = new FragmentationProfile(1.0 + 1.5 * t, 0.8 * t, Math.min(ramp(1, 4, t), regular));

        return new DifficultyProfile(levelIndex, LevelBand.forLevel(eff), capacity, fragmentation, colors, empties,
                                     sinks, ramp(6, 18, t), targetOptimalMoves(levelIndex), sinkRequired);
    }

    /**
     * Optimal solution length every generated level must have exactly: 3 at level one rising to 10 at the plateau.
     * Non-decreasing in the level index.
     */
    public static int targetOptimalMoves(int levelIndex) {
        return ramp(3, 10, linearProgress(levelIndex));
    }

    private static int ramp(int first, int last, double t) {
        return (int) Math.round(first + (last - first) * t);
    }

    private static void requirePositive(int levelIndex) {
        if (levelIndex <= 0) {
            throw new IllegalArgumentException("levelIndex must be positive: " + levelIndex);
        }
    }
}
