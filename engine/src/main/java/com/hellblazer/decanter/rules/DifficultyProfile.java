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

import java.util.Objects;

/**
 * Everything the generator needs to know about a level's shape.
 *
 * @param levelIndex           the requested level
 * @param band                 difficulty tier of the effective level
 * @param capacityProfile      bottle size requirements
 * @param fragmentationProfile color scattering requirements
 * @param colorCount           distinct colors, each filling exactly one bottle when solved
 * @param emptyBottleCount     non-sink bottles that are empty when solved
 * @param sinkCount            sink bottles
 * @param reverseMoveCount     inverse moves applied to scramble the solved configuration
 * @param targetOptimalMoves   exact optimal solution length of the generated level
 * @param sinkRequired         whether a color sits in the sink when solved, forcing pours into it
 *
 * @author hal.hildebrand
 */
public record DifficultyProfile(int levelIndex, LevelBand band, CapacityProfile capacityProfile,
                                FragmentationProfile fragmentationProfile, int colorCount, int emptyBottleCount,
                                int sinkCount, int reverseMoveCount, int targetOptimalMoves,
                                boolean sinkRequired) {

    public static final int MAX_BOTTLES = 9;

    public DifficultyProfile {
        if (levelIndex <= 0) {
            throw new IllegalArgumentException("levelIndex must be positive: " + levelIndex);
        }
        Objects.requireNonNull(band, "band");
        Objects.requireNonNull(capacityProfile, "capacityProfile");
        Objects.requireNonNull(fragmentationProfile, "fragmentationProfile");
        if (colorCount < 1) {
            throw new IllegalArgumentException("colorCount must be positive: " + colorCount);
        }
        if (emptyBottleCount < 0 || sinkCount < 0) {
            throw new IllegalArgumentException(
            "Bottle counts must be non-negative: empties=" + emptyBottleCount + ", sinks=" + sinkCount);
        }
        if (reverseMoveCount < 0) {
            throw new IllegalArgumentException("reverseMoveCount must be non-negative: " + reverseMoveCount);
        }
        if (targetOptimalMoves < 1) {
            throw new IllegalArgumentException("targetOptimalMoves must be positive: " + targetOptimalMoves);
        }
        if (sinkRequired && sinkCount == 0) {
            throw new IllegalArgumentException("sinkRequired without a sink");
        }
        if (sinkRequired && sinkCount > colorCount) {
            throw new IllegalArgumentException("More filled sinks than colors: " + sinkCount + " > " + colorCount);
        }
        int bottles = colorCount + emptyBottleCount + (sinkRequired ? 0 : sinkCount);
        if (bottles > MAX_BOTTLES) {
            throw new IllegalArgumentException("Too many bottles: " + bottles + " > " + MAX_BOTTLES);
        }
    }

    /**
     * Total bottles. When the sink is required it holds one of the colors, otherwise it is an extra empty bottle.
     */
    public int bottleCount() {
        return colorCount + emptyBottleCount + (sinkRequired ? 0 : sinkCount);
    }

    /**
     * @return the number of non-sink bottles
     */
    public int regularBottleCount() {
        return bottleCount() - sinkCount;
    }

    public DifficultyProfile withReverseMoveCount(int reverseMoves) {
        return new DifficultyProfile(levelIndex, band, capacityProfile, fragmentationProfile, colorCount,
                                     emptyBottleCount, sinkCount, reverseMoves, targetOptimalMoves, sinkRequired);
    }

    public DifficultyProfile withTargetOptimalMoves(int targetMoves) {
        return new DifficultyProfile(levelIndex, band, capacityProfile, fragmentationProfile, colorCount,
                                     emptyBottleCount, sinkCount, reverseMoveCount, targetMoves, sinkRequired);
    }
}
