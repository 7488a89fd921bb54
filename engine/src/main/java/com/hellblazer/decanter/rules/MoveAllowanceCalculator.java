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

/**
 * How many moves a player gets for a level with a known optimal solution.
 *
 * @author hal.hildebrand
 */
public final class MoveAllowanceCalculator {

    public static final int    FULL_SLACK_LEVEL = 1;
    public static final int    NO_SLACK_LEVEL   = 500;
    public static final double MAX_SLACK        = 2.0;
    public static final double MIN_SLACK        = 1.0;

    private MoveAllowanceCalculator() {
    }

    /**
     * @return {@code max(optimal + 1, ceil(optimal * slack))}, so there is always at least one spare move
     */
    public static int movesAllowed(int levelIndex, int optimalMoves) {
        if (optimalMoves < 0) {
            throw new IllegalArgumentException("optimalMoves must be known: " + optimalMoves);
        }
        int scaled = (int) Math.ceil(optimalMoves * slackFactor(levelIndex));
        return Math.max(optimalMoves + 1, scaled);
    }

    /**
     * @return 2.0 at level 1 falling linearly to 1.0 at level 500 and beyond
     */
    public static double slackFactor(int levelIndex) {
        if (levelIndex <= FULL_SLACK_LEVEL) {
            return MAX_SLACK;
        }
        if (levelIndex >= NO_SLACK_LEVEL) {
            return MIN_SLACK;
        }
        double t = (levelIndex - FULL_SLACK_LEVEL) / (double) (NO_SLACK_LEVEL - FULL_SLACK_LEVEL);
        return MAX_SLACK - (MAX_SLACK - MIN_SLACK) * t;
    }
}
