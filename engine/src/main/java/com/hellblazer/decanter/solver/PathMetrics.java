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
package com.hellblazer.decanter.solver;

/**
 * Decision density along an optimal solution, measured over the start state and every intermediate state (the final
 * win state is not a decision).
 *
 * @param forcedMoveRatio        fraction of those states with exactly one legal move
 * @param averageBranchingFactor mean legal move count
 * @param decisionDepth          index of the first state with two or more legal moves, or the path length if none
 * @param emptyBottleUsageRatio  fraction of path moves that pour into an empty bottle
 * @param pathLength             moves in the path
 *
 * @author hal.hildebrand
 */
public record PathMetrics(double forcedMoveRatio, double averageBranchingFactor, int decisionDepth,
                          double emptyBottleUsageRatio, int pathLength) {

    /**
     * Metrics of an empty path.
     */
    public static PathMetrics trivial() {
        return new PathMetrics(1.0, 1.0, 0, 0.0, 0);
    }
}
