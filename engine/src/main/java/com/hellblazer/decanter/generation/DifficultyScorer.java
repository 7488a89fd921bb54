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
package com.hellblazer.decanter.generation;

import com.hellblazer.decanter.solver.LevelMetrics;

/**
 * Intrinsic 1..100 difficulty of a level, from its metrics alone.
 * <p>
 * Solution length contributes up to 40 points, rising steeply to 5 moves, more slowly to 12 and then plateauing.
 * Branching adds up to 25, traps up to 20 (quadratic), the share of real decisions up to 10, and a unique solution 5.
 *
 * @author hal.hildebrand
 */
public final class DifficultyScorer {

    private DifficultyScorer() {
    }

    public static int intrinsicDifficulty(LevelMetrics metrics) {
        if (metrics == null || metrics.optimalMoves() <= 0) {
            return 1;
        }
        int optimal = metrics.optimalMoves();
        double moveScore;
        if (optimal <= 5) {
            moveScore = optimal * 4.0;
        } else if (optimal <= 12) {
            moveScore = 20.0 + (optimal - 5) * 2.5;
        } else {
            moveScore = 37.5 + Math.min(2.5, (optimal - 12) * 0.3);
        }
        double branchScore = clamp01((metrics.averageBranchingFactor() - 1.0) / 3.5) * 25.0;
        double trapScore = metrics.trapScore() * metrics.trapScore() * 20.0;
        double decisionScore = (1.0 - clamp01(metrics.forcedMoveRatio())) * 10.0;
        double uniqueScore = metrics.solutionMultiplicity() <= 1 ? 5.0 : metrics.solutionMultiplicity() <= 3 ? 3.0 : 1.0;

        long total = Math.round(moveScore + branchScore + trapScore + decisionScore + uniqueScore);
        return (int) Math.max(1, Math.min(100, total));
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
