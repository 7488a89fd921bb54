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
 * Everything measured about a candidate level, as consumed by the quality gate and the scorers.
 *
 * @author hal.hildebrand
 */
public record LevelMetrics(int optimalMoves, double forcedMoveRatio, double averageBranchingFactor,
                           int decisionDepth, double emptyBottleUsageRatio, double trapScore,
                           int solutionMultiplicity, int mixedBottleCount, int distinctSignatureCount,
                           int topColorVariety, double avgFragmentsPerColor, double fragmentSizeVariance) {

    /**
     * Values for a level about which nothing is known; fails any non-trivial gate.
     */
    public static LevelMetrics empty() {
        return new LevelMetrics(-1, 1.0, 1.0, 0, 1.0, 0.0, 1, 0, 0, 0, 0.0, 0.0);
    }

    public static LevelMetrics of(int optimalMoves, PathMetrics path, double trapScore, int multiplicity,
                                  StructuralMetrics structure, FragmentationMetrics fragmentation) {
        return new LevelMetrics(optimalMoves, path.forcedMoveRatio(), path.averageBranchingFactor(),
                                path.decisionDepth(), path.emptyBottleUsageRatio(), trapScore, multiplicity,
                                structure.mixedBottleCount(), structure.distinctSignatureCount(),
                                structure.topColorVariety(), fragmentation.avgFragmentsPerColor(),
                                fragmentation.fragmentSizeVariance());
    }

    @Override
    public String toString() {
        return String.format(
        "LevelMetrics[opt=%d, FMR=%.2f, ABF=%.2f, DD=%d, EBUR=%.2f, TS=%.2f, SM=%d, mixed=%d, sigs=%d, tops=%d, frag=%.2f/%.2f]",
        optimalMoves, forcedMoveRatio, averageBranchingFactor, decisionDepth, emptyBottleUsageRatio, trapScore,
        solutionMultiplicity, mixedBottleCount, distinctSignatureCount, topColorVariety, avgFragmentsPerColor,
        fragmentSizeVariance);
    }
}
