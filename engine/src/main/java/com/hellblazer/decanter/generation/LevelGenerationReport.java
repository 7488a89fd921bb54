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
 * Diagnostics of one {@link LevelGenerator#generate} call.
 *
 * @param levelIndex         the level generated
 * @param seed               the requested seed
 * @param attemptsUsed       attempts consumed, fallback attempts included
 * @param metrics            metrics of the accepted level
 * @param optimalMoves       optimal solution length
 * @param movesAllowed       move allowance handed to the player
 * @param scrambleMoves      inverse moves applied
 * @param generationMillis   total wall clock time
 * @param solverMillis       time spent in the solver
 * @param metricsMillis      time spent computing metrics
 * @param difficultyScore    intrinsic 1..100 difficulty
 * @param objectiveScore     candidate objective score
 * @param qualityGated       false when the level came from the relaxed fallback
 * @param lastRejectReason   the last rejection before acceptance, null if the first candidate passed
 *
 * @author hal.hildebrand
 */
public record LevelGenerationReport(int levelIndex, long seed, int attemptsUsed, LevelMetrics metrics,
                                    int optimalMoves, int movesAllowed, int scrambleMoves, long generationMillis,
                                    long solverMillis, long metricsMillis, int difficultyScore, double objectiveScore,
                                    boolean qualityGated, String lastRejectReason) {
}
