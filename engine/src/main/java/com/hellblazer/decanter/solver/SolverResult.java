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

import com.hellblazer.decanter.model.Move;

import java.util.List;
import java.util.Objects;

/**
 * Result of a search.
 *
 * @param optimalMoves  minimum moves to a win, or -1 when not solved
 * @param path          the moves of one optimal solution; empty in depth-only mode or when not solved
 * @param status        how the search ended
 * @param nodesExplored distinct states visited
 * @param elapsedMillis wall clock time spent
 *
 * @author hal.hildebrand
 */
public record SolverResult(int optimalMoves, List<Move> path, SolverStatus status, long nodesExplored,
                           long elapsedMillis) {

    public static final int UNKNOWN = -1;

    public SolverResult {
        Objects.requireNonNull(status, "status");
        path = path == null ? List.of() : List.copyOf(path);
        if (status == SolverStatus.SOLVED && optimalMoves < 0) {
            throw new IllegalArgumentException("Solved result needs a depth: " + optimalMoves);
        }
        if (status != SolverStatus.SOLVED && optimalMoves != UNKNOWN) {
            throw new IllegalArgumentException(status + " result must report " + UNKNOWN + ": " + optimalMoves);
        }
    }

    public static SolverResult budgetExhausted(long nodesExplored, long elapsedMillis) {
        return new SolverResult(UNKNOWN, List.of(), SolverStatus.BUDGET_EXHAUSTED, nodesExplored, elapsedMillis);
    }

    public static SolverResult solved(int depth, List<Move> path, long nodesExplored, long elapsedMillis) {
        return new SolverResult(depth, path, SolverStatus.SOLVED, nodesExplored, elapsedMillis);
    }

    public static SolverResult unsolvable(long nodesExplored, long elapsedMillis) {
        return new SolverResult(UNKNOWN, List.of(), SolverStatus.UNSOLVABLE, nodesExplored, elapsedMillis);
    }

    public boolean isSolved() {
        return status == SolverStatus.SOLVED;
    }
}
