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

import com.hellblazer.decanter.common.IntArrayList;
import com.hellblazer.decanter.model.Move;
import com.hellblazer.decanter.model.PuzzleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Breadth-first search for the fewest moves to a win.
 * <p>
 * Every edge costs one move, so the first win reached is optimal. Visited states are deduplicated on
 * {@link StateEncoder#encodeCanonical(PuzzleState)}. Each win is detected as soon as its state is generated; since every
 * generated state is checked, the depth reported is still the BFS depth of the shallowest win.
 * <p>
 * The search keeps a flat node arena (state, parent index, packed move, depth) which doubles as the FIFO queue, so path
 * reconstruction is a walk back along parent indices.
 * <p>
 * Search moves are the legal moves minus two classes:
 * <ul>
 * <li>pouring a solved bottle's whole contents into an empty bottle</li>
 * <li>pouring into a sink, when sink moves are disabled</li>
 * </ul>
 * Instances hold no state and may be shared between threads.
 *
 * @author hal.hildebrand
 */
public final class BfsSolver {

    private static final Logger log = LoggerFactory.getLogger(BfsSolver.class);

    /** Expansions between wall clock checks; a power of two */
    private static final int CLOCK_CHECK_INTERVAL = 256;

    /**
     * The number of units a search move from {@code source} to {@code target} pours, or zero when the pour is illegal
     * or excluded from search.
     */
    public static int searchPourAmount(PuzzleState state, int source, int target, boolean allowSinkMoves) {
        int amount = state.pourAmount(source, target);
        if (amount == 0) {
            return 0;
        }
        var from = state.bottle(source);
        var to = state.bottle(target);
        if (!allowSinkMoves && to.isSink()) {
            return 0;
        }
        if (to.isEmpty() && from.isSolved() && amount == from.count()) {
            return 0;
        }
        return amount;
    }

    /**
     * @return the search moves of a state, ordered by source then target
     */
    public static List<Move> searchMoves(PuzzleState state, boolean allowSinkMoves) {
        Objects.requireNonNull(state, "state");
        var moves = new ArrayList<Move>();
        int n = state.bottleCount();
        for (int s = 0; s < n; s++) {
            for (int t = 0; t < n; t++) {
                int amount = searchPourAmount(state, s, t, allowSinkMoves);
                if (amount > 0) {
                    moves.add(new Move(s, t, amount));
                }
            }
        }
        return moves;
    }

    /**
     * Depth-only search, sink moves allowed.
     */
    public SolverResult solve(PuzzleState state, int maxNodes, long maxMillis) {
        return search(state, maxNodes, maxMillis, true, false);
    }

    public SolverResult solve(PuzzleState state, SolverBudget budget) {
        Objects.requireNonNull(budget, "budget");
        return solve(state, budget.maxNodes(), budget.maxMillis());
    }

    /**
     * Search that also reconstructs one optimal move sequence.
     *
     * @param allowSinkMoves whether pours into sinks may be used
     */
    public SolverResult solveWithPath(PuzzleState state, int maxNodes, long maxMillis, boolean allowSinkMoves) {
        return search(state, maxNodes, maxMillis, allowSinkMoves, true);
    }

    public SolverResult solveWithPath(PuzzleState state, SolverBudget budget, boolean allowSinkMoves) {
        Objects.requireNonNull(budget, "budget");
        return solveWithPath(state, budget.maxNodes(), budget.maxMillis(), allowSinkMoves);
    }

    private List<Move> reconstruct(int node, IntArrayList parents, IntArrayList moves) {
        var path = new ArrayList<Move>();
        for (int i = node; parents.getInt(i) >= 0; i = parents.getInt(i)) {
            path.add(Move.unpack(moves.getInt(i)));
        }
        Collections.reverse(path);
        return path;
    }

    private SolverResult search(PuzzleState state, int maxNodes, long maxMillis, boolean allowSinkMoves,
                                boolean withPath) {
        Objects.requireNonNull(state, "state");
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (maxMillis <= 0) {
            throw new IllegalArgumentException("maxMillis must be positive: " + maxMillis);
        }
        long start = System.nanoTime();
        long deadline = start + maxMillis * 1_000_000L;

        if (state.isWin()) {
            return SolverResult.solved(0, List.of(), 1, elapsedMillis(start));
        }

        var states = new ArrayList<PuzzleState>();
        var parents = new IntArrayList();
        var moves = new IntArrayList();
        var depths = new IntArrayList();
        var visited = new HashSet<String>();

        states.add(state);
        parents.addInt(-1);
        moves.addInt(0);
        depths.addInt(0);
        visited.add(StateEncoder.encodeCanonical(state));

        for (int head = 0; head < states.size(); head++) {
            if ((head & (CLOCK_CHECK_INTERVAL - 1)) == 0 && System.nanoTime() > deadline) {
                log.trace("Time budget of {} ms exhausted after {} nodes", maxMillis, visited.size());
                return SolverResult.budgetExhausted(visited.size(), elapsedMillis(start));
            }
            var current = states.set(head, null);
            int childDepth = depths.getInt(head) + 1;
            int n = current.bottleCount();
            for (int s = 0; s < n; s++) {
                for (int t = 0; t < n; t++) {
                    int amount = searchPourAmount(current, s, t, allowSinkMoves);
                    if (amount == 0) {
                        continue;
                    }
                    var child = current.tryApplyMove(s, t).state();
                    if (!visited.add(StateEncoder.encodeCanonical(child))) {
                        continue;
                    }
                    int index = states.size();
                    states.add(child);
                    parents.addInt(head);
                    moves.addInt(new Move(s, t, amount).packed());
                    depths.addInt(childDepth);
                    if (child.isWin()) {
                        var path = withPath ? reconstruct(index, parents, moves) : List.<Move>of();
                        long elapsed = elapsedMillis(start);
                        log.trace("Solved in {} moves, {} nodes, {} ms", childDepth, visited.size(), elapsed);
                        return SolverResult.solved(childDepth, path, visited.size(), elapsed);
                    }
                    if (visited.size() >= maxNodes) {
                        log.trace("Node budget of {} exhausted", maxNodes);
                        return SolverResult.budgetExhausted(visited.size(), elapsedMillis(start));
                    }
                }
            }
        }
        return SolverResult.unsolvable(visited.size(), elapsedMillis(start));
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
