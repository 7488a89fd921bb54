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

import com.hellblazer.decanter.common.DeterministicRandom;
import com.hellblazer.decanter.model.Move;
import com.hellblazer.decanter.model.PuzzleState;
import com.hellblazer.decanter.rules.MoveRules;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Measures how much real decision making a level demands.
 * <p>
 * Path metrics walk an optimal solution and count the choices on the way. The trap score probes a seeded sample of
 * non-optimal opening moves with reduced-budget searches. Multiplicity counts distinct win states reachable within a
 * small margin over optimal. Structural and fragmentation metrics describe the start state itself.
 * <p>
 * Deterministic for a fixed input, sampling seed and configuration, as long as the trap probes finish inside their node
 * budget rather than their time budget.
 *
 * @author hal.hildebrand
 */
public final class MetricsComputer {

    private final BfsSolver     solver;
    private final MetricsConfig config;

    public MetricsComputer() {
        this(new BfsSolver(), MetricsConfig.defaultConfig());
    }

    public MetricsComputer(BfsSolver solver, MetricsConfig config) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * All metrics of a solved start state.
     *
     * @param result a solved path-mode result for {@code state}
     * @throws IllegalArgumentException if the result is not solved or carries no path
     */
    public LevelMetrics compute(PuzzleState state, SolverResult result, long samplingSeed) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(result, "result");
        if (!result.isSolved()) {
            throw new IllegalArgumentException("Metrics require a solved result: " + result.status());
        }
        if (result.path().size() != result.optimalMoves()) {
            throw new IllegalArgumentException(
            "Metrics require the solution path, got " + result.path().size() + " moves for depth "
            + result.optimalMoves());
        }
        var path = result.path();
        return LevelMetrics.of(result.optimalMoves(), computePathMetrics(state, path),
                               computeTrapScore(state, path, samplingSeed),
                               estimateSolutionMultiplicity(state, result.optimalMoves()),
                               computeStructuralMetrics(state), computeFragmentation(state));
    }

    public FragmentationMetrics computeFragmentation(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        var fragmentsPerColor = new int[64];
        var lengths = new ArrayList<Integer>();
        for (var bottle : state.bottles()) {
            int i = 0;
            while (i < bottle.count()) {
                int code = bottle.slotCode(i);
                int run = 1;
                while (i + run < bottle.count() && bottle.slotCode(i + run) == code) {
                    run++;
                }
                fragmentsPerColor[code]++;
                lengths.add(run);
                i += run;
            }
        }
        int colors = 0;
        for (int count : fragmentsPerColor) {
            if (count > 0) {
                colors++;
            }
        }
        if (colors == 0) {
            return new FragmentationMetrics(0.0, 0.0);
        }
        double mean = lengths.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double variance = lengths.stream().mapToDouble(l -> (l - mean) * (l - mean)).average().orElse(0.0);
        return new FragmentationMetrics(lengths.size() / (double) colors, variance);
    }

    /**
     * Walk {@code path} from {@code state}.
     *
     * @throws IllegalArgumentException if a move of the path is illegal where it is applied
     */
    public PathMetrics computePathMetrics(PuzzleState state, List<Move> path) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return PathMetrics.trivial();
        }
        int forced = 0;
        int totalLegal = 0;
        int decisionDepth = -1;
        int emptyPours = 0;
        var current = state;
        for (int i = 0; i < path.size(); i++) {
            int legal = MoveRules.countLegalMoves(current);
            if (legal == 1) {
                forced++;
            } else if (legal >= 2 && decisionDepth < 0) {
                decisionDepth = i;
            }
            totalLegal += legal;

            var move = path.get(i);
            if (current.pourAmount(move.source(), move.target()) > 0 && current.bottle(move.target()).isEmpty()) {
                emptyPours++;
            }
            var result = current.tryApplyMove(move.source(), move.target());
            if (!result.applied()) {
                throw new IllegalArgumentException("Illegal path move " + i + ": " + move + " on " + current);
            }
            current = result.state();
        }
        int states = path.size();
        return new PathMetrics(forced / (double) states, totalLegal / (double) states,
                               decisionDepth < 0 ? path.size() : decisionDepth, emptyPours / (double) path.size(),
                               path.size());
    }

    public StructuralMetrics computeStructuralMetrics(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        int mixed = 0;
        var signatures = new HashSet<String>();
        var tops = new HashSet<Integer>();
        var sb = new StringBuilder();
        for (var bottle : state.bottles()) {
            if (bottle.isEmpty()) {
                continue;
            }
            if (!bottle.isSingleColorOrEmpty()) {
                mixed++;
            }
            sb.setLength(0);
            StateEncoder.appendSignature(sb, bottle);
            signatures.add(sb.toString());
            tops.add(bottle.topColor().code());
        }
        return new StructuralMetrics(mixed, signatures.size(), tops.size());
    }

    /**
     * Fraction of sampled non-optimal opening moves after which the level can no longer be finished in the optimal
     * number of moves, or cannot be solved inside the probe budget.
     *
     * @param path         an optimal solution of {@code state}
     * @param samplingSeed seed choosing which opening moves are probed
     */
    public double computeTrapScore(PuzzleState state, List<Move> path, long samplingSeed) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(path, "path");
        if (path.isEmpty() || config.trapSamples() == 0) {
            return 0.0;
        }
        var first = path.get(0);
        var candidates = new ArrayList<Move>();
        for (var move : MoveRules.legalMoves(state)) {
            if (move.source() != first.source() || move.target() != first.target()) {
                candidates.add(move);
            }
        }
        if (candidates.isEmpty()) {
            return 0.0;
        }
        int optimal = path.size();
        int sampled = Math.min(config.trapSamples(), candidates.size());
        var order = new int[candidates.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        var rng = new DeterministicRandom(samplingSeed);
        int traps = 0;
        for (int i = 0; i < sampled; i++) {
            int j = i + rng.nextInt(order.length - i);
            int swap = order[i];
            order[i] = order[j];
            order[j] = swap;

            var move = candidates.get(order[i]);
            var next = state.tryApplyMove(move.source(), move.target()).state();
            var probe = solver.solve(next, config.trapNodes(), config.trapMillis());
            if (!probe.isSolved() || 1 + probe.optimalMoves() > optimal) {
                traps++;
            }
        }
        return traps / (double) sampled;
    }

    /**
     * Count distinct win states reachable within {@code optimalMoves} plus the configured margin, up to the
     * configured cap and node budget.
     *
     * @return at least 1
     */
    public int estimateSolutionMultiplicity(PuzzleState state, int optimalMoves) {
        Objects.requireNonNull(state, "state");
        if (optimalMoves <= 0) {
            return 1;
        }
        int limit = optimalMoves + config.nearOptimalMargin();
        var visited = new HashSet<String>();
        var queue = new ArrayDeque<Frontier>();
        visited.add(StateEncoder.encodeCanonical(state));
        queue.add(new Frontier(state, 0));
        int solutions = 0;
        while (!queue.isEmpty() && solutions < config.multiplicityCap()) {
            var node = queue.poll();
            if (node.state.isWin()) {
                solutions++;
                continue;
            }
            if (node.depth >= limit || visited.size() >= config.multiplicityNodes()) {
                continue;
            }
            int n = node.state.bottleCount();
            for (int s = 0; s < n; s++) {
                for (int t = 0; t < n; t++) {
                    if (BfsSolver.searchPourAmount(node.state, s, t, true) == 0) {
                        continue;
                    }
                    var next = node.state.tryApplyMove(s, t).state();
                    if (visited.add(StateEncoder.encodeCanonical(next))) {
                        queue.add(new Frontier(next, node.depth + 1));
                    }
                }
            }
        }
        return Math.max(1, solutions);
    }

    public MetricsConfig config() {
        return config;
    }

    private record Frontier(PuzzleState state, int depth) {
    }
}
