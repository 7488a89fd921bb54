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
package com.hellblazer.decanter;

import com.hellblazer.decanter.common.SeedMixer;
import com.hellblazer.decanter.generation.GeneratedLevel;
import com.hellblazer.decanter.generation.GenerationConfig;
import com.hellblazer.decanter.generation.GenerationException;
import com.hellblazer.decanter.generation.GenerationOutcome;
import com.hellblazer.decanter.generation.LevelGenerator;
import com.hellblazer.decanter.model.MoveResult;
import com.hellblazer.decanter.model.PuzzleState;
import com.hellblazer.decanter.rules.LevelDifficultyEngine;
import com.hellblazer.decanter.solver.BfsSolver;
import com.hellblazer.decanter.solver.SolverResult;

import java.util.Objects;

/**
 * Entry points used by the session layer.
 * <p>
 * The engine is a pure computation library: it never performs I/O, never starts threads and keeps no state between
 * calls, so one instance may be shared freely. Callers that want generation off their main thread schedule these calls
 * themselves.
 * <p>
 * Usage:
 * <pre>
 * var engine = new PuzzleEngine();
 * var state = engine.generate(seed, level);
 * var result = engine.tryApplyMove(state, 0, 3);
 * if (result.applied() &amp;&amp; result.state().isWin()) { ... }
 * </pre>
 * When generation fails for a seed, retry with {@link #perturbSeed(long, int)}.
 *
 * @author hal.hildebrand
 */
public final class PuzzleEngine {

    private final BfsSolver      solver;
    private final LevelGenerator generator;

    public PuzzleEngine() {
        this(GenerationConfig.defaultConfig());
    }

    public PuzzleEngine(GenerationConfig config) {
        this.solver = new BfsSolver();
        this.generator = new LevelGenerator(solver, Objects.requireNonNull(config, "config"));
    }

    /**
     * Deterministic seed for the {@code attempt}th retry after a generation failure. Attempt zero is the seed.
     */
    public static long perturbSeed(long seed, int attempt) {
        return SeedMixer.perturb(seed, attempt);
    }

    /**
     * Build the level for {@code (seed, levelIndex)}; the difficulty profile is derived from the level index.
     *
     * @throws GenerationException if the seed cannot satisfy the level's profile
     */
    public PuzzleState generate(long seed, int levelIndex) throws GenerationException {
        return generateWithReport(seed, levelIndex).state();
    }

    /**
     * As {@link #generate(long, int)}, together with the generation report.
     */
    public GeneratedLevel generateWithReport(long seed, int levelIndex) throws GenerationException {
        return generator.generate(seed, LevelDifficultyEngine.profile(levelIndex));
    }

    public LevelGenerator generator() {
        return generator;
    }

    /**
     * Optimal move count within the budget; {@link SolverResult#optimalMoves()} is -1 when unknown.
     */
    public SolverResult solve(PuzzleState state, int maxNodes, long maxMillis) {
        return solver.solve(state, maxNodes, maxMillis);
    }

    /**
     * Optimal move count and one optimal move sequence.
     */
    public SolverResult solveWithPath(PuzzleState state, int maxNodes, long maxMillis, boolean allowSinkMoves) {
        return solver.solveWithPath(state, maxNodes, maxMillis, allowSinkMoves);
    }

    /**
     * Apply a pour. An illegal pour returns the input state with zero poured.
     */
    public MoveResult tryApplyMove(PuzzleState state, int source, int target) {
        return Objects.requireNonNull(state, "state").tryApplyMove(source, target);
    }

    public GenerationOutcome tryGenerate(long seed, int levelIndex) {
        return generator.tryGenerate(seed, LevelDifficultyEngine.profile(levelIndex));
    }
}
