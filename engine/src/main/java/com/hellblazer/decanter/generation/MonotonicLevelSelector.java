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

import com.hellblazer.decanter.common.SeedMixer;
import com.hellblazer.decanter.rules.LevelDifficultyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Picks, among several seeded candidates for a level, the one whose intrinsic difficulty is closest to a rising target
 * curve, so consecutive levels feel monotonically harder.
 * <p>
 * Candidates are generated on the caller's executor; the selector never creates threads. The choice depends only on the
 * candidates' contents and their index, never on completion order.
 *
 * @author hal.hildebrand
 */
public final class MonotonicLevelSelector {

    /** Candidates generated per level */
    public static final int    DEFAULT_CANDIDATES = 16;
    /** Target difficulty at level one */
    public static final double START_DIFFICULTY   = 35.0;
    /** Target difficulty at and beyond {@link #RAMP_LEVELS} */
    public static final double END_DIFFICULTY     = 92.0;
    /** Level where the target curve flattens */
    public static final int    RAMP_LEVELS        = 200;

    private static final Logger log = LoggerFactory.getLogger(MonotonicLevelSelector.class);

    private final LevelGenerator  generator;
    private final ExecutorService executor;
    private final int             candidates;

    public MonotonicLevelSelector(LevelGenerator generator, ExecutorService executor) {
        this(generator, executor, DEFAULT_CANDIDATES);
    }

    public MonotonicLevelSelector(LevelGenerator generator, ExecutorService executor, int candidates) {
        if (candidates <= 0) {
            throw new IllegalArgumentException("candidates must be positive: " + candidates);
        }
        this.generator = Objects.requireNonNull(generator, "generator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.candidates = candidates;
    }

    /**
     * Target intrinsic difficulty, linear from {@link #START_DIFFICULTY} at level one to {@link #END_DIFFICULTY} at
     * {@link #RAMP_LEVELS}, flat afterwards.
     */
    public static double targetDifficulty(int levelIndex) {
        if (levelIndex <= 0) {
            throw new IllegalArgumentException("levelIndex must be positive: " + levelIndex);
        }
        int clamped = Math.min(levelIndex, RAMP_LEVELS);
        double t = (clamped - 1) / (double) (RAMP_LEVELS - 1);
        return START_DIFFICULTY + (END_DIFFICULTY - START_DIFFICULTY) * t;
    }

    public int candidates() {
        return candidates;
    }

    /**
     * Generate the level's candidates and return the closest to the target curve.
     *
     * @throws GenerationException  if every candidate failed, or a candidate task threw
     * @throws InterruptedException if interrupted while waiting for candidates
     */
    public GeneratedLevel select(int levelIndex) throws GenerationException, InterruptedException {
        var profile = LevelDifficultyEngine.profile(levelIndex);
        var target = targetDifficulty(levelIndex);

        var futures = new ArrayList<Future<GenerationOutcome>>(candidates);
        for (int i = 0; i < candidates; i++) {
            long seed = SeedMixer.candidateSeed(levelIndex, i);
            futures.add(executor.submit(() -> generator.tryGenerate(seed, profile)));
        }

        GeneratedLevel best = null;
        int bestIndex = -1;
        double bestDistance = Double.MAX_VALUE;
        GenerationOutcome.Failure firstFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            GenerationOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (ExecutionException e) {
                cancelRemaining(futures, i + 1);
                throw new GenerationException("Candidate " + i + " of level " + levelIndex + " failed", e.getCause());
            } catch (InterruptedException e) {
                cancelRemaining(futures, i);
                throw e;
            }
            if (outcome instanceof GenerationOutcome.Success success) {
                var level = success.generated();
                double distance = Math.abs(level.report().difficultyScore() - target);
                if (distance < bestDistance) {
                    best = level;
                    bestIndex = i;
                    bestDistance = distance;
                }
            } else if (firstFailure == null) {
                firstFailure = (GenerationOutcome.Failure) outcome;
            }
        }
        if (best == null) {
            throw new GenerationException(levelIndex, firstFailure.seed(), firstFailure.reason());
        }
        log.info("Level {}: selected candidate {} of {} (difficulty {}, target {})", levelIndex, bestIndex, candidates,
                 best.report().difficultyScore(), String.format("%.1f", target));
        return best;
    }

    private static void cancelRemaining(ArrayList<Future<GenerationOutcome>> futures, int from) {
        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }
}
