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
import com.hellblazer.decanter.solver.BfsSolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MonotonicLevelSelectorTest {

    private ExecutorService executor;

    @AfterEach
    void shutdown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
    }

    @BeforeEach
    void startExecutor() {
        executor = Executors.newFixedThreadPool(3);
    }

    @Test
    void testAllCandidatesFailing() {
        var impossible = new LevelGenerator(new BfsSolver(), LevelGeneratorTest.CONFIG.withMinOptimalMoves(1_000)
                                                                                      .withMaxAttempts(1)
                                                                                      .withFallbackAttempts(0)
                                                                                      .withCandidatesPerAttempt(1));
        var selector = new MonotonicLevelSelector(impossible, executor, 2);
        var thrown = assertThrows(GenerationException.class, () -> selector.select(1));
        assertEquals(1, thrown.levelIndex());
        assertEquals(SeedMixer.candidateSeed(1, 0), thrown.seed());
    }

    @Test
    void testRejectsBadArguments() {
        var generator = new LevelGenerator();
        assertThrows(IllegalArgumentException.class, () -> new MonotonicLevelSelector(generator, executor, 0));
        assertThrows(NullPointerException.class, () -> new MonotonicLevelSelector(null, executor));
        assertThrows(NullPointerException.class, () -> new MonotonicLevelSelector(generator, null));
        assertEquals(MonotonicLevelSelector.DEFAULT_CANDIDATES,
                     new MonotonicLevelSelector(generator, executor).candidates());
    }

    @Test
    void testSelectionIsDeterministic() throws Exception {
        var generator = new LevelGenerator(new BfsSolver(), LevelGeneratorTest.CONFIG);
        var selector = new MonotonicLevelSelector(generator, executor, 4);
        var first = selector.select(2);
        var second = selector.select(2);
        assertEquals(first.state(), second.state());

        var target = MonotonicLevelSelector.targetDifficulty(2);
        double chosen = Math.abs(first.report().difficultyScore() - target);
        boolean fromCandidate = false;
        for (int i = 0; i < 4; i++) {
            var candidate = generator.tryGenerate(SeedMixer.candidateSeed(2, i),
                                                  LevelDifficultyEngine.profile(2));
            if (candidate.isSuccess()) {
                var level = candidate.level().orElseThrow();
                assertTrue(chosen <= Math.abs(level.report().difficultyScore() - target));
                fromCandidate |= level.state().equals(first.state());
            }
        }
        assertTrue(fromCandidate);
    }

    @Test
    void testTargetCurve() {
        assertEquals(MonotonicLevelSelector.START_DIFFICULTY, MonotonicLevelSelector.targetDifficulty(1), 1e-9);
        assertEquals(MonotonicLevelSelector.END_DIFFICULTY, MonotonicLevelSelector.targetDifficulty(200), 1e-9);
        assertEquals(MonotonicLevelSelector.END_DIFFICULTY, MonotonicLevelSelector.targetDifficulty(5_000), 1e-9);
        assertTrue(MonotonicLevelSelector.targetDifficulty(50) < MonotonicLevelSelector.targetDifficulty(51));
        assertThrows(IllegalArgumentException.class, () -> MonotonicLevelSelector.targetDifficulty(0));
    }
}
