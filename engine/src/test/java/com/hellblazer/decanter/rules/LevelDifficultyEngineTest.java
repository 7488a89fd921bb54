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
package com.hellblazer.decanter.rules;

import com.hellblazer.decanter.model.ColorId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LevelDifficultyEngineTest {

    @ParameterizedTest
    @CsvSource({ "1,A", "10,A", "11,B", "25,B", "26,C", "50,C", "51,D", "75,D", "76,E", "100,E", "5000,E" })
    void testBands(int level, LevelBand band) {
        assertEquals(band, LevelDifficultyEngine.profile(level).band());
    }

    @Test
    void testFirstLevel() {
        var profile = LevelDifficultyEngine.profile(1);
        assertEquals(3, profile.colorCount());
        assertEquals(2, profile.emptyBottleCount());
        assertEquals(0, profile.sinkCount());
        assertFalse(profile.sinkRequired());
        assertEquals(6, profile.reverseMoveCount());
        assertEquals(3, profile.targetOptimalMoves());
        assertArrayEquals(new int[] { 4 }, profile.capacityProfile().capacityPool());
        assertEquals(5, profile.bottleCount());
    }

    @Test
    void testMonotonicRamp() {
        var previous = LevelDifficultyEngine.profile(1);
        for (int level = 2; level <= LevelDifficultyEngine.MAX_EFFECTIVE_LEVEL; level++) {
            var profile = LevelDifficultyEngine.profile(level);
            assertTrue(profile.reverseMoveCount() >= previous.reverseMoveCount(), "reverse moves at " + level);
            assertTrue(profile.targetOptimalMoves() >= previous.targetOptimalMoves(), "optimal target at " + level);
            assertTrue(profile.sinkCount() >= previous.sinkCount(), "sinks at " + level);
            assertTrue(profile.capacityProfile().capacityPool().length >= previous.capacityProfile()
                                                                                   .capacityPool().length,
                       "capacity pool at " + level);
            assertTrue(profile.fragmentationProfile().minAvgFragmentsPerColor() >= previous.fragmentationProfile()
                                                                                           .minAvgFragmentsPerColor(),
                       "fragmentation at " + level);
            assertTrue(profile.band().ordinal() >= previous.band().ordinal());
            assertTrue(profile.bottleCount() <= DifficultyProfile.MAX_BOTTLES);
            previous = profile;
        }
    }

    @Test
    void testNonPositiveLevelRejected() {
        assertThrows(IllegalArgumentException.class, () -> LevelDifficultyEngine.profile(0));
        assertThrows(IllegalArgumentException.class, () -> LevelDifficultyEngine.profile(-3));
        assertThrows(IllegalArgumentException.class, () -> LevelDifficultyEngine.effectiveLevel(0));
    }

    @Test
    void testPlateau() {
        var plateau = LevelDifficultyEngine.profile(100);
        for (int level : new int[] { 101, 250, 10_000 }) {
            var profile = LevelDifficultyEngine.profile(level);
            assertEquals(level, profile.levelIndex());
            assertEquals(plateau.colorCount(), profile.colorCount());
            assertEquals(plateau.emptyBottleCount(), profile.emptyBottleCount());
            assertEquals(plateau.sinkCount(), profile.sinkCount());
            assertEquals(plateau.reverseMoveCount(), profile.reverseMoveCount());
            assertEquals(plateau.targetOptimalMoves(), profile.targetOptimalMoves());
            assertEquals(plateau.capacityProfile(), profile.capacityProfile());
            assertEquals(plateau.fragmentationProfile(), profile.fragmentationProfile());
        }
        assertEquals(1.0, LevelDifficultyEngine.linearProgress(100));
        assertEquals(1.0, LevelDifficultyEngine.linearProgress(1000));
        assertEquals(0.0, LevelDifficultyEngine.linearProgress(1));
        assertEquals(10, plateau.targetOptimalMoves());
    }

    @Test
    void testSinkRequiredNeedsSink() {
        for (int level = 1; level <= 300; level++) {
            var profile = LevelDifficultyEngine.profile(level);
            if (profile.sinkRequired()) {
                assertTrue(profile.sinkCount() > 0, "level " + level);
                assertEquals(profile.colorCount() + profile.emptyBottleCount(), profile.bottleCount());
            }
            assertTrue(profile.colorCount() < ColorId.values().length);
        }
    }

    @Test
    void testSinkRequiredClassIsStable() {
        for (int level = 1; level <= 50; level++) {
            assertEquals(LevelDifficultyEngine.isSinkRequiredClass(level),
                         LevelDifficultyEngine.isSinkRequiredClass(level));
        }
    }
}
