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
import com.hellblazer.decanter.model.PuzzleState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MetricsComputerTest {

    private static final PuzzleState SWAP     = PuzzleState.parse("[RB|BR|__]");
    private static final PuzzleState TRAPPY   = PuzzleState.parse("[RBGR|GBRB|BGRG|____|____]");
    private static final List<Move>  SWAP_PATH = List.of(new Move(0, 2, 1), new Move(1, 0, 1), new Move(1, 2, 1));

    private final BfsSolver       solver  = new BfsSolver();
    private final MetricsComputer metrics = new MetricsComputer(solver, MetricsConfig.defaultConfig()
                                                                                     .withTrapNodes(500_000)
                                                                                     .withTrapMillis(60_000));

    @Test
    void testComputeRequiresSolvedPath() {
        var depthOnly = solver.solve(SWAP, 10_000, 60_000);
        assertThrows(IllegalArgumentException.class, () -> metrics.compute(SWAP, depthOnly, 1L));
        var unsolved = SolverResult.unsolvable(1, 0);
        assertThrows(IllegalArgumentException.class, () -> metrics.compute(SWAP, unsolved, 1L));
    }

    @Test
    void testFragmentation() {
        var swap = metrics.computeFragmentation(SWAP);
        assertEquals(2.0, swap.avgFragmentsPerColor(), 1e-9);
        assertEquals(0.0, swap.fragmentSizeVariance(), 1e-9);

        var uneven = metrics.computeFragmentation(PuzzleState.parse("[RRB_|B___]"));
        assertEquals(1.5, uneven.avgFragmentsPerColor(), 1e-9);
        assertEquals(2.0 / 9.0, uneven.fragmentSizeVariance(), 1e-9);

        var empty = metrics.computeFragmentation(PuzzleState.parse("[__|__]"));
        assertEquals(0.0, empty.avgFragmentsPerColor());
    }

    @Test
    void testFullMetrics() {
        var result = solver.solveWithPath(SWAP, 10_000, 60_000, true);
        var level = metrics.compute(SWAP, result, 7L);
        assertEquals(3, level.optimalMoves());
        assertEquals(2, level.mixedBottleCount());
        assertEquals(0.0, level.trapScore());
        assertEquals(1, level.solutionMultiplicity());
        assertNotNull(level.toString());
    }

    @Test
    void testIllegalPathRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> metrics.computePathMetrics(SWAP, List.of(new Move(0, 1, 1))));
    }

    @Test
    void testMultiplicityIsAtLeastOne() {
        assertEquals(1, metrics.estimateSolutionMultiplicity(SWAP, 3));
        assertEquals(1, metrics.estimateSolutionMultiplicity(PuzzleState.parse("[RR|__]"), 0));
        int multiplicity = metrics.estimateSolutionMultiplicity(TRAPPY, 10);
        assertTrue(multiplicity >= 1 && multiplicity <= metrics.config().multiplicityCap());
    }

    @Test
    void testPathMetrics() {
        var path = metrics.computePathMetrics(SWAP, SWAP_PATH);
        // legal moves along the path: 2, 1, 2
        assertEquals(1.0 / 3.0, path.forcedMoveRatio(), 1e-9);
        assertEquals(5.0 / 3.0, path.averageBranchingFactor(), 1e-9);
        assertEquals(0, path.decisionDepth());
        assertEquals(1.0 / 3.0, path.emptyBottleUsageRatio(), 1e-9);
        assertEquals(3, path.pathLength());

        assertEquals(PathMetrics.trivial(), metrics.computePathMetrics(SWAP, List.of()));
    }

    @Test
    void testStructure() {
        var structure = metrics.computeStructuralMetrics(SWAP);
        assertEquals(2, structure.mixedBottleCount());
        assertEquals(2, structure.distinctSignatureCount());
        assertEquals(2, structure.topColorVariety());

        var solvedish = metrics.computeStructuralMetrics(PuzzleState.parse("[RR__|RR__|BB__|____]"));
        assertEquals(0, solvedish.mixedBottleCount());
        assertEquals(2, solvedish.distinctSignatureCount());
        assertEquals(2, solvedish.topColorVariety());
    }

    @Test
    void testTrapScore() {
        var result = solver.solveWithPath(TRAPPY, SolverBudget.background(), true);
        assertEquals(10, result.optimalMoves());
        // five alternative openings, four of which cost extra moves
        assertEquals(0.8, metrics.computeTrapScore(TRAPPY, result.path(), 3L), 1e-9);
        assertEquals(0.8, metrics.computeTrapScore(TRAPPY, result.path(), 99L), 1e-9);

        var noSamples = new MetricsComputer(solver, MetricsConfig.defaultConfig().withTrapSamples(0));
        assertEquals(0.0, noSamples.computeTrapScore(TRAPPY, result.path(), 3L));
        assertEquals(0.0, metrics.computeTrapScore(SWAP, SWAP_PATH, 3L));
    }

    @Test
    void testTrapSamplingIsSeeded() {
        var sampling = new MetricsComputer(solver, MetricsConfig.defaultConfig()
                                                                .withTrapSamples(2)
                                                                .withTrapNodes(500_000)
                                                                .withTrapMillis(60_000));
        var path = solver.solveWithPath(TRAPPY, SolverBudget.background(), true).path();
        for (long seed = 0; seed < 10; seed++) {
            assertEquals(sampling.computeTrapScore(TRAPPY, path, seed), sampling.computeTrapScore(TRAPPY, path, seed));
        }
    }
}
