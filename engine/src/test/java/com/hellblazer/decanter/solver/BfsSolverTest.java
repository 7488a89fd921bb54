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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BfsSolverTest {

    private static final int  NODES  = 500_000;
    private static final long MILLIS = 60_000;

    private final BfsSolver solver = new BfsSolver();

    @Test
    void testAlreadyWonNeedsNoMoves() {
        var result = solver.solveWithPath(PuzzleState.parse("[RR|__]"), NODES, MILLIS, true);
        assertEquals(SolverStatus.SOLVED, result.status());
        assertEquals(0, result.optimalMoves());
        assertTrue(result.path().isEmpty());
    }

    @Test
    void testBudgetExhaustion() {
        var state = PuzzleState.parse("[RBGR|GBRB|BGRG|____|____]");
        var result = solver.solve(state, 2, MILLIS);
        assertEquals(SolverStatus.BUDGET_EXHAUSTED, result.status());
        assertEquals(SolverResult.UNKNOWN, result.optimalMoves());
        assertFalse(result.isSolved());
    }

    @Test
    void testDepthOnlyMatchesPathMode() {
        var state = PuzzleState.parse("[RBGR|GBRB|BGRG|____|____]");
        var depthOnly = solver.solve(state, NODES, MILLIS);
        var withPath = solver.solveWithPath(state, NODES, MILLIS, true);
        assertTrue(depthOnly.isSolved());
        assertEquals(withPath.optimalMoves(), depthOnly.optimalMoves());
        assertTrue(depthOnly.path().isEmpty());
        assertEquals(withPath.optimalMoves(), withPath.path().size());
    }

    @Test
    void testInvalidInput() {
        assertThrows(NullPointerException.class, () -> solver.solve(null, NODES, MILLIS));
        var state = PuzzleState.parse("[RB|BR|__]");
        assertThrows(IllegalArgumentException.class, () -> solver.solve(state, 0, MILLIS));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(state, NODES, 0));
        assertThrows(NullPointerException.class, () -> solver.solve(state, (SolverBudget) null));
    }

    @Test
    void testNoOutgoingMovesIsUnsolvable() {
        var result = solver.solve(PuzzleState.parse("[RB|BR]"), NODES, MILLIS);
        assertEquals(SolverStatus.UNSOLVABLE, result.status());
        assertEquals(-1, result.optimalMoves());
        assertEquals(1, result.nodesExplored());
    }

    @ParameterizedTest
    @CsvSource({ "'[RB|BR|__]',3", "'[R_|R_]',1", "'[RR_|R__]',1", "'[RB_|BR_|___]',3", "'[BR|B_|*__]',2",
                 "'[RRB|B__|___]',1", "'[RBR|BRB|___]',5" })
    void testOptimalDepths(String notation, int expected) {
        var state = PuzzleState.parse(notation);
        var result = solver.solveWithPath(state, NODES, MILLIS, true);
        assertTrue(result.isSolved(), notation);
        assertEquals(expected, result.optimalMoves(), notation);
        assertReplaysToWin(state, result);
    }

    @Test
    void testPathRoundTrip() {
        for (var notation : List.of("[RBGR|GBRB|BGRG|____|____]", "[RGB_|BRG_|GBR_|____]",
                                    "[RBB_|GRG_|BGR_|*___|___]")) {
            var state = PuzzleState.parse(notation);
            var result = solver.solveWithPath(state, SolverBudget.background(), true);
            assertTrue(result.isSolved(), notation);
            assertReplaysToWin(state, result);
        }
    }

    @Test
    void testWholeSolvedPoursIntoEmptyExcludedFromSearch() {
        var state = PuzzleState.parse("[RR__|____|BRB_]");
        var moves = BfsSolver.searchMoves(state, true);
        assertFalse(moves.contains(new Move(0, 1, 2)), "solved bottle poured into an identical empty one");
        assertTrue(moves.contains(new Move(2, 1, 1)));
        assertEquals(0, BfsSolver.searchPourAmount(PuzzleState.parse("[RR__|_____]"), 0, 1, true),
                     "larger empty target");
        assertEquals(0, BfsSolver.searchPourAmount(PuzzleState.parse("[RR__|__]"), 0, 1, true),
                     "smaller empty target");
        assertEquals(0, BfsSolver.searchPourAmount(PuzzleState.parse("[RR__|*____]"), 0, 1, true), "empty sink");
        assertEquals(1, BfsSolver.searchPourAmount(PuzzleState.parse("[BR__|____]"), 0, 1, true),
                     "mixed bottle may split onto an empty one");
        assertEquals(2, BfsSolver.searchPourAmount(PuzzleState.parse("[RR__|R___]"), 0, 1, true));
    }

    @ParameterizedTest
    @CsvSource({ "'[__|GR__|BRR_|RR]'", "'[R__|RGGR|G_|B__]'" })
    void testOnlyWholeSolvedPoursIntoEmptyIsUnsolvable(String notation) {
        var result = solver.solveWithPath(PuzzleState.parse(notation), NODES, MILLIS, true);
        assertEquals(SolverStatus.UNSOLVABLE, result.status(), notation);
        assertEquals(-1, result.optimalMoves());
        assertTrue(result.path().isEmpty());
    }

    @Test
    void testSingleMoveScenario() {
        var state = PuzzleState.parse("[R_|R_]");
        var result = solver.solveWithPath(state, NODES, MILLIS, true);
        assertEquals(1, result.optimalMoves());
        assertEquals(List.of(new Move(0, 1, 1)), result.path());
        var end = state.tryApplyMove(0, 1).state();
        assertEquals("[__|RR]", end.toString());
        assertTrue(end.isWin());
    }

    @Test
    void testSinkMovesToggle() {
        var state = PuzzleState.parse("[BR|B_|*__]");
        var withSinks = solver.solveWithPath(state, NODES, MILLIS, true);
        assertEquals(2, withSinks.optimalMoves());
        assertEquals(new Move(0, 2, 1), withSinks.path().get(0));

        var withoutSinks = solver.solveWithPath(state, NODES, MILLIS, false);
        assertEquals(SolverStatus.UNSOLVABLE, withoutSinks.status());
        assertTrue(BfsSolver.searchMoves(state, false).isEmpty());
    }

    @Test
    void testUsesBudgetPresets() {
        var result = solver.solve(PuzzleState.parse("[RB|BR|__]"), SolverBudget.interactive());
        assertEquals(3, result.optimalMoves());
    }

    private static void assertReplaysToWin(PuzzleState state, SolverResult result) {
        assertEquals(result.optimalMoves(), result.path().size());
        var current = state;
        for (var move : result.path()) {
            var applied = current.tryApplyMove(move.source(), move.target());
            assertTrue(applied.applied(), "illegal path move " + move + " on " + current);
            assertEquals(move.amount(), applied.poured());
            current = applied.state();
        }
        assertTrue(current.isWin(), "path ends in " + current);
    }
}
