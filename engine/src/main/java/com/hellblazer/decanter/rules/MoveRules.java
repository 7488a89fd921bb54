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

import com.hellblazer.decanter.model.Bottle;
import com.hellblazer.decanter.model.Move;
import com.hellblazer.decanter.model.PuzzleState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward move legality.
 *
 * @author hal.hildebrand
 */
public final class MoveRules {

    private MoveRules() {
    }

    /**
     * Sinks accept pours but are never poured from.
     */
    public static boolean canUseAsSource(Bottle bottle) {
        Objects.requireNonNull(bottle, "bottle");
        return !bottle.isSink();
    }

    public static int countLegalMoves(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        int n = state.bottleCount();
        int count = 0;
        for (int s = 0; s < n; s++) {
            for (int t = 0; t < n; t++) {
                if (state.pourAmount(s, t) > 0) {
                    count++;
                }
            }
        }
        return count;
    }

    public static boolean hasAnyLegalMove(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        int n = state.bottleCount();
        for (int s = 0; s < n; s++) {
            if (!canUseAsSource(state.bottle(s)) || state.bottle(s).isEmpty()) {
                continue;
            }
            for (int t = 0; t < n; t++) {
                if (state.pourAmount(s, t) > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean isValidMove(PuzzleState state, int source, int target) {
        return pourAmount(state, source, target) > 0;
    }

    /**
     * Every legal move, ordered by source index then target index.
     */
    public static List<Move> legalMoves(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        int n = state.bottleCount();
        var moves = new ArrayList<Move>();
        for (int s = 0; s < n; s++) {
            for (int t = 0; t < n; t++) {
                int amount = state.pourAmount(s, t);
                if (amount > 0) {
                    moves.add(new Move(s, t, amount));
                }
            }
        }
        return moves;
    }

    /**
     * @return the units a pour from {@code source} to {@code target} moves; zero for an illegal move
     */
    public static int pourAmount(PuzzleState state, int source, int target) {
        Objects.requireNonNull(state, "state");
        return state.pourAmount(source, target);
    }
}
