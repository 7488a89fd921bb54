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
package com.hellblazer.decanter.model;

import java.util.Objects;

/**
 * Outcome of {@link PuzzleState#tryApplyMove(int, int)}: the resulting state and the number of units poured. An
 * illegal move pours nothing and returns the original state.
 *
 * @author hal.hildebrand
 */
public record MoveResult(PuzzleState state, int poured) {

    public MoveResult {
        Objects.requireNonNull(state, "state");
    }

    public boolean applied() {
        return poured > 0;
    }
}
