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

import com.hellblazer.decanter.model.PuzzleState;

import java.util.Optional;

/**
 * A playable start is not already won and offers at least one legal move.
 *
 * @author hal.hildebrand
 */
public final class LevelStartValidator {

    private LevelStartValidator() {
    }

    public static boolean isPlayable(PuzzleState state) {
        return validate(state).isEmpty();
    }

    public static Optional<String> validate(PuzzleState state) {
        if (state == null) {
            return Optional.of("State is null");
        }
        if (state.isWin()) {
            return Optional.of("State is already solved");
        }
        if (!MoveRules.hasAnyLegalMove(state)) {
            return Optional.of("State has no legal opening moves");
        }
        return Optional.empty();
    }
}
