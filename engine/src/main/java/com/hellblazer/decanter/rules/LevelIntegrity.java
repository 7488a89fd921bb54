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
import com.hellblazer.decanter.model.PuzzleState;

import java.util.Map;
import java.util.Optional;

/**
 * Structural checks a generated level must pass before it is handed out.
 * <ul>
 * <li>there is at least one bottle, and at least one that is not a sink</li>
 * <li>each color's volume equals the capacity of some non-sink bottle, so it can be gathered in one place</li>
 * <li>sinks hold at most one color, since they can never be poured from</li>
 * <li>a full sink holds exactly the whole volume of its color</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public final class LevelIntegrity {

    private LevelIntegrity() {
    }

    /**
     * @return the first violation found, or empty when the state is sound
     */
    public static Optional<String> validate(PuzzleState state) {
        if (state == null) {
            return Optional.of("State is null");
        }
        if (state.bottleCount() == 0) {
            return Optional.of("State has no bottles");
        }
        if (state.bottles().stream().allMatch(b -> b.isSink())) {
            return Optional.of("State has no non-sink bottle");
        }
        var volumes = state.colorVolumes();
        for (Map.Entry<ColorId, Integer> entry : volumes.entrySet()) {
            int volume = entry.getValue();
            boolean fits = state.bottles().stream().anyMatch(b -> !b.isSink() && b.capacity() == volume);
            if (!fits) {
                return Optional.of("No non-sink bottle can contain color " + entry.getKey() + " volume " + volume);
            }
        }
        for (int i = 0; i < state.bottleCount(); i++) {
            var bottle = state.bottle(i);
            if (!bottle.isSink()) {
                continue;
            }
            if (!bottle.isSingleColorOrEmpty()) {
                return Optional.of("Sink bottle " + i + " has mixed colors");
            }
            if (bottle.isSealed() && volumes.get(bottle.topColor()) != bottle.capacity()) {
                return Optional.of("Sink bottle " + i + " seals part of color " + bottle.topColor());
            }
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalStateException describing the first violation
     */
    public static void validateOrThrow(PuzzleState state) {
        validate(state).ifPresent(error -> {
            throw new IllegalStateException(error);
        });
    }
}
