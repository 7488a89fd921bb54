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

import java.util.Optional;

/**
 * Non-throwing result of {@link LevelGenerator#tryGenerate}: either a level or the reason none was produced.
 *
 * @author hal.hildebrand
 */
public sealed interface GenerationOutcome {

    static GenerationOutcome failure(int levelIndex, long seed, String reason) {
        return new Failure(levelIndex, seed, reason);
    }

    static GenerationOutcome success(GeneratedLevel level) {
        return new Success(level);
    }

    default Optional<GeneratedLevel> level() {
        return this instanceof Success success ? Optional.of(success.generated()) : Optional.empty();
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return the level
     * @throws GenerationException describing the failure
     */
    default GeneratedLevel orElseThrow() throws GenerationException {
        if (this instanceof Success success) {
            return success.generated();
        }
        var failure = (Failure) this;
        throw new GenerationException(failure.levelIndex(), failure.seed(), failure.reason());
    }

    record Success(GeneratedLevel generated) implements GenerationOutcome {
    }

    record Failure(int levelIndex, long seed, String reason) implements GenerationOutcome {
    }
}
