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

/**
 * Thrown when no acceptable level could be produced within the attempt limits, fallback included.
 *
 * @author hal.hildebrand
 */
public class GenerationException extends Exception {

    private final int    levelIndex;
    private final long   seed;
    private final String lastRejectReason;

    /**
     * @param levelIndex       the level requested
     * @param seed             the seed requested
     * @param lastRejectReason why the final candidate was rejected
     */
    public GenerationException(int levelIndex, long seed, String lastRejectReason) {
        super("Failed to generate level " + levelIndex + " from seed " + seed + " (" + lastRejectReason + ")");
        this.levelIndex = levelIndex;
        this.seed = seed;
        this.lastRejectReason = lastRejectReason;
    }

    /**
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public GenerationException(String message, Throwable cause) {
        super(message, cause);
        this.levelIndex = 0;
        this.seed = 0L;
        this.lastRejectReason = message;
    }

    public String lastRejectReason() {
        return lastRejectReason;
    }

    public int levelIndex() {
        return levelIndex;
    }

    public long seed() {
        return seed;
    }
}
