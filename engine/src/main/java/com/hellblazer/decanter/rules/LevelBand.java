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

/**
 * Coarse difficulty tiers over the effective level.
 *
 * @author hal.hildebrand
 */
public enum LevelBand {
    A(10), B(25), C(50), D(75), E(Integer.MAX_VALUE);

    private final int lastLevel;

    LevelBand(int lastLevel) {
        this.lastLevel = lastLevel;
    }

    /**
     * @param effectiveLevel a level already clamped to the difficulty plateau
     */
    public static LevelBand forLevel(int effectiveLevel) {
        if (effectiveLevel <= 0) {
            throw new IllegalArgumentException("Level must be positive: " + effectiveLevel);
        }
        for (var band : values()) {
            if (effectiveLevel <= band.lastLevel) {
                return band;
            }
        }
        return E;
    }

    public int lastLevel() {
        return lastLevel;
    }
}
