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

/**
 * A pour of {@code amount} units from bottle {@code source} into bottle {@code target}, both addressed by index.
 *
 * @author hal.hildebrand
 */
public record Move(int source, int target, int amount) {

    private static final int FIELD_MASK = 0xFF;

    public Move {
        if (source < 0 || source > FIELD_MASK || target < 0 || target > FIELD_MASK) {
            throw new IllegalArgumentException("Bottle index out of range: " + source + " -> " + target);
        }
        if (amount < 0 || amount > FIELD_MASK) {
            throw new IllegalArgumentException("Amount out of range: " + amount);
        }
    }

    public static Move unpack(int packed) {
        return new Move(packed & FIELD_MASK, (packed >>> 8) & FIELD_MASK, (packed >>> 16) & FIELD_MASK);
    }

    /**
     * @return the move as a single int: source in bits 0-7, target in bits 8-15, amount in bits 16-23
     */
    public int packed() {
        return source | (target << 8) | (amount << 16);
    }

    @Override
    public String toString() {
        return "(" + source + "->" + target + " x" + amount + ")";
    }
}
