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
 * The liquid colors. Each color has a one letter symbol used by the compact state notation.
 *
 * @author hal.hildebrand
 */
public enum ColorId {
    RED('R'), BLUE('B'), GREEN('G'), YELLOW('Y'), PURPLE('P'), ORANGE('O'), CYAN('C'), MAGENTA('M');

    private static final ColorId[] VALUES = values();

    private final char symbol;

    ColorId(char symbol) {
        this.symbol = symbol;
    }

    /**
     * @param code a slot code as produced by {@link #code()}
     * @return the color, or null for code zero
     */
    public static ColorId fromCode(int code) {
        if (code == 0) {
            return null;
        }
        if (code < 0 || code > VALUES.length) {
            throw new IllegalArgumentException("Invalid color code: " + code);
        }
        return VALUES[code - 1];
    }

    public static ColorId fromSymbol(char symbol) {
        for (var color : VALUES) {
            if (color.symbol == Character.toUpperCase(symbol)) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown color symbol: " + symbol);
    }

    /**
     * Non-zero slot code of this color; zero is reserved for an empty slot.
     */
    public int code() {
        return ordinal() + 1;
    }

    public char symbol() {
        return symbol;
    }
}
