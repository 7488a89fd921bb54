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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MoveTest {

    @Test
    void testPackedFieldsAreIndependent() {
        var move = new Move(8, 3, 5);
        assertEquals(move, Move.unpack(move.packed()));
        assertEquals(Move.unpack(new Move(0, 0, 1).packed()), new Move(0, 0, 1));
        assertNotEquals(new Move(1, 2, 3).packed(), new Move(2, 1, 3).packed());
    }

    @Test
    void testRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new Move(-1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new Move(0, 256, 1));
    }

    @Test
    void testToString() {
        assertEquals("(2->0 x3)", new Move(2, 0, 3).toString());
    }
}
