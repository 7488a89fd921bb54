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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.hellblazer.decanter.model.ColorId.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BottleTest {

    @Test
    void testConstructionRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> Bottle.empty(0));
        assertThrows(IllegalArgumentException.class, () -> Bottle.of(2, RED, BLUE, GREEN));
        assertThrows(IllegalArgumentException.class, () -> Bottle.fromSlots(false, RED, null, BLUE));
        assertThrows(IllegalArgumentException.class, () -> Bottle.of(3, RED, null));
    }

    @Test
    void testFragmentCount() {
        assertEquals(0, Bottle.empty(4).fragmentCount());
        assertEquals(1, Bottle.of(4, RED, RED).fragmentCount());
        assertEquals(3, Bottle.of(4, RED, BLUE, BLUE, RED).fragmentCount());
    }

    @Test
    void testFromSlotsKeepsCapacity() {
        var bottle = Bottle.fromSlots(true, GREEN, GREEN, null, null);
        assertEquals(4, bottle.capacity());
        assertEquals(2, bottle.count());
        assertTrue(bottle.isSink());
        assertEquals(Bottle.sink(4, GREEN, GREEN), bottle);
    }

    @Test
    void testQueries() {
        var bottle = Bottle.of(4, RED, BLUE, BLUE);
        assertEquals(3, bottle.count());
        assertEquals(1, bottle.freeSpace());
        assertEquals(BLUE, bottle.topColor());
        assertEquals(2, bottle.contiguousTopCount());
        assertFalse(bottle.isSolved());
        assertFalse(bottle.isSingleColorOrEmpty());
        assertEquals(RED, bottle.slot(0));
        assertNull(bottle.slot(3));
        assertThrows(IndexOutOfBoundsException.class, () -> bottle.slot(4));

        var empty = Bottle.empty(3);
        assertNull(empty.topColor());
        assertEquals(0, empty.contiguousTopCount());
        assertTrue(empty.isSingleColorOrEmpty());
        assertFalse(empty.isSolved());

        var full = Bottle.filled(3, GREEN, false);
        assertTrue(full.isFullSolved());
        assertFalse(full.isSealed());
        assertTrue(Bottle.filled(3, GREEN, true).isSealed());
    }

    @Test
    void testToString() {
        assertEquals("RB__", Bottle.of(4, RED, BLUE).toString());
        assertEquals("*Y__", Bottle.sink(3, YELLOW).toString());
        assertEquals("___", Bottle.empty(3).toString());
    }

    @Test
    void testWithPushedAndRemoved() {
        var bottle = Bottle.of(4, RED, BLUE, BLUE);
        assertSame(bottle, bottle.withTopRemoved(0));
        assertEquals(Bottle.of(4, RED), bottle.withTopRemoved(2));
        assertThrows(IllegalArgumentException.class, () -> bottle.withTopRemoved(3));
        assertEquals(Bottle.of(4, RED, BLUE, BLUE, GREEN), bottle.withPushed(GREEN, 1));
        assertThrows(IllegalArgumentException.class, () -> bottle.withPushed(GREEN, 2));
        assertEquals(Bottle.of(4, RED, BLUE, BLUE), bottle, "bottles are immutable");
    }

    @Nested
    class PourAmount {

        @Test
        void testEmptySourcePoursNothing() {
            assertEquals(0, Bottle.empty(3).maxPourAmountInto(Bottle.empty(3)));
        }

        @Test
        void testFullTargetPoursNothing() {
            assertEquals(0, Bottle.of(2, BLUE).maxPourAmountInto(Bottle.of(2, BLUE, BLUE)));
        }

        @Test
        void testLimitedByFreeSpace() {
            assertEquals(1, Bottle.of(4, RED, BLUE, BLUE).maxPourAmountInto(Bottle.of(3, BLUE, BLUE)));
        }

        @Test
        void testLimitedByTopRun() {
            assertEquals(2, Bottle.of(4, RED, BLUE, BLUE).maxPourAmountInto(Bottle.of(4, BLUE)));
            assertEquals(2, Bottle.of(4, RED, BLUE, BLUE).maxPourAmountInto(Bottle.empty(5)));
        }

        @Test
        void testMismatchedTopPoursNothing() {
            var source = Bottle.of(3, RED, BLUE);
            assertEquals(0, source.maxPourAmountInto(Bottle.of(3, RED)));
            assertFalse(source.canPourInto(Bottle.of(3, RED)));
        }

        @Test
        void testSinkNeverPours() {
            assertEquals(0, Bottle.sink(3, RED).maxPourAmountInto(Bottle.empty(3)));
            assertEquals(1, Bottle.of(3, RED).maxPourAmountInto(Bottle.emptySink(3)));
        }
    }
}
