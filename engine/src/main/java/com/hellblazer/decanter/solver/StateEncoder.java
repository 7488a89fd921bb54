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
package com.hellblazer.decanter.solver;

import com.hellblazer.decanter.model.Bottle;
import com.hellblazer.decanter.model.PuzzleState;

import java.util.Arrays;
import java.util.Objects;

/**
 * Keys for visited-state deduplication. Both encodings depend on bottle contents only; move counters and generation
 * metadata are ignored.
 *
 * @author hal.hildebrand
 */
public final class StateEncoder {

    private static final char SEPARATOR   = '|';
    private static final char HEADER_BASE = 0x100;

    private StateEncoder() {
    }

    /**
     * Positional key: two states share it exactly when bottle {@code i} of each is identical for every {@code i}.
     */
    public static String encode(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        var sb = new StringBuilder(state.bottleCount() * 8);
        for (var bottle : state.bottles()) {
            appendSignature(sb, bottle);
            sb.append(SEPARATOR);
        }
        return sb.toString();
    }

    /**
     * Order independent key: the sorted bottle signatures. States that differ only by a permutation of bottles with
     * the same capacity and sink flag share a key, and such states are equally far from a win.
     */
    public static String encodeCanonical(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        int n = state.bottleCount();
        var signatures = new String[n];
        var sb = new StringBuilder(16);
        int length = 0;
        for (int i = 0; i < n; i++) {
            sb.setLength(0);
            appendSignature(sb, state.bottle(i));
            signatures[i] = sb.toString();
            length += signatures[i].length() + 1;
        }
        Arrays.sort(signatures);
        var combined = new StringBuilder(length);
        for (var signature : signatures) {
            combined.append(signature).append(SEPARATOR);
        }
        return combined.toString();
    }

    /**
     * Signature of one bottle: a header char holding capacity and sink flag, then one char per occupied slot.
     */
    static void appendSignature(StringBuilder sb, Bottle bottle) {
        sb.append((char) (HEADER_BASE + (bottle.capacity() << 1) + (bottle.isSink() ? 1 : 0)));
        for (int i = 0; i < bottle.count(); i++) {
            sb.append((char) ('0' + bottle.slotCode(i)));
        }
    }
}
