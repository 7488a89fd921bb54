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

import java.util.Objects;

/**
 * Node and wall clock limits for one search.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class SolverBudget {

    /** Live play hints and auto-solve */
    public static final int  INTERACTIVE_NODES  = 200_000;
    public static final long INTERACTIVE_MILLIS = 1_000;

    /** Off the interactive path, e.g. verifying stored levels */
    public static final int  BACKGROUND_NODES  = 2_000_000;
    public static final long BACKGROUND_MILLIS = 10_000;

    /** Solving each generated candidate */
    public static final int  GENERATION_NODES  = 250_000;
    public static final long GENERATION_MILLIS = 2_000;

    /** Reduced searches used by trap sampling */
    public static final int  PROBE_NODES  = 2_000;
    public static final long PROBE_MILLIS = 100;

    private final int  maxNodes;
    private final long maxMillis;

    /**
     * @param maxNodes  maximum distinct states visited
     * @param maxMillis maximum wall clock milliseconds
     * @throws IllegalArgumentException if either limit is not positive
     */
    public SolverBudget(int maxNodes, long maxMillis) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (maxMillis <= 0) {
            throw new IllegalArgumentException("maxMillis must be positive: " + maxMillis);
        }
        this.maxNodes = maxNodes;
        this.maxMillis = maxMillis;
    }

    public static SolverBudget background() {
        return new SolverBudget(BACKGROUND_NODES, BACKGROUND_MILLIS);
    }

    public static SolverBudget generation() {
        return new SolverBudget(GENERATION_NODES, GENERATION_MILLIS);
    }

    public static SolverBudget interactive() {
        return new SolverBudget(INTERACTIVE_NODES, INTERACTIVE_MILLIS);
    }

    public static SolverBudget probe() {
        return new SolverBudget(PROBE_NODES, PROBE_MILLIS);
    }

    public long maxMillis() {
        return maxMillis;
    }

    public int maxNodes() {
        return maxNodes;
    }

    public SolverBudget withMaxMillis(long newMaxMillis) {
        return new SolverBudget(maxNodes, newMaxMillis);
    }

    public SolverBudget withMaxNodes(int newMaxNodes) {
        return new SolverBudget(newMaxNodes, maxMillis);
    }

    @Override
    public String toString() {
        return String.format("SolverBudget[maxNodes=%d, maxMillis=%d]", maxNodes, maxMillis);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (SolverBudget) obj;
        return maxNodes == other.maxNodes && maxMillis == other.maxMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxNodes, maxMillis);
    }
}
