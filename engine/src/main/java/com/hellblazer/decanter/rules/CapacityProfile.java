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

import java.util.Arrays;

/**
 * Bottle size diversity required of a level.
 *
 * @param capacityPool          the capacities bottles may take, sorted ascending and distinct
 * @param minDistinctCapacities how many different capacities the level must use
 * @param minSmallBottles       minimum bottles of capacity {@value #SMALL_CAPACITY} or less
 * @param minLargeBottles       minimum bottles of capacity {@value #LARGE_CAPACITY} or more
 *
 * @author hal.hildebrand
 */
public record CapacityProfile(int[] capacityPool, int minDistinctCapacities, int minSmallBottles,
                              int minLargeBottles) {

    public static final int SMALL_CAPACITY = 3;
    public static final int LARGE_CAPACITY = 6;

    public CapacityProfile {
        if (capacityPool == null || capacityPool.length == 0) {
            throw new IllegalArgumentException("Capacity pool must not be empty");
        }
        capacityPool = capacityPool.clone();
        for (int i = 0; i < capacityPool.length; i++) {
            if (capacityPool[i] <= 0) {
                throw new IllegalArgumentException("Capacities must be positive: " + Arrays.toString(capacityPool));
            }
            if (i > 0 && capacityPool[i] <= capacityPool[i - 1]) {
                throw new IllegalArgumentException(
                "Capacities must be sorted and distinct: " + Arrays.toString(capacityPool));
            }
        }
        if (minDistinctCapacities < 1 || minDistinctCapacities > capacityPool.length) {
            throw new IllegalArgumentException(
            "minDistinctCapacities must be in [1, " + capacityPool.length + "]: " + minDistinctCapacities);
        }
        if (minSmallBottles < 0 || minLargeBottles < 0) {
            throw new IllegalArgumentException(
            "Bottle minimums must be non-negative: " + minSmallBottles + ", " + minLargeBottles);
        }
        if (minSmallBottles > 0 && !isSmall(capacityPool[0])) {
            throw new IllegalArgumentException("Small bottles required but pool has none: " + Arrays.toString(capacityPool));
        }
        if (minLargeBottles > 0 && !isLarge(capacityPool[capacityPool.length - 1])) {
            throw new IllegalArgumentException("Large bottles required but pool has none: " + Arrays.toString(capacityPool));
        }
    }

    public static boolean isLarge(int capacity) {
        return capacity >= LARGE_CAPACITY;
    }

    public static boolean isSmall(int capacity) {
        return capacity <= SMALL_CAPACITY;
    }

    @Override
    public int[] capacityPool() {
        return capacityPool.clone();
    }

    public int maxCapacity() {
        return capacityPool[capacityPool.length - 1];
    }

    public int minCapacity() {
        return capacityPool[0];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CapacityProfile other && Arrays.equals(capacityPool, other.capacityPool)
        && minDistinctCapacities == other.minDistinctCapacities && minSmallBottles == other.minSmallBottles
        && minLargeBottles == other.minLargeBottles;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * Arrays.hashCode(capacityPool) + minDistinctCapacities) + minSmallBottles)
        + minLargeBottles;
    }

    @Override
    public String toString() {
        return String.format("CapacityProfile{pool=%s, distinct=%d, small=%d, large=%d}", Arrays.toString(capacityPool),
                             minDistinctCapacities, minSmallBottles, minLargeBottles);
    }
}
