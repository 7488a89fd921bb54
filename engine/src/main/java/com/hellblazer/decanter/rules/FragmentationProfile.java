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
 * How thoroughly a generated level must scatter its colors.
 *
 * @param minAvgFragmentsPerColor average number of separate runs each color is split into
 * @param minFragmentSizeVariance variance of the run lengths
 * @param minMixedBottles         bottles holding more than one color
 *
 * @author hal.hildebrand
 */
public record FragmentationProfile(double minAvgFragmentsPerColor, double minFragmentSizeVariance,
                                   int minMixedBottles) {

    public FragmentationProfile {
        if (minAvgFragmentsPerColor < 1.0) {
            throw new IllegalArgumentException("minAvgFragmentsPerColor must be >= 1: " + minAvgFragmentsPerColor);
        }
        if (minFragmentSizeVariance < 0.0) {
            throw new IllegalArgumentException("minFragmentSizeVariance must be >= 0: " + minFragmentSizeVariance);
        }
        if (minMixedBottles < 0) {
            throw new IllegalArgumentException("minMixedBottles must be >= 0: " + minMixedBottles);
        }
    }
}
