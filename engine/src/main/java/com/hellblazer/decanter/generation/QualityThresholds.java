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

import com.hellblazer.decanter.rules.LevelBand;

import java.util.Objects;

/**
 * Acceptance limits for generated levels, tightening from band A to band E.
 *
 * @param maxForcedMoveRatio       most states on the optimal line may offer a single move
 * @param maxDecisionDepth         moves before the first real choice
 * @param minBranchingFactor       mean legal moves along the optimal line
 * @param minTrapScore             share of probed wrong openings that must cost extra moves
 * @param minSolutionMultiplicity  distinct near-optimal solutions required
 * @param maxEmptyBottleUsageRatio share of optimal moves that may pour into an empty bottle
 * @param minMixedBottles          bottles holding more than one color
 * @param minDistinctSignatures    distinct bottle contents
 * @param minTopColorVariety       distinct top colors
 * @param checkFragmentation       whether the profile's fragmentation targets apply
 *
 * @author hal.hildebrand
 */
public record QualityThresholds(double maxForcedMoveRatio, int maxDecisionDepth, double minBranchingFactor,
                                double minTrapScore, int minSolutionMultiplicity, double maxEmptyBottleUsageRatio,
                                int minMixedBottles, int minDistinctSignatures, int minTopColorVariety,
                                boolean checkFragmentation) {

    public static QualityThresholds forBand(LevelBand band) {
        Objects.requireNonNull(band, "band");
        return switch (band) {
            case A -> new QualityThresholds(0.70, 4, 1.2, 0.05, 1, 0.80, 1, 2, 1, true);
            case B -> new QualityThresholds(0.60, 3, 1.3, 0.10, 1, 0.70, 2, 3, 2, true);
            case C -> new QualityThresholds(0.55, 2, 1.4, 0.15, 1, 0.60, 2, 3, 2, true);
            case D -> new QualityThresholds(0.50, 2, 1.5, 0.18, 1, 0.55, 3, 4, 3, true);
            case E -> new QualityThresholds(0.45, 2, 1.5, 0.20, 1, 0.50, 3, 4, 3, true);
        };
    }

    /**
     * Limits for the fallback path: any solvable, non-trivial level with some mixing passes.
     */
    public static QualityThresholds relaxed() {
        return new QualityThresholds(1.0, Integer.MAX_VALUE, 1.0, 0.0, 1, 1.0, 1, 2, 1, false);
    }

    @Override
    public String toString() {
        return String.format(
        "QualityThresholds[FMR<=%.2f, DD<=%d, ABF>=%.2f, TS>=%.2f, SM>=%d, EBUR<=%.2f, mixed>=%d, sigs>=%d, tops>=%d]",
        maxForcedMoveRatio, maxDecisionDepth, minBranchingFactor, minTrapScore, minSolutionMultiplicity,
        maxEmptyBottleUsageRatio, minMixedBottles, minDistinctSignatures, minTopColorVariety);
    }
}
