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

import com.hellblazer.decanter.rules.FragmentationProfile;
import com.hellblazer.decanter.solver.LevelMetrics;

import java.util.Objects;

/**
 * Pure accept/reject predicate over {@link LevelMetrics}.
 *
 * @author hal.hildebrand
 */
public final class QualityGate {

    private QualityGate() {
    }

    public static boolean accept(LevelMetrics metrics, QualityThresholds thresholds) {
        return evaluate(metrics, thresholds, null).accepted();
    }

    public static boolean accept(LevelMetrics metrics, QualityThresholds thresholds, FragmentationProfile targets) {
        return evaluate(metrics, thresholds, targets).accepted();
    }

    public static GateVerdict evaluate(LevelMetrics metrics, QualityThresholds thresholds) {
        return evaluate(metrics, thresholds, null);
    }

    /**
     * @param targets fragmentation targets, checked only when the thresholds ask for it; may be null
     */
    public static GateVerdict evaluate(LevelMetrics metrics, QualityThresholds thresholds,
                                       FragmentationProfile targets) {
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(thresholds, "thresholds");
        if (metrics.forcedMoveRatio() > thresholds.maxForcedMoveRatio()) {
            return GateVerdict.reject(
            String.format("forced_move_ratio %.2f > %.2f", metrics.forcedMoveRatio(), thresholds.maxForcedMoveRatio()));
        }
        if (metrics.decisionDepth() > thresholds.maxDecisionDepth()) {
            return GateVerdict.reject(
            "decision_depth " + metrics.decisionDepth() + " > " + thresholds.maxDecisionDepth());
        }
        if (metrics.averageBranchingFactor() < thresholds.minBranchingFactor()) {
            return GateVerdict.reject(String.format("branching_factor %.2f < %.2f", metrics.averageBranchingFactor(),
                                                    thresholds.minBranchingFactor()));
        }
        if (metrics.trapScore() < thresholds.minTrapScore()) {
            return GateVerdict.reject(
            String.format("trap_score %.2f < %.2f", metrics.trapScore(), thresholds.minTrapScore()));
        }
        if (metrics.solutionMultiplicity() < thresholds.minSolutionMultiplicity()) {
            return GateVerdict.reject("solution_multiplicity " + metrics.solutionMultiplicity() + " < "
                                      + thresholds.minSolutionMultiplicity());
        }
        if (metrics.emptyBottleUsageRatio() > thresholds.maxEmptyBottleUsageRatio()) {
            return GateVerdict.reject(String.format("empty_bottle_usage %.2f > %.2f", metrics.emptyBottleUsageRatio(),
                                                    thresholds.maxEmptyBottleUsageRatio()));
        }
        if (metrics.mixedBottleCount() < thresholds.minMixedBottles()) {
            return GateVerdict.reject(
            "mixed_bottles " + metrics.mixedBottleCount() + " < " + thresholds.minMixedBottles());
        }
        if (metrics.distinctSignatureCount() < thresholds.minDistinctSignatures()) {
            return GateVerdict.reject("distinct_signatures " + metrics.distinctSignatureCount() + " < "
                                      + thresholds.minDistinctSignatures());
        }
        if (metrics.topColorVariety() < thresholds.minTopColorVariety()) {
            return GateVerdict.reject(
            "top_color_variety " + metrics.topColorVariety() + " < " + thresholds.minTopColorVariety());
        }
        if (thresholds.checkFragmentation() && targets != null) {
            if (metrics.avgFragmentsPerColor() < targets.minAvgFragmentsPerColor()) {
                return GateVerdict.reject(String.format("fragments_per_color %.2f < %.2f",
                                                        metrics.avgFragmentsPerColor(),
                                                        targets.minAvgFragmentsPerColor()));
            }
            if (metrics.fragmentSizeVariance() < targets.minFragmentSizeVariance()) {
                return GateVerdict.reject(String.format("fragment_variance %.2f < %.2f",
                                                        metrics.fragmentSizeVariance(),
                                                        targets.minFragmentSizeVariance()));
            }
            if (metrics.mixedBottleCount() < targets.minMixedBottles()) {
                return GateVerdict.reject(
                "profile_mixed_bottles " + metrics.mixedBottleCount() + " < " + targets.minMixedBottles());
            }
        }
        return GateVerdict.accept();
    }
}
