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

import com.hellblazer.decanter.solver.LevelMetrics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Weighted decision-complexity score in [0, 1] used to pick the best candidate of an attempt.
 * <p>
 * Components, each normalized to [0, 1]: branching {@code (abf - 1) / 2}, trap score, decision
 * {@code 1 / (1 + depth)}, multiplicity {@code (m - 1) / 4}, empty usage {@code 1 - ebur} and forced moves
 * {@code 1 - fmr}. The weighted sum is divided by the total weight.
 *
 * @author hal.hildebrand
 */
public final class DifficultyObjective {

    public static final double DEFAULT_FORCED_WEIGHT = 0.15;

    private final double branching;
    private final double trap;
    private final double decision;
    private final double multiplicity;
    private final double emptyUsage;
    private final double forced;

    public DifficultyObjective(double branching, double trap, double decision, double multiplicity,
                               double emptyUsage, double forced) {
        if (branching < 0 || trap < 0 || decision < 0 || multiplicity < 0 || emptyUsage < 0 || forced < 0) {
            throw new IllegalArgumentException(
            "Weights must be non-negative: " + describe(branching, trap, decision, multiplicity, emptyUsage, forced));
        }
        if (branching + trap + decision + multiplicity + emptyUsage + forced <= 0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
        this.branching = branching;
        this.trap = trap;
        this.decision = decision;
        this.multiplicity = multiplicity;
        this.emptyUsage = emptyUsage;
        this.forced = forced;
    }

    public static DifficultyObjective branchingFocused() {
        return new DifficultyObjective(0.35, 0.20, 0.25, 0.10, 0.10, DEFAULT_FORCED_WEIGHT);
    }

    public static DifficultyObjective defaults() {
        return new DifficultyObjective(0.25, 0.30, 0.20, 0.15, 0.10, DEFAULT_FORCED_WEIGHT);
    }

    public static DifficultyObjective trapFocused() {
        return new DifficultyObjective(0.20, 0.40, 0.15, 0.15, 0.10, DEFAULT_FORCED_WEIGHT);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String describe(double... weights) {
        return Arrays.toString(weights);
    }

    public double score(LevelMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics");
        double sum = branching * clamp01((metrics.averageBranchingFactor() - 1.0) / 2.0)
        + trap * clamp01(metrics.trapScore())
        + decision * (1.0 / (1.0 + Math.max(0, metrics.decisionDepth())))
        + multiplicity * clamp01((metrics.solutionMultiplicity() - 1.0) / 4.0)
        + emptyUsage * clamp01(1.0 - metrics.emptyBottleUsageRatio())
        + forced * clamp01(1.0 - metrics.forcedMoveRatio());
        return clamp01(sum / (branching + trap + decision + multiplicity + emptyUsage + forced));
    }

    @Override
    public String toString() {
        return "DifficultyObjective" + describe(branching, trap, decision, multiplicity, emptyUsage, forced);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (DifficultyObjective) obj;
        return Double.compare(branching, other.branching) == 0 && Double.compare(trap, other.trap) == 0
        && Double.compare(decision, other.decision) == 0 && Double.compare(multiplicity, other.multiplicity) == 0
        && Double.compare(emptyUsage, other.emptyUsage) == 0 && Double.compare(forced, other.forced) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(branching, trap, decision, multiplicity, emptyUsage, forced);
    }
}
