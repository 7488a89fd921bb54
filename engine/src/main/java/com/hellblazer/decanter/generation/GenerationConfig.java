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

import com.hellblazer.decanter.solver.MetricsConfig;
import com.hellblazer.decanter.solver.SolverBudget;

import java.util.Objects;

/**
 * Retry limits, budgets and scoring used by {@link LevelGenerator}.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class GenerationConfig {

    /** Default scrambles compared inside one attempt */
    public static final int DEFAULT_CANDIDATES_PER_ATTEMPT = 3;

    /** Default gated attempts before falling back */
    public static final int DEFAULT_MAX_ATTEMPTS = 12;

    /** Default attempts on the relaxed fallback */
    public static final int DEFAULT_FALLBACK_ATTEMPTS = 6;

    /** Default minimum optimal solution length of a generated level */
    public static final int DEFAULT_MIN_OPTIMAL_MOVES = 2;

    /** Default share of the profile's reverse moves used by the fallback */
    public static final double DEFAULT_FALLBACK_REVERSE_FACTOR = 0.75;

    /** Default number of wholesale-dumpable bottles tolerated next to two or more empties */
    public static final int DEFAULT_CHAIN_RISK_LIMIT = 1;

    private final int                 candidatesPerAttempt;
    private final int                 maxAttempts;
    private final int                 fallbackAttempts;
    private final int                 minOptimalMoves;
    private final double              fallbackReverseFactor;
    private final int                 chainRiskLimit;
    private final SolverBudget        solverBudget;
    private final MetricsConfig       metricsConfig;
    private final DifficultyObjective objective;

    /**
     * @throws IllegalArgumentException if a count is out of range
     */
    public GenerationConfig(int candidatesPerAttempt, int maxAttempts, int fallbackAttempts, int minOptimalMoves,
                            double fallbackReverseFactor, int chainRiskLimit, SolverBudget solverBudget,
                            MetricsConfig metricsConfig, DifficultyObjective objective) {
        Objects.requireNonNull(solverBudget, "solverBudget cannot be null");
        Objects.requireNonNull(metricsConfig, "metricsConfig cannot be null");
        Objects.requireNonNull(objective, "objective cannot be null");
        if (candidatesPerAttempt <= 0) {
            throw new IllegalArgumentException("candidatesPerAttempt must be positive: " + candidatesPerAttempt);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (fallbackAttempts < 0) {
            throw new IllegalArgumentException("fallbackAttempts must be non-negative: " + fallbackAttempts);
        }
        if (minOptimalMoves < 1) {
            throw new IllegalArgumentException("minOptimalMoves must be at least 1: " + minOptimalMoves);
        }
        if (fallbackReverseFactor <= 0.0 || fallbackReverseFactor > 1.0) {
            throw new IllegalArgumentException(
            "fallbackReverseFactor must be in (0.0, 1.0]: " + fallbackReverseFactor);
        }
        if (chainRiskLimit < 0) {
            throw new IllegalArgumentException("chainRiskLimit must be non-negative: " + chainRiskLimit);
        }
        this.candidatesPerAttempt = candidatesPerAttempt;
        this.maxAttempts = maxAttempts;
        this.fallbackAttempts = fallbackAttempts;
        this.minOptimalMoves = minOptimalMoves;
        this.fallbackReverseFactor = fallbackReverseFactor;
        this.chainRiskLimit = chainRiskLimit;
        this.solverBudget = solverBudget;
        this.metricsConfig = metricsConfig;
        this.objective = objective;
    }

    public static GenerationConfig defaultConfig() {
        return new GenerationConfig(DEFAULT_CANDIDATES_PER_ATTEMPT, DEFAULT_MAX_ATTEMPTS, DEFAULT_FALLBACK_ATTEMPTS,
                                    DEFAULT_MIN_OPTIMAL_MOVES, DEFAULT_FALLBACK_REVERSE_FACTOR,
                                    DEFAULT_CHAIN_RISK_LIMIT, SolverBudget.generation(),
                                    MetricsConfig.defaultConfig(), DifficultyObjective.defaults());
    }

    public int candidatesPerAttempt() {
        return candidatesPerAttempt;
    }

    public int chainRiskLimit() {
        return chainRiskLimit;
    }

    public int fallbackAttempts() {
        return fallbackAttempts;
    }

    public double fallbackReverseFactor() {
        return fallbackReverseFactor;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public MetricsConfig metricsConfig() {
        return metricsConfig;
    }

    public int minOptimalMoves() {
        return minOptimalMoves;
    }

    public DifficultyObjective objective() {
        return objective;
    }

    public SolverBudget solverBudget() {
        return solverBudget;
    }

    public GenerationConfig withCandidatesPerAttempt(int candidates) {
        return new GenerationConfig(candidates, maxAttempts, fallbackAttempts, minOptimalMoves, fallbackReverseFactor,
                                    chainRiskLimit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withChainRiskLimit(int limit) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves,
                                    fallbackReverseFactor, limit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withFallbackAttempts(int attempts) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, attempts, minOptimalMoves,
                                    fallbackReverseFactor, chainRiskLimit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withFallbackReverseFactor(double factor) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves, factor,
                                    chainRiskLimit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withMaxAttempts(int attempts) {
        return new GenerationConfig(candidatesPerAttempt, attempts, fallbackAttempts, minOptimalMoves,
                                    fallbackReverseFactor, chainRiskLimit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withMetricsConfig(MetricsConfig config) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves,
                                    fallbackReverseFactor, chainRiskLimit, solverBudget, config, objective);
    }

    public GenerationConfig withMinOptimalMoves(int moves) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, moves, fallbackReverseFactor,
                                    chainRiskLimit, solverBudget, metricsConfig, objective);
    }

    public GenerationConfig withObjective(DifficultyObjective newObjective) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves,
                                    fallbackReverseFactor, chainRiskLimit, solverBudget, metricsConfig, newObjective);
    }

    public GenerationConfig withSolverBudget(SolverBudget budget) {
        return new GenerationConfig(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves,
                                    fallbackReverseFactor, chainRiskLimit, budget, metricsConfig, objective);
    }

    @Override
    public String toString() {
        return String.format(
        "GenerationConfig[candidates=%d, maxAttempts=%d, fallbackAttempts=%d, minOptimal=%d, fallbackReverse=%.2f, chainRisk=%d, %s, %s]",
        candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves, fallbackReverseFactor, chainRiskLimit,
        solverBudget, metricsConfig);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (GenerationConfig) obj;
        return candidatesPerAttempt == other.candidatesPerAttempt && maxAttempts == other.maxAttempts
        && fallbackAttempts == other.fallbackAttempts && minOptimalMoves == other.minOptimalMoves
        && Double.compare(fallbackReverseFactor, other.fallbackReverseFactor) == 0
        && chainRiskLimit == other.chainRiskLimit && solverBudget.equals(other.solverBudget)
        && metricsConfig.equals(other.metricsConfig) && objective.equals(other.objective);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidatesPerAttempt, maxAttempts, fallbackAttempts, minOptimalMoves,
                            fallbackReverseFactor, chainRiskLimit, solverBudget, metricsConfig, objective);
    }
}
