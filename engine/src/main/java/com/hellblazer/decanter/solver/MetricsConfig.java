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
 * Budgets and caps for {@link MetricsComputer}.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class MetricsConfig {

    /** Default number of non-optimal opening moves probed for traps */
    public static final int DEFAULT_TRAP_SAMPLES = 15;

    /** Default node budget of each trap probe */
    public static final int DEFAULT_TRAP_NODES = 2_000;

    /** Default time budget of each trap probe */
    public static final long DEFAULT_TRAP_MILLIS = 100;

    /** Default cap on counted solutions */
    public static final int DEFAULT_MULTIPLICITY_CAP = 3;

    /** Default extra moves over optimal still counted as a solution */
    public static final int DEFAULT_NEAR_OPTIMAL_MARGIN = 1;

    /** Largest near-optimal margin accepted */
    public static final int MAX_NEAR_OPTIMAL_MARGIN = 2;

    /** Default node budget of the multiplicity search */
    public static final int DEFAULT_MULTIPLICITY_NODES = 5_000;

    private final int  trapSamples;
    private final int  trapNodes;
    private final long trapMillis;
    private final int  multiplicityCap;
    private final int  nearOptimalMargin;
    private final int  multiplicityNodes;

    /**
     * @throws IllegalArgumentException if a budget is not positive or the margin is outside [0, 2]
     */
    public MetricsConfig(int trapSamples, int trapNodes, long trapMillis, int multiplicityCap, int nearOptimalMargin,
                         int multiplicityNodes) {
        if (trapSamples < 0) {
            throw new IllegalArgumentException("trapSamples must be non-negative: " + trapSamples);
        }
        if (trapNodes <= 0) {
            throw new IllegalArgumentException("trapNodes must be positive: " + trapNodes);
        }
        if (trapMillis <= 0) {
            throw new IllegalArgumentException("trapMillis must be positive: " + trapMillis);
        }
        if (multiplicityCap < 1) {
            throw new IllegalArgumentException("multiplicityCap must be at least 1: " + multiplicityCap);
        }
        if (nearOptimalMargin < 0 || nearOptimalMargin > MAX_NEAR_OPTIMAL_MARGIN) {
            throw new IllegalArgumentException(
            "nearOptimalMargin must be between 0 and " + MAX_NEAR_OPTIMAL_MARGIN + ": " + nearOptimalMargin);
        }
        if (multiplicityNodes <= 0) {
            throw new IllegalArgumentException("multiplicityNodes must be positive: " + multiplicityNodes);
        }
        this.trapSamples = trapSamples;
        this.trapNodes = trapNodes;
        this.trapMillis = trapMillis;
        this.multiplicityCap = multiplicityCap;
        this.nearOptimalMargin = nearOptimalMargin;
        this.multiplicityNodes = multiplicityNodes;
    }

    public static MetricsConfig defaultConfig() {
        return new MetricsConfig(DEFAULT_TRAP_SAMPLES, DEFAULT_TRAP_NODES, DEFAULT_TRAP_MILLIS,
                                 DEFAULT_MULTIPLICITY_CAP, DEFAULT_NEAR_OPTIMAL_MARGIN, DEFAULT_MULTIPLICITY_NODES);
    }

    public int multiplicityCap() {
        return multiplicityCap;
    }

    public int multiplicityNodes() {
        return multiplicityNodes;
    }

    public int nearOptimalMargin() {
        return nearOptimalMargin;
    }

    public long trapMillis() {
        return trapMillis;
    }

    public int trapNodes() {
        return trapNodes;
    }

    public int trapSamples() {
        return trapSamples;
    }

    public MetricsConfig withMultiplicityCap(int cap) {
        return new MetricsConfig(trapSamples, trapNodes, trapMillis, cap, nearOptimalMargin, multiplicityNodes);
    }

    public MetricsConfig withNearOptimalMargin(int margin) {
        return new MetricsConfig(trapSamples, trapNodes, trapMillis, multiplicityCap, margin, multiplicityNodes);
    }

    public MetricsConfig withMultiplicityNodes(int nodes) {
        return new MetricsConfig(trapSamples, trapNodes, trapMillis, multiplicityCap, nearOptimalMargin, nodes);
    }

    public MetricsConfig withTrapMillis(long millis) {
        return new MetricsConfig(trapSamples, trapNodes, millis, multiplicityCap, nearOptimalMargin,
                                 multiplicityNodes);
    }

    public MetricsConfig withTrapNodes(int nodes) {
        return new MetricsConfig(trapSamples, nodes, trapMillis, multiplicityCap, nearOptimalMargin,
                                 multiplicityNodes);
    }

    public MetricsConfig withTrapSamples(int samples) {
        return new MetricsConfig(samples, trapNodes, trapMillis, multiplicityCap, nearOptimalMargin,
                                 multiplicityNodes);
    }

    @Override
    public String toString() {
        return String.format(
        "MetricsConfig[trapSamples=%d, trapNodes=%d, trapMillis=%d, multiplicityCap=%d, margin=%d, multiplicityNodes=%d]",
        trapSamples, trapNodes, trapMillis, multiplicityCap, nearOptimalMargin, multiplicityNodes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (MetricsConfig) obj;
        return trapSamples == other.trapSamples && trapNodes == other.trapNodes && trapMillis == other.trapMillis
        && multiplicityCap == other.multiplicityCap && nearOptimalMargin == other.nearOptimalMargin
        && multiplicityNodes == other.multiplicityNodes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trapSamples, trapNodes, trapMillis, multiplicityCap, nearOptimalMargin, multiplicityNodes);
    }
}
