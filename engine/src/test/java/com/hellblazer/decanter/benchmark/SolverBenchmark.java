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
package com.hellblazer.decanter.benchmark;

import com.hellblazer.decanter.model.PuzzleState;
import com.hellblazer.decanter.solver.BfsSolver;
import com.hellblazer.decanter.solver.MetricsComputer;
import com.hellblazer.decanter.solver.SolverResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * Solver and metrics throughput on representative start states.
 *
 * @author hal.hildebrand
 */
@Tag("benchmark")
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class SolverBenchmark {

    @Param({ "[RBGR|GBRB|BGRG|____|____]", "[RGB_|BRG_|GBR_|____]", "[RBB_|GRG_|BGR_|*___|___]",
             "[CCGG__|*____|MMMM|YYY|OOOGGC_|CCC__|BBBBB_|OOBGOO]" })
    private String notation;

    private BfsSolver       solver;
    private MetricsComputer metrics;
    private PuzzleState     state;
    private SolverResult    solution;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder().include(SolverBenchmark.class.getSimpleName()).build();
        new Runner(opt).run();
    }

    @Benchmark
    public Object computeMetrics() {
        return metrics.compute(state, solution, 17L);
    }

    @Test
    public void runBenchmark() throws RunnerException {
        main(new String[0]);
    }

    @Setup
    public void setup() {
        solver = new BfsSolver();
        metrics = new MetricsComputer();
        state = PuzzleState.parse(notation);
        solution = solver.solveWithPath(state, 2_000_000, 60_000, true);
    }

    @Benchmark
    public SolverResult solveDepth() {
        return solver.solve(state, 2_000_000, 60_000);
    }

    @Benchmark
    public SolverResult solveWithPath() {
        return solver.solveWithPath(state, 2_000_000, 60_000, true);
    }
}
