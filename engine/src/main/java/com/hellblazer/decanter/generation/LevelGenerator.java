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

import com.hellblazer.decanter.common.DeterministicRandom;
import com.hellblazer.decanter.common.IntArrayList;
import com.hellblazer.decanter.common.SeedMixer;
import com.hellblazer.decanter.model.Bottle;
import com.hellblazer.decanter.model.ColorId;
import com.hellblazer.decanter.model.Move;
import com.hellblazer.decanter.model.PuzzleState;
import com.hellblazer.decanter.rules.CapacityProfile;
import com.hellblazer.decanter.rules.DifficultyProfile;
import com.hellblazer.decanter.rules.LevelIntegrity;
import com.hellblazer.decanter.rules.LevelStartValidator;
import com.hellblazer.decanter.rules.MoveAllowanceCalculator;
import com.hellblazer.decanter.solver.BfsSolver;
import com.hellblazer.decanter.solver.LevelMetrics;
import com.hellblazer.decanter.solver.MetricsComputer;
import com.hellblazer.decanter.solver.SolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds solvable levels by reverse construction.
 * <p>
 * Each attempt lays out a solved configuration matching the profile (every color fills one bottle exactly), then
 * scrambles it with inverse moves: {@code k} units are lifted off the top run of a bottle X and stacked on a non-sink
 * bottle Y such that the forward pour Y to X of exactly {@code k} units is legal afterwards. Every scrambled state can
 * therefore be walked back to the solved one, and the solver only has to find the shortest way.
 * <p>
 * Candidates are checked in order (integrity, playable start, chain risk, solver, target length, quality gate); the
 * best surviving candidate of an attempt, by {@link DifficultyObjective}, is accepted. A candidate whose optimal
 * solution is longer than the profile's target is advanced along that solution until exactly the target remains, then
 * checked again from integrity on. Shorter candidates are discarded, so every level of a profile has the same optimal
 * length. After the attempt ceiling the
 * generator falls back to fewer inverse moves and {@link QualityThresholds#relaxed()}.
 * <p>
 * The output is a pure function of (seed, profile, configuration) as long as no search runs into its time budget.
 * Instances hold no mutable state and may be shared between threads.
 *
 * @author hal.hildebrand
 */
public final class LevelGenerator {

    private static final Logger log = LoggerFactory.getLogger(LevelGenerator.class);

    /** Seed offset between attempts */
    private static final int ATTEMPT_SEED_STRIDE = 7919;
    /** Fewest inverse moves any attempt applies */
    private static final int MIN_SCRAMBLE_MOVES  = 4;

    private final BfsSolver        solver;
    private final MetricsComputer  metricsComputer;
    private final GenerationConfig config;

    public LevelGenerator() {
        this(new BfsSolver(), GenerationConfig.defaultConfig());
    }

    public LevelGenerator(BfsSolver solver, GenerationConfig config) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.config = Objects.requireNonNull(config, "config");
        this.metricsComputer = new MetricsComputer(solver, config.metricsConfig());
    }

    /**
     * Count the single-colored bottles that could be dumped whole into an empty bottle, when two or more non-sink
     * bottles are empty. Such a start lets the player undo the scramble by rote.
     */
    static int chainRisk(PuzzleState state) {
        int empties = 0;
        int widestEmpty = 0;
        for (var bottle : state.bottles()) {
            if (!bottle.isSink() && bottle.isEmpty()) {
                empties++;
                widestEmpty = Math.max(widestEmpty, bottle.capacity());
            }
        }
        if (empties < 2) {
            return 0;
        }
        int dumpable = 0;
        for (var bottle : state.bottles()) {
            if (!bottle.isSink() && bottle.isSolved() && bottle.count() <= widestEmpty) {
                dumpable++;
            }
        }
        return dumpable;
    }

    /**
     * Whether lifting {@code k} units off bottle {@code x} onto bottle {@code y} is a valid inverse move.
     *
     * @param emptyLimit most non-sink bottles allowed to be empty afterwards
     */
    static boolean isValidInverse(List<Bottle> bottles, int x, int y, int k, int emptyLimit) {
        if (x == y || k <= 0) {
            return false;
        }
        var from = bottles.get(x);
        var to = bottles.get(y);
        if (to.isSink() || from.isEmpty()) {
            return false;
        }
        int run = from.contiguousTopCount();
        if (k > run || k > to.freeSpace()) {
            return false;
        }
        // X must again accept the pour: its new top is the same color, or it is empty
        if (k == run && k != from.count()) {
            return false;
        }
        // onto the same color the forward pour would move more than k, unless X was full
        if (!to.isEmpty() && to.topColor() == from.topColor() && !from.isFull()) {
            return false;
        }
        // the forward pour would move a solved bottle whole into an empty one
        if (k == from.count() && to.isEmpty()) {
            return false;
        }
        int empties = 0;
        for (var bottle : bottles) {
            if (!bottle.isSink() && bottle.isEmpty()) {
                empties++;
            }
        }
        if (k == from.count() && !from.isSink()) {
            empties++;
        }
        if (to.isEmpty()) {
            empties--;
        }
        return empties <= emptyLimit;
    }

    /**
     * Lay out the solved configuration: capacities honoring the profile's minimums, one color per filled bottle,
     * required sinks filled with a color, all in a seeded order.
     */
    static List<Bottle> buildSolved(DifficultyProfile profile, DeterministicRandom rng) {
        var capacityProfile = profile.capacityProfile();
        var pool = capacityProfile.capacityPool();
        int regular = profile.regularBottleCount();
        var capacities = new int[regular];
        int k = 0;

        var small = Arrays.stream(pool).filter(CapacityProfile::isSmall).toArray();
        var large = Arrays.stream(pool).filter(CapacityProfile::isLarge).toArray();
        for (int i = 0; i < capacityProfile.minSmallBottles() && k < regular; i++) {
            capacities[k++] = small[rng.nextInt(small.length)];
        }
        for (int i = 0; i < capacityProfile.minLargeBottles() && k < regular; i++) {
            capacities[k++] = large[rng.nextInt(large.length)];
        }
        var used = new HashSet<Integer>();
        for (int i = 0; i < k; i++) {
            used.add(capacities[i]);
        }
        var shuffledPool = pool.clone();
        rng.shuffle(shuffledPool, shuffledPool.length);
        for (int capacity : shuffledPool) {
            if (used.size() >= capacityProfile.minDistinctCapacities() || k >= regular) {
                break;
            }
            if (used.add(capacity)) {
                capacities[k++] = capacity;
            }
        }
        while (k < regular) {
            capacities[k++] = pool[rng.nextInt(pool.length)];
        }
        rng.shuffle(capacities, regular);

        var palette = new int[ColorId.values().length];
        for (int i = 0; i < palette.length; i++) {
            palette[i] = i;
        }
        rng.shuffle(palette, palette.length);

        var bottles = new ArrayList<Bottle>(profile.bottleCount());
        int filledSinks = profile.sinkRequired() ? profile.sinkCount() : 0;
        int colored = profile.colorCount() - filledSinks;
        int color = 0;
        for (int i = 0; i < regular; i++) {
            if (i < colored) {
                bottles.add(Bottle.filled(capacities[i], ColorId.values()[palette[color++]], false));
            } else {
                bottles.add(Bottle.empty(capacities[i]));
            }
        }
        for (int i = 0; i < profile.sinkCount(); i++) {
            if (profile.sinkRequired()) {
                int capacity = capacities[rng.nextInt(regular)];
                bottles.add(Bottle.filled(capacity, ColorId.values()[palette[color++]], true));
            } else {
                bottles.add(Bottle.emptySink(pool[rng.nextInt(pool.length)]));
            }
        }

        var order = new int[bottles.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        rng.shuffle(order, order.length);
        var arranged = new ArrayList<Bottle>(bottles.size());
        for (int index : order) {
            arranged.add(bottles.get(index));
        }
        return arranged;
    }

    public GenerationConfig config() {
        return config;
    }

    /**
     * @throws GenerationException if neither the gated attempts nor the fallback produced a level
     */
    public GeneratedLevel generate(long seed, DifficultyProfile profile) throws GenerationException {
        return tryGenerate(seed, profile).orElseThrow();
    }

    /**
     * Like {@link #generate(long, DifficultyProfile)}, reporting failure as a value.
     */
    public GenerationOutcome tryGenerate(long seed, DifficultyProfile profile) {
        Objects.requireNonNull(profile, "profile");
        var run = new Run(seed, profile, System.nanoTime());

        var gated = QualityThresholds.forBand(profile.band());
        for (int attempt = 0; attempt < config.maxAttempts(); attempt++) {
            int reverse = Math.max(MIN_SCRAMBLE_MOVES, profile.reverseMoveCount() - attempt / 2);
            var best = runAttempt(run, attempt, reverse, gated, true);
            if (best != null) {
                return GenerationOutcome.success(accept(run, best, attempt + 1, true));
            }
        }

        int fallbackReverse = Math.max(MIN_SCRAMBLE_MOVES, (int) Math.round(
        profile.reverseMoveCount() * config.fallbackReverseFactor()));
        log.warn("Level {} seed {}: no candidate passed {} after {} attempts, last rejection: {}; relaxing",
                 profile.levelIndex(), seed, gated, config.maxAttempts(), run.lastReject);
        var relaxed = QualityThresholds.relaxed();
        for (int i = 0; i < config.fallbackAttempts(); i++) {
            int attempt = config.maxAttempts() + i;
            var best = runAttempt(run, attempt, fallbackReverse, relaxed, false);
            if (best != null) {
                return GenerationOutcome.success(accept(run, best, attempt + 1, false));
            }
        }
        log.warn("Level {} seed {}: generation failed after {} attempts, last rejection: {}", profile.levelIndex(),
                 seed, config.maxAttempts() + config.fallbackAttempts(), run.lastReject);
        return GenerationOutcome.failure(profile.levelIndex(), seed, run.lastReject);
    }

    private GeneratedLevel accept(Run run, Candidate best, int attemptsUsed, boolean qualityGated) {
        var profile = run.profile;
        int optimal = best.result.optimalMoves();
        int allowed = MoveAllowanceCalculator.movesAllowed(profile.levelIndex(), optimal);
        var state = new PuzzleState(best.state.bottles(), 0, allowed, optimal, profile.levelIndex(), run.seed,
                                    best.scrambleMoves);
        long totalMillis = (System.nanoTime() - run.startNanos) / 1_000_000L;
        int difficulty = DifficultyScorer.intrinsicDifficulty(best.metrics);
        var report = new LevelGenerationReport(profile.levelIndex(), run.seed, attemptsUsed, best.metrics, optimal,
                                               allowed, best.scrambleMoves, totalMillis,
                                               run.solverNanos / 1_000_000L, run.metricsNanos / 1_000_000L,
                                               difficulty, best.objective, qualityGated, run.lastReject);
        log.info("Level {} seed {}: optimal {} allowed {} scramble {} difficulty {} attempts {}{} in {} ms",
                 profile.levelIndex(), run.seed, optimal, allowed, best.scrambleMoves, difficulty, attemptsUsed,
                 qualityGated ? "" : " (relaxed)", totalMillis);
        return new GeneratedLevel(state, report);
    }

    private Candidate evaluate(Run run, int attempt, int index, PuzzleState scrambled, int applied,
                               QualityThresholds thresholds, boolean gated, long samplingSeed) {
        var profile = run.profile;
        if (applied == 0) {
            return reject(run, attempt, index, "scramble");
        }
        var early = startProblem(scrambled, gated);
        if (early != null) {
            return reject(run, attempt, index, early);
        }

        long solveStart = System.nanoTime();
        var result = solver.solveWithPath(scrambled, config.solverBudget(), true);
        run.solverNanos += System.nanoTime() - solveStart;
        if (!result.isSolved()) {
            return reject(run, attempt, index, "solver " + result.status().name().toLowerCase(Locale.ROOT));
        }
        int optimal = result.optimalMoves();
        int target = profile.targetOptimalMoves();
        if (optimal < target) {
            return reject(run, attempt, index, "optimal " + optimal + " < target " + target);
        }
        var level = scrambled;
        int scrambleMoves = applied;
        if (optimal > target) {
            // any state on an optimal path is solved optimally by the rest of that path
            int surplus = optimal - target;
            var path = result.path();
            for (var move : path.subList(0, surplus)) {
                level = level.tryApplyMove(move.source(), move.target()).state();
            }
            level = level.resetMoves();
            var trimmed = startProblem(level, gated);
            if (trimmed != null) {
                return reject(run, attempt, index, "trimmed " + trimmed);
            }
            result = SolverResult.solved(target, path.subList(surplus, optimal), result.nodesExplored(),
                                         result.elapsedMillis());
            scrambleMoves -= surplus;
        }
        if (target < config.minOptimalMoves()) {
            return reject(run, attempt, index, "min_optimal " + target + " < " + config.minOptimalMoves());
        }

        long metricsStart = System.nanoTime();
        var metrics = metricsComputer.compute(level, result, samplingSeed);
        run.metricsNanos += System.nanoTime() - metricsStart;
        var verdict = QualityGate.evaluate(metrics, thresholds, profile.fragmentationProfile());
        if (!verdict.accepted()) {
            return reject(run, attempt, index, verdict.reason());
        }
        return new Candidate(level, scrambleMoves, result, metrics, config.objective().score(metrics));
    }

    /**
     * Integrity, playable start and, when gated, chain risk.
     *
     * @return the first problem found, or null
     */
    private String startProblem(PuzzleState state, boolean gated) {
        var integrity = LevelIntegrity.validate(state);
        if (integrity.isPresent()) {
            return "integrity: " + integrity.get();
        }
        var start = LevelStartValidator.validate(state);
        if (start.isPresent()) {
            return "start: " + start.get();
        }
        if (gated) {
            int risk = chainRisk(state);
            if (risk > config.chainRiskLimit()) {
                return "chain_risk " + risk + " > " + config.chainRiskLimit();
            }
        }
        return null;
    }

    private Candidate reject(Run run, int attempt, int index, String reason) {
        run.lastReject = reason;
        log.debug("Level {} seed {} attempt {} candidate {} rejected: {}", run.profile.levelIndex(), run.seed, attempt,
                  index, reason);
        return null;
    }

    private Candidate runAttempt(Run run, int attempt, int reverseMoves, QualityThresholds thresholds,
                                 boolean gated) {
        var profile = run.profile;
        var rng = new DeterministicRandom(
        SeedMixer.mix(run.seed + (long) attempt * ATTEMPT_SEED_STRIDE, profile.levelIndex()));
        var solved = buildSolved(profile, rng);
        Candidate best = null;
        for (int c = 0; c < config.candidatesPerAttempt(); c++) {
            var bottles = new ArrayList<>(solved);
            int applied = scramble(bottles, profile.emptyBottleCount(), reverseMoves, rng);
            var scrambled = PuzzleState.of(bottles);
            var candidate = evaluate(run, attempt, c, scrambled, applied, thresholds, gated, rng.nextInt());
            if (candidate != null && (best == null || candidate.objective > best.objective)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Apply up to {@code moves} random inverse moves in place, never undoing the previous one.
     *
     * @return the number applied
     */
    static int scramble(List<Bottle> bottles, int emptyLimit, int moves, DeterministicRandom rng) {
        int applied = 0;
        int guard = Math.max(40, moves * 50);
        int lastSource = -1;
        int lastTarget = -1;
        var candidates = new IntArrayList(64);
        int n = bottles.size();
        while (applied < moves && guard-- > 0) {
            candidates.clear();
            for (int x = 0; x < n; x++) {
                var from = bottles.get(x);
                if (from.isEmpty()) {
                    continue;
                }
                for (int y = 0; y < n; y++) {
                    if (x == lastTarget && y == lastSource) {
                        continue;
                    }
                    int most = Math.min(from.contiguousTopCount(), bottles.get(y).freeSpace());
                    for (int k = 1; k <= most; k++) {
                        if (isValidInverse(bottles, x, y, k, emptyLimit)) {
                            candidates.addInt(new Move(x, y, k).packed());
                        }
                    }
                }
            }
            if (candidates.isEmpty()) {
                break;
            }
            var move = Move.unpack(candidates.getInt(rng.nextInt(candidates.size())));
            var from = bottles.get(move.source());
            var color = from.topColor();
            bottles.set(move.source(), from.withTopRemoved(move.amount()));
            bottles.set(move.target(), bottles.get(move.target()).withPushed(color, move.amount()));
            lastSource = move.source();
            lastTarget = move.target();
            applied++;
        }
        return applied;
    }

    private record Candidate(PuzzleState state, int scrambleMoves, SolverResult result, LevelMetrics metrics,
                             double objective) {
    }

    /**
     * Bookkeeping of one generate call.
     */
    private static final class Run {
        private final long              seed;
        private final DifficultyProfile profile;
        private final long              startNanos;
        private       long              solverNanos;
        private       long              metricsNanos;
        private       String            lastReject;

        private Run(long seed, DifficultyProfile profile, long startNanos) {
            this.seed = seed;
            this.profile = profile;
            this.startNanos = startNanos;
        }
    }
}
