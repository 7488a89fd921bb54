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
package com.hellblazer.decanter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable puzzle instance: the ordered bottles plus the move bookkeeping of a level.
 * <p>
 * Bottles are addressed by index. No operation changes the number of units of any color; moves only redistribute
 * them.
 * <p>
 * Compact notation, used by {@link #toString()} and {@link #parse(String)}: bottles separated by {@code |}, each
 * written bottom to top as color symbols followed by one {@code _} per free slot, with a leading {@code *} for a
 * sink, e.g. {@code [RB_|BR_|*___]}.
 *
 * @author hal.hildebrand
 */
public final class PuzzleState {

    public static final int UNKNOWN_OPTIMAL = -1;

    private final List<Bottle> bottles;
    private final int          movesUsed;
    private final int          movesAllowed;
    private final int          optimalMoves;
    private final int          levelIndex;
    private final long         seed;
    private final int          scrambleMoves;

    /**
     * @param bottles       the bottles, in index order
     * @param movesUsed     moves made so far
     * @param movesAllowed  move allowance, zero when none has been assigned
     * @param optimalMoves  optimal move count from the start, {@link #UNKNOWN_OPTIMAL} when unknown
     * @param levelIndex    the level this state belongs to, zero when not generated
     * @param seed          the generation seed
     * @param scrambleMoves inverse moves applied during generation
     */
    public PuzzleState(List<Bottle> bottles, int movesUsed, int movesAllowed, int optimalMoves, int levelIndex,
                       long seed, int scrambleMoves) {
        Objects.requireNonNull(bottles, "bottles");
        if (movesUsed < 0) {
            throw new IllegalArgumentException("movesUsed must be non-negative: " + movesUsed);
        }
        if (movesAllowed < 0) {
            throw new IllegalArgumentException("movesAllowed must be non-negative: " + movesAllowed);
        }
        if (optimalMoves < UNKNOWN_OPTIMAL) {
            throw new IllegalArgumentException("optimalMoves must be -1 or non-negative: " + optimalMoves);
        }
        if (scrambleMoves < 0) {
            throw new IllegalArgumentException("scrambleMoves must be non-negative: " + scrambleMoves);
        }
        this.bottles = List.copyOf(bottles);
        this.movesUsed = movesUsed;
        this.movesAllowed = movesAllowed;
        this.optimalMoves = optimalMoves;
        this.levelIndex = levelIndex;
        this.seed = seed;
        this.scrambleMoves = scrambleMoves;
    }

    public static PuzzleState of(Bottle... bottles) {
        return of(List.of(bottles));
    }

    public static PuzzleState of(List<Bottle> bottles) {
        return new PuzzleState(bottles, 0, 0, UNKNOWN_OPTIMAL, 0, 0L, 0);
    }

    /**
     * Parse the compact notation produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static PuzzleState parse(String notation) {
        Objects.requireNonNull(notation, "notation");
        var trimmed = notation.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '[' || trimmed.charAt(trimmed.length() - 1) != ']') {
            throw new IllegalArgumentException("Expected [..|..]: " + notation);
        }
        var body = trimmed.substring(1, trimmed.length() - 1);
        var result = new ArrayList<Bottle>();
        for (var token : body.split("\\|", -1)) {
            boolean sink = token.startsWith("*");
            var slotsText = sink ? token.substring(1) : token;
            if (slotsText.isEmpty()) {
                throw new IllegalArgumentException("Bottle without slots in: " + notation);
            }
            var slots = new ColorId[slotsText.length()];
            for (int i = 0; i < slots.length; i++) {
                char c = slotsText.charAt(i);
                slots[i] = c == '_' ? null : ColorId.fromSymbol(c);
            }
            result.add(Bottle.fromSlots(sink, slots));
        }
        return of(result);
    }

    public Bottle bottle(int index) {
        return bottles.get(index);
    }

    public int bottleCount() {
        return bottles.size();
    }

    public List<Bottle> bottles() {
        return bottles;
    }

    /**
     * @return units per color present in the state
     */
    public Map<ColorId, Integer> colorVolumes() {
        var volumes = new int[ColorId.values().length];
        for (var bottle : bottles) {
            bottle.accumulateVolumes(volumes);
        }
        var result = new EnumMap<ColorId, Integer>(ColorId.class);
        for (var color : ColorId.values()) {
            if (volumes[color.ordinal()] > 0) {
                result.put(color, volumes[color.ordinal()]);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PuzzleState other)) {
            return false;
        }
        return movesUsed == other.movesUsed && movesAllowed == other.movesAllowed
        && optimalMoves == other.optimalMoves && levelIndex == other.levelIndex && seed == other.seed
        && scrambleMoves == other.scrambleMoves && bottles.equals(other.bottles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bottles, movesUsed, movesAllowed, optimalMoves, levelIndex, seed, scrambleMoves);
    }

    /**
     * Out of moves without having won. A state without an allowance never fails.
     */
    public boolean isFail() {
        if (movesAllowed == 0) {
            return false;
        }
        return movesUsed >= movesAllowed && !isWin();
    }

    /**
     * Every bottle is empty or single-colored, and no single-colored bottle can be poured whole into another bottle
     * holding only that color. Two same-colored bottles that could be combined are not a finished state.
     */
    public boolean isWin() {
        for (var bottle : bottles) {
            if (!bottle.isSingleColorOrEmpty()) {
                return false;
            }
        }
        for (int s = 0; s < bottles.size(); s++) {
            var source = bottles.get(s);
            if (source.isEmpty() || source.isSink()) {
                continue;
            }
            for (int t = 0; t < bottles.size(); t++) {
                var target = bottles.get(t);
                if (t != s && !target.isEmpty() && target.topCode() == source.topCode()
                && target.freeSpace() >= source.count()) {
                    return false;
                }
            }
        }
        return true;
    }

    public int levelIndex() {
        return levelIndex;
    }

    public int movesAllowed() {
        return movesAllowed;
    }

    public int movesUsed() {
        return movesUsed;
    }

    public int optimalMoves() {
        return optimalMoves;
    }

    /**
     * The number of units a pour from {@code source} into {@code target} moves, zero when the move is illegal
     * (index out of range, same bottle, sink or empty source, full target, or mismatched top colors).
     */
    public int pourAmount(int source, int target) {
        if (source < 0 || target < 0 || source >= bottles.size() || target >= bottles.size() || source == target) {
            return 0;
        }
        return bottles.get(source).maxPourAmountInto(bottles.get(target));
    }

    /**
     * @return a copy with the move counter cleared
     */
    public PuzzleState resetMoves() {
        return withMovesUsed(0);
    }

    public int scrambleMoves() {
        return scrambleMoves;
    }

    public long seed() {
        return seed;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("[");
        for (int i = 0; i < bottles.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(bottles.get(i));
        }
        return sb.append(']').toString();
    }

    /**
     * Pour from {@code source} into {@code target} if legal.
     *
     * @return the resulting state with the move counted, or this state with nothing poured when the move is illegal
     */
    public MoveResult tryApplyMove(int source, int target) {
        int amount = pourAmount(source, target);
        if (amount == 0) {
            return new MoveResult(this, 0);
        }
        var from = bottles.get(source);
        var color = from.topColor();
        var next = new ArrayList<>(bottles);
        next.set(source, from.withTopRemoved(amount));
        next.set(target, bottles.get(target).withPushed(color, amount));
        return new MoveResult(
        new PuzzleState(next, movesUsed + 1, movesAllowed, optimalMoves, levelIndex, seed, scrambleMoves), amount);
    }

    /**
     * Replace the bottles, keeping the bookkeeping.
     */
    public PuzzleState withBottles(List<Bottle> replacement) {
        return new PuzzleState(replacement, movesUsed, movesAllowed, optimalMoves, levelIndex, seed, scrambleMoves);
    }

    public PuzzleState withMovesAllowed(int allowed) {
        return new PuzzleState(bottles, movesUsed, allowed, optimalMoves, levelIndex, seed, scrambleMoves);
    }

    public PuzzleState withMovesUsed(int used) {
        return new PuzzleState(bottles, used, movesAllowed, optimalMoves, levelIndex, seed, scrambleMoves);
    }

    public PuzzleState withOptimalMoves(int optimal) {
        return new PuzzleState(bottles, movesUsed, movesAllowed, optimal, levelIndex, seed, scrambleMoves);
    }

    /**
     * Stamp generation metadata.
     */
    public PuzzleState withOrigin(int level, long originSeed, int scramble) {
        return new PuzzleState(bottles, movesUsed, movesAllowed, optimalMoves, level, originSeed, scramble);
    }
}
