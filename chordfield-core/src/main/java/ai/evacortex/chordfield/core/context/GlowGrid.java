/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

import ai.evacortex.chordfield.core.chord.GridChordResolver;
import ai.evacortex.chordfield.core.chord.GridLayout;

import java.util.Arrays;

/**
 * Harmonic-distance heat map over the 64 grid cells. Each level is the number of pitch classes
 * a cell shares with the reference chord, capped at {@value #MAX_LEVEL}.
 */
public final class GlowGrid {

    public static final int MAX_LEVEL = 3;

    public static final GlowGrid DARK = new GlowGrid(new int[GridLayout.CELLS]);

    private final int[] levels;

    GlowGrid(int[] levels) {
        if (levels.length != GridLayout.CELLS) {
            throw new IllegalArgumentException("expected " + GridLayout.CELLS + " levels, got " + levels.length);
        }
        this.levels = levels;
    }

    public int level(int row, int column) {
        GridChordResolver.checkPosition(row, column);
        return levels[row * GridChordResolver.COLUMNS + column];
    }

    public int level(int index) {
        return levels[index];
    }

    public int[] levels() {
        return levels.clone();
    }

    public boolean isDark() {
        for (int l : levels) {
            if (l != 0) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof GlowGrid && Arrays.equals(levels, ((GlowGrid) o).levels));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(levels);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GlowGrid[");
        for (int row = 0; row < GridChordResolver.ROWS; row++) {
            if (row > 0) sb.append('|');
            for (int col = 0; col < GridChordResolver.COLUMNS; col++) {
                sb.append(levels[row * GridChordResolver.COLUMNS + col]);
            }
        }
        return sb.append(']').toString();
    }
}
