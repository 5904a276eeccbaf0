/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.chord;

import ai.evacortex.chordfield.core.theory.Mode;

/**
 * All 64 chords of the grid for one (key, mode, chromatic override) combination,
 * stored row-major.
 */
public final class GridLayout {

    public static final int CELLS = GridChordResolver.ROWS * GridChordResolver.COLUMNS;

    private final ChordDescriptor[] cells;

    private GridLayout(ChordDescriptor[] cells) {
        this.cells = cells;
    }

    public static GridLayout build(int key, Mode mode, Integer chromaticOverride) {
        ChordDescriptor[] cells = new ChordDescriptor[CELLS];
        for (int row = 0; row < GridChordResolver.ROWS; row++) {
            for (int col = 0; col < GridChordResolver.COLUMNS; col++) {
                cells[row * GridChordResolver.COLUMNS + col] =
                        GridChordResolver.resolve(row, col, key, mode, chromaticOverride);
            }
        }
        return new GridLayout(cells);
    }

    public ChordDescriptor chordAt(int row, int column) {
        GridChordResolver.checkPosition(row, column);
        return cells[row * GridChordResolver.COLUMNS + column];
    }

    public ChordDescriptor cell(int index) {
        return cells[index];
    }
}
