/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.chord;

import ai.evacortex.chordfield.core.exceptions.InvalidGridPositionException;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.Objects;

/**
 * Maps positions of the 8×8 chord grid to chords.
 *
 * <p>Columns 0–6 are the diatonic degrees of the mode transposed to the key. Column 7 is the
 * chromatic column, a semitone above the key (♭II) unless an override root is given.</p>
 *
 * <p>Rows 0–6 carry fixed qualities: maj7, min7, dom7, ø7, maj9, min9, dom9. Row 7 derives its
 * quality from the natural triad at the column's degree so that it always yields a plausible
 * tension chord:</p>
 * <ul>
 *     <li>major degree → sus2</li>
 *     <li>minor degree → dim7</li>
 *     <li>diminished degree or chromatic column → 7alt</li>
 *     <li>anything else → sus4</li>
 * </ul>
 */
public final class GridChordResolver {

    public static final int ROWS = 8;
    public static final int COLUMNS = 8;
    public static final int CHROMATIC_COLUMN = 7;
    public static final int CONTEXT_ROW = 7;

    private static final ChordQuality[] ROW_QUALITIES = {
            ChordQuality.MAJ7,
            ChordQuality.MIN7,
            ChordQuality.DOM7,
            ChordQuality.HALFDIM7,
            ChordQuality.MAJ9,
            ChordQuality.MIN9,
            ChordQuality.DOM9,
    };

    private GridChordResolver() {}

    /**
     * Root pitch class of each of the eight columns.
     *
     * @param chromaticOverride root of the chromatic column, or {@code null} for ♭II
     */
    public static int[] columnRoots(int key, Mode mode, Integer chromaticOverride) {
        Objects.requireNonNull(mode, "mode must not be null");
        int[] roots = new int[COLUMNS];
        for (int deg = 0; deg < Mode.DEGREES; deg++) {
            roots[deg] = mode.degreeRoot(key, deg);
        }
        roots[CHROMATIC_COLUMN] = chromaticOverride != null
                ? PitchClass.of(chromaticOverride)
                : PitchClass.of(key + 1);
        return roots;
    }

    public static ChordQuality qualityFor(int row, int column, Mode mode) {
        checkPosition(row, column);
        if (row < CONTEXT_ROW) return ROW_QUALITIES[row];
        return contextRowQuality(column, mode);
    }

    static ChordQuality contextRowQuality(int column, Mode mode) {
        if (column >= CHROMATIC_COLUMN) return ChordQuality.DOM7ALT;
        return switch (mode.triad(column)) {
            case MAJ -> ChordQuality.SUS2;
            case MIN -> ChordQuality.DIM7;
            case DIM -> ChordQuality.DOM7ALT;
            default -> ChordQuality.SUS4;
        };
    }

    /**
     * Resolves a grid cell to its chord.
     *
     * @throws InvalidGridPositionException if row or column is outside 0–7
     */
    public static ChordDescriptor resolve(int row, int column, int key, Mode mode, Integer chromaticOverride) {
        checkPosition(row, column);
        int root = columnRoots(key, mode, chromaticOverride)[column];
        return new ChordDescriptor(root, qualityFor(row, column, mode));
    }

    /**
     * @throws InvalidGridPositionException if the row or column lies outside 0–7
     */
    public static void checkPosition(int row, int column) {
        if (row < 0 || row >= ROWS || column < 0 || column >= COLUMNS) {
            throw new InvalidGridPositionException(row, column);
        }
    }
}
