/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.chord;

import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;

/**
 * Display labels for chords, keys and grid columns.
 */
public final class ChordNames {

    private static final String[] ROMAN_UPPER = {"I", "II", "III", "IV", "V", "VI", "VII", "♭II"};
    private static final String[] ROMAN_LOWER = {"i", "ii", "iii", "iv", "v", "vi", "vii", "♭ii"};

    private ChordNames() {}

    public static String chordName(int root, ChordQuality quality) {
        return PitchClass.flatName(root) + quality.suffix();
    }

    public static String keyName(int key) {
        return PitchClass.flatName(key);
    }

    /**
     * Roman-numeral label for a grid column (0–6 diatonic, 7 chromatic).
     * Minor-sounding qualities use lower case.
     */
    public static String romanLabel(int column, ChordQuality quality) {
        if (column < 0 || column >= ROMAN_UPPER.length) {
            throw new IllegalArgumentException("Column out of range: " + column);
        }
        boolean lower = quality.isMinorFamily()
                || quality == ChordQuality.HALFDIM7
                || quality == ChordQuality.DIM7
                || quality == ChordQuality.DIM;
        String numeral = lower ? ROMAN_LOWER[column] : ROMAN_UPPER[column];
        return numeral + romanSuffix(quality);
    }

    private static String romanSuffix(ChordQuality quality) {
        return switch (quality) {
            case MAJ7 -> "Δ7";
            case MIN7, DOM7 -> "7";
            case HALFDIM7 -> "ø7";
            case DIM7 -> "°7";
            case MAJ9 -> "Δ9";
            case MIN9, DOM9 -> "9";
            case DOM7ALT -> "7alt";
            case SUS2 -> "sus2";
            case SUS4 -> "sus4";
            default -> "";
        };
    }
}
